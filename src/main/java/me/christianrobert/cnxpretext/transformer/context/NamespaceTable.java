package me.christianrobert.cnxpretext.transformer.context;

/**
 * Namespaces of the CNXML source vocabulary.
 * Fixed for the lifetime of the process.
 */
public final class NamespaceTable {

    public static final String CONTENT = "http://cnx.rice.edu/cnxml";
    public static final String MATH = "http://www.w3.org/1998/Math/MathML";
    public static final String METADATA = "http://cnx.rice.edu/mdml";

    /** Declared on PreTeXt chapter and appendix roots. */
    public static final String XINCLUDE = "http://www.w3.org/2001/XInclude";

    private NamespaceTable() {
    }

    public static boolean isContent(String namespaceUri) {
        return CONTENT.equals(namespaceUri);
    }

    public static boolean isMath(String namespaceUri) {
        return MATH.equals(namespaceUri);
    }

    public static boolean isMetadata(String namespaceUri) {
        return METADATA.equals(namespaceUri);
    }
}
