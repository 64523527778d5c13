package me.christianrobert.cnxpretext.transformer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Element of a parsed CNXML document.
 *
 * <p>Mixed content is kept in document order the same way the source stores it:
 * {@link #getText()} is the text before the first child, and every child carries
 * its own {@link #getTail()} - the text following that child which still belongs
 * to this node's content stream.</p>
 *
 * <pre>
 * &lt;para&gt;See &lt;emphasis&gt;this&lt;/emphasis&gt; now.&lt;/para&gt;
 *
 * para        text="See "
 *   emphasis  text="this"  tail=" now."
 * </pre>
 *
 * <p>Instances are immutable once built. Children and attributes are copied on
 * construction and exposed read-only.</p>
 */
public class SourceNode {

    private final String namespaceUri;
    private final String localName;
    private final Map<String, String> attributes;
    private final String text;
    private final List<SourceNode> children;
    private final String tail;

    public SourceNode(String namespaceUri,
                      String localName,
                      Map<String, String> attributes,
                      String text,
                      List<SourceNode> children,
                      String tail) {
        this.namespaceUri = namespaceUri != null ? namespaceUri : "";
        this.localName = localName;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.text = text != null ? text : "";
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        this.tail = tail != null ? tail : "";
    }

    /**
     * Creates a childless element, mostly useful for tests.
     */
    public static SourceNode leaf(String namespaceUri, String localName, String text) {
        return new SourceNode(namespaceUri, localName, Map.of(), text, List.of(), "");
    }

    /**
     * Returns a copy of this node with a different tail text.
     * Used by the parser, which only knows a child's tail after reading its following siblings.
     */
    public SourceNode withTail(String newTail) {
        return new SourceNode(namespaceUri, localName, attributes, text, children, newTail);
    }

    public String getNamespaceUri() {
        return namespaceUri;
    }

    public String getLocalName() {
        return localName;
    }

    public boolean is(String namespace, String name) {
        return namespaceUri.equals(namespace) && localName.equals(name);
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    /**
     * Attribute value, or null when absent.
     */
    public String getAttribute(String name) {
        return attributes.get(name);
    }

    public String getAttribute(String name, String defaultValue) {
        String value = attributes.get(name);
        return value != null ? value : defaultValue;
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    public String getText() {
        return text;
    }

    public List<SourceNode> getChildren() {
        return children;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public String getTail() {
        return tail;
    }

    /**
     * Child at the given position, or empty when the node has fewer children.
     */
    public Optional<SourceNode> childAt(int index) {
        if (index < 0 || index >= children.size()) {
            return Optional.empty();
        }
        return Optional.of(children.get(index));
    }

    /**
     * First direct child with the given qualified name.
     */
    public Optional<SourceNode> findChild(String namespace, String name) {
        for (SourceNode child : children) {
            if (child.is(namespace, name)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /**
     * All direct children with the given qualified name, in document order.
     */
    public List<SourceNode> findChildren(String namespace, String name) {
        List<SourceNode> result = new ArrayList<>();
        for (SourceNode child : children) {
            if (child.is(namespace, name)) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * First descendant (depth-first, document order, excluding this node) with the given name.
     */
    public Optional<SourceNode> findDescendant(String namespace, String name) {
        for (SourceNode child : children) {
            if (child.is(namespace, name)) {
                return Optional.of(child);
            }
            Optional<SourceNode> nested = child.findDescendant(namespace, name);
            if (nested.isPresent()) {
                return nested;
            }
        }
        return Optional.empty();
    }

    /**
     * All descendant text in document order, ignoring markup. Includes the tails of
     * descendants but not this node's own tail.
     */
    public String flattenText() {
        StringBuilder sb = new StringBuilder();
        appendFlattened(sb);
        return sb.toString();
    }

    private void appendFlattened(StringBuilder sb) {
        sb.append(text);
        for (SourceNode child : children) {
            child.appendFlattened(sb);
            sb.append(child.tail);
        }
    }

    @Override
    public String toString() {
        return "SourceNode{" + localName + ", children=" + children.size() + "}";
    }
}
