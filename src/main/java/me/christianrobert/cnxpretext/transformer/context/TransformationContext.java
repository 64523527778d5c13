package me.christianrobert.cnxpretext.transformer.context;

/**
 * Context for one recursive conversion call.
 *
 * <p>Instances are immutable: every {@code withX} / {@code nested} method returns a
 * new context, so a callee can never change what its caller sees. Each module
 * conversion starts from {@link #root(String, ConversionOptions)} and the
 * context is discarded with the finished output string.</p>
 *
 * <ul>
 *   <li>{@link #getSectionDepth()} - selects section / subsection / subsubsection tags</li>
 *   <li>{@link #getIndentLevel()} - output formatting only, never semantics</li>
 *   <li>{@link #getMode()} - inline rendering mode (see {@link RenderMode})</li>
 *   <li>{@link #getIdScope()} / {@link #getPosition()} - inputs of the deterministic identifier scheme</li>
 * </ul>
 */
public class TransformationContext {

    private final ConversionOptions options;
    private final int sectionDepth;
    private final int indentLevel;
    private final RenderMode mode;
    private final String idScope;
    private final int position;

    private TransformationContext(ConversionOptions options, int sectionDepth, int indentLevel,
                                  RenderMode mode, String idScope, int position) {
        this.options = options;
        this.sectionDepth = sectionDepth;
        this.indentLevel = indentLevel;
        this.mode = mode;
        this.idScope = idScope;
        this.position = position;
    }

    /**
     * Context for the content root of a module that becomes a top-level section.
     *
     * @param rootId identifier of the emitted section, used as scope for synthesized ids
     * @param options converter settings
     */
    public static TransformationContext root(String rootId, ConversionOptions options) {
        return new TransformationContext(options, 0, 1, RenderMode.BLOCK, rootId, 0);
    }

    public static TransformationContext root(String rootId) {
        return root(rootId, ConversionOptions.defaults());
    }

    public ConversionOptions getOptions() {
        return options;
    }

    public int getSectionDepth() {
        return sectionDepth;
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    public RenderMode getMode() {
        return mode;
    }

    public String getIdScope() {
        return idScope;
    }

    /**
     * Zero-based position of the current node among its parent's children.
     */
    public int getPosition() {
        return position;
    }

    /**
     * One formatting level deeper.
     */
    public TransformationContext indented() {
        return new TransformationContext(options, sectionDepth, indentLevel + 1, mode, idScope, position);
    }

    /**
     * Context for the children of a nested section with the given identifier.
     */
    public TransformationContext nestedSection(String sectionId) {
        return new TransformationContext(options, sectionDepth + 1, indentLevel + 1, mode, sectionId, 0);
    }

    /**
     * Context for the children of a non-section container (note, example, exercise,
     * solution) with the given identifier. Depth and indentation are unchanged; only
     * the scope of synthesized ids moves to the container.
     */
    public TransformationContext nestedScope(String scopeId) {
        return new TransformationContext(options, sectionDepth, indentLevel, mode, scopeId, 0);
    }

    public TransformationContext withMode(RenderMode newMode) {
        if (newMode == mode) {
            return this;
        }
        return new TransformationContext(options, sectionDepth, indentLevel, newMode, idScope, position);
    }

    public TransformationContext atPosition(int newPosition) {
        return new TransformationContext(options, sectionDepth, indentLevel, mode, idScope, newPosition);
    }

    /**
     * Indentation string for the current level.
     */
    public String indent() {
        return options.getIndentUnit().repeat(indentLevel);
    }

    /**
     * Deterministic identifier for an element that has no source id:
     * {@code <scope>-<kind>-<position+1>}. Same input, same identifier.
     */
    public String synthesizeId(String kind) {
        return idScope + "-" + kind + "-" + (position + 1);
    }
}
