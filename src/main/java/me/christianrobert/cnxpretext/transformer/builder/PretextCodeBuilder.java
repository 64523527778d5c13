package me.christianrobert.cnxpretext.transformer.builder;

import me.christianrobert.cnxpretext.transformer.builder.math.LatexMathBuilder;
import me.christianrobert.cnxpretext.transformer.context.NamespaceTable;
import me.christianrobert.cnxpretext.transformer.context.RenderMode;
import me.christianrobert.cnxpretext.transformer.context.TransformationContext;
import me.christianrobert.cnxpretext.transformer.model.SourceNode;
import me.christianrobert.cnxpretext.transformer.util.PretextEscaper;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Structural converter: turns the content tree of one CNXML module into a PreTeXt
 * section fragment.
 *
 * <p>Block constructs are routed through {@link #BLOCK_DISPATCH} to static
 * {@code VisitX::v} emitters, which call back into this builder for their children.
 * Mixed text content goes through {@link VisitInlineContent}, math through
 * {@link LatexMathBuilder}.</p>
 *
 * <p>Content-namespace elements without an emitter (labels, glossary stubs, metadata
 * leftovers) are dropped at block level. Output is a pure function of the input tree
 * and the context: nothing here keeps state between calls.</p>
 */
public class PretextCodeBuilder {

    // no logging is desired, a chapter would log every paragraph

    private static final Map<String, ElementVisitor> BLOCK_DISPATCH = Map.ofEntries(
            entry("para", VisitPara::v),
            entry("list", VisitList::v),
            entry("table", VisitTable::v),
            entry("figure", VisitFigure::v),
            entry("media", VisitImage::block),
            entry("image", VisitImage::block),
            entry("equation", VisitEquation::v),
            entry("preformat", VisitPreformat::v),
            entry("code", VisitPreformat::v),
            entry("note", VisitNote::v),
            entry("example", VisitExample::v),
            entry("exercise", VisitExercise::v),
            entry("section", VisitSection::v)
    );

    /** Children that belong to their parent's header and never render as blocks. */
    static final Set<String> HEADER_ELEMENTS = Set.of("title", "label", "caption");

    private final LatexMathBuilder mathBuilder = new LatexMathBuilder();

    /**
     * Converts a module into one PreTeXt {@code <section>}.
     *
     * @param document parsed module, either the {@code document} root or a {@code content} element
     * @param sectionId identifier for the emitted section
     * @param title plain-text section title
     * @param ctx root context, see {@link TransformationContext#root}
     * @return the section fragment; an empty section shell when the module has no content
     */
    public String convertModule(SourceNode document, String sectionId, String title, TransformationContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append(ctx.indent()).append("<section xml:id=\"").append(PretextEscaper.escapeAttribute(sectionId)).append("\">\n");
        if (title != null && !title.isBlank()) {
            sb.append(ctx.indented().indent()).append("<title>")
                    .append(PretextEscaper.escapeText(title.trim())).append("</title>\n");
        }

        Optional<SourceNode> content = findContent(document);
        content.ifPresent(c -> sb.append(visitChildren(c, ctx.indented(), HEADER_ELEMENTS)));

        sb.append(ctx.indent()).append("</section>\n");
        return sb.toString();
    }

    /**
     * Converts a module into a chapter {@code <introduction>}. Objective notes
     * become {@code <objectives>} through the regular note mapping.
     */
    public String convertIntroduction(SourceNode document, TransformationContext ctx) {
        Optional<SourceNode> content = findContent(document);
        String body = content.map(c -> visitChildren(c, ctx.indented(), HEADER_ELEMENTS)).orElse("");
        if (body.isEmpty()) {
            return ctx.indent() + "<introduction/>\n";
        }
        return ctx.indent() + "<introduction>\n" + body + ctx.indent() + "</introduction>\n";
    }

    /**
     * Emits one block-level construct, or nothing when the element has no block form.
     */
    public String visitBlock(SourceNode node, TransformationContext ctx) {
        if (!NamespaceTable.isContent(node.getNamespaceUri())) {
            if (node.is(NamespaceTable.MATH, "math")) {
                // stray display math directly in a container
                return VisitEquation.fromMath(node, null, ctx, this);
            }
            return "";
        }
        ElementVisitor visitor = BLOCK_DISPATCH.get(node.getLocalName());
        if (visitor == null) {
            return "";
        }
        return visitor.v(node, ctx, this);
    }

    /**
     * Emits all children of a container in document order, skipping the named elements.
     * Each child sees its own position, which feeds the deterministic id scheme.
     */
    public String visitChildren(SourceNode container, TransformationContext ctx, Set<String> skip) {
        StringBuilder sb = new StringBuilder();
        List<SourceNode> children = container.getChildren();
        for (int i = 0; i < children.size(); i++) {
            SourceNode child = children.get(i);
            if (skip.contains(child.getLocalName()) && NamespaceTable.isContent(child.getNamespaceUri())) {
                continue;
            }
            sb.append(visitBlock(child, ctx.atPosition(i)));
        }
        return sb.toString();
    }

    /**
     * Renders the mixed content of a node (text, inline spans, math), without the node's own tail.
     */
    public String renderInline(SourceNode node, TransformationContext ctx) {
        return VisitInlineContent.v(node, ctx, this);
    }

    /**
     * Inline rendering in paragraph mode, trimmed.
     */
    public String renderInlineTrimmed(SourceNode node, TransformationContext ctx) {
        return renderInline(node, ctx.withMode(RenderMode.INLINE)).trim();
    }

    /**
     * LaTeX for one {@code m:math} element.
     */
    public String renderMath(SourceNode math) {
        return mathBuilder.rewrite(math);
    }

    /**
     * Rendered text of the node's {@code title} child; empty when it has none.
     */
    public String titleOf(SourceNode node, TransformationContext ctx) {
        return node.findChild(NamespaceTable.CONTENT, "title")
                .map(t -> renderInlineTrimmed(t, ctx))
                .orElse("");
    }

    /**
     * A complete {@code <title>} line at the given indentation, using the fallback
     * when the node has no title of its own. Empty when both are empty.
     */
    public String titleLine(SourceNode node, TransformationContext ctx, String fallback) {
        String title = titleOf(node, ctx);
        if (title.isEmpty()) {
            title = fallback != null ? PretextEscaper.escapeText(fallback) : "";
        }
        if (title.isEmpty()) {
            return "";
        }
        return ctx.indent() + "<title>" + title + "</title>\n";
    }

    /**
     * Id scope for the children of a container: its source id, else the id it would be
     * given at its own position. Containers nested in one section then never number
     * their figures and tables into the section's sequence.
     */
    static TransformationContext childScope(SourceNode container, String kind, TransformationContext ctx) {
        String id = container.getAttribute("id");
        if (id == null || id.isBlank()) {
            id = ctx.synthesizeId(kind);
        }
        return ctx.nestedScope(id.trim());
    }

    /**
     * Opening tag with an optional {@code xml:id}.
     */
    static String open(String tag, String id) {
        if (id == null || id.isEmpty()) {
            return "<" + tag + ">";
        }
        return "<" + tag + " xml:id=\"" + PretextEscaper.escapeAttribute(id) + "\">";
    }

    /**
     * The module's {@code content} element; the node itself when it is one.
     */
    public static Optional<SourceNode> findContent(SourceNode document) {
        if (document == null) {
            return Optional.empty();
        }
        if (document.is(NamespaceTable.CONTENT, "content")) {
            return Optional.of(document);
        }
        return document.findDescendant(NamespaceTable.CONTENT, "content");
    }
}
