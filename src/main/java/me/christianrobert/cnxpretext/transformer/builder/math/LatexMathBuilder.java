package me.christianrobert.cnxpretext.transformer.builder.math;

import me.christianrobert.cnxpretext.transformer.model.SourceNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Rewrites a MathML expression tree into linear LaTeX notation.
 *
 * <p>Every MathML tag with special rendering is routed to a static {@code VisitX}
 * helper through {@link #DISPATCH}. Tags absent from the table are treated as
 * opaque rows: a childless node with text is a symbol leaf, anything else is
 * the concatenation of its rewritten children.</p>
 *
 * <p>The rewrite is total. Positional constructs with missing children get empty
 * operands ({@link #operands}), whitespace-only text is ignored, and nothing in
 * here throws for unexpected input.</p>
 */
public class LatexMathBuilder {

  // no logging: pure function over a small tree, called once per math span

  private static final Map<String, MathVisitor> DISPATCH = Map.ofEntries(
      entry("mi", VisitToken::identifier),
      entry("mn", VisitToken::number),
      entry("mo", VisitToken::operator),
      entry("mtext", VisitToken::text),
      entry("ms", VisitToken::stringLiteral),
      entry("mspace", VisitToken::space),
      entry("mfrac", VisitFraction::v),
      entry("msqrt", VisitRoot::sqrt),
      entry("mroot", VisitRoot::root),
      entry("msub", VisitScript::sub),
      entry("msup", VisitScript::sup),
      entry("msubsup", VisitScript::subsup),
      entry("mover", VisitUnderOver::over),
      entry("munder", VisitUnderOver::under),
      entry("munderover", VisitUnderOver::underover),
      entry("mfenced", VisitFenced::v),
      entry("mtable", VisitMatrix::v),
      entry("semantics", VisitRow::semantics),
      entry("annotation", VisitRow::skip),
      entry("annotation-xml", VisitRow::skip),
      entry("mphantom", VisitRow::phantom)
  );

  /**
   * Rewrites a complete expression (usually an {@code m:math} element).
   *
   * @param node expression root, may be null
   * @return LaTeX, empty for a null or empty expression
   */
  public String rewrite(SourceNode node) {
    return visit(node, SymbolRole.DEFAULT);
  }

  /**
   * Rewrites one node in the given positional role.
   */
  public String visit(SourceNode node, SymbolRole role) {
    if (node == null) {
      return "";
    }

    MathVisitor visitor = DISPATCH.get(node.getLocalName());
    if (visitor != null) {
      return visitor.v(node, role, this);
    }

    if (!node.hasChildren()) {
      // symbol or number leaf under an unknown tag
      return SymbolTable.translate(node.getText(), role);
    }

    // math, mrow, mstyle, mpadded, menclose and anything unknown
    return concatChildren(node, role);
  }

  /**
   * Rewrites the positional operands of a fixed-arity construct.
   * The list always has exactly as many entries as the construct's {@link ArityClass};
   * missing children yield empty strings.
   *
   * @param baseRole role of the first operand; the others use {@link SymbolRole#DEFAULT}
   */
  public List<String> operands(SourceNode node, SymbolRole baseRole) {
    ArityClass arity = ArityClass.of(node.getLocalName());
    int count = arity.isPositional() ? arity.getOperandCount() : node.getChildren().size();

    List<String> result = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      SymbolRole role = i == 0 ? baseRole : SymbolRole.DEFAULT;
      result.add(node.childAt(i).map(child -> visitWithTail(child, role)).orElse(""));
    }
    return result;
  }

  /**
   * Concatenates the node's own text and all rewritten children, each followed by its tail.
   */
  public String concatChildren(SourceNode node, SymbolRole role) {
    StringBuilder sb = new StringBuilder();
    appendPart(sb, SymbolTable.translate(node.getText(), role));
    for (SourceNode child : node.getChildren()) {
      appendPart(sb, visitWithTail(child, role));
    }
    return sb.toString();
  }

  /**
   * Rewritten child followed by its trimmed tail text.
   */
  String visitWithTail(SourceNode child, SymbolRole role) {
    StringBuilder sb = new StringBuilder();
    appendPart(sb, visit(child, role));
    appendPart(sb, SymbolTable.translate(child.getTail(), SymbolRole.DEFAULT));
    return sb.toString();
  }

  /**
   * Appends a LaTeX fragment, inserting a space where a control word would
   * otherwise run into a following letter ({@code \mu} + {@code x} is {@code \mu x}, not {@code \mux}).
   */
  static void appendPart(StringBuilder sb, String part) {
    if (part == null || part.isEmpty()) {
      return;
    }
    if (endsWithControlWord(sb) && Character.isLetter(part.charAt(0))) {
      sb.append(' ');
    }
    sb.append(part);
  }

  private static boolean endsWithControlWord(StringBuilder sb) {
    int i = sb.length() - 1;
    if (i < 0 || !isAsciiLetter(sb.charAt(i))) {
      return false;
    }
    while (i >= 0 && isAsciiLetter(sb.charAt(i))) {
      i--;
    }
    return i >= 0 && sb.charAt(i) == '\\';
  }

  private static boolean isAsciiLetter(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }
}
