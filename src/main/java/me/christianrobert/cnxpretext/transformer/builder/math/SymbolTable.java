package me.christianrobert.cnxpretext.transformer.builder.math;

import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Static mapping from MathML symbol text to LaTeX, keyed on (symbol, {@link SymbolRole}).
 *
 * <p>Lookup order: the role-specific table first, then the default table. A symbol
 * found in neither is returned unchanged. Example: {@code Σ} is {@code \Sigma} as an
 * identifier but {@code \sum} as an operator or as the base of an under/over limit.</p>
 *
 * <p>Whole-token entries (function names like {@code sin}) are matched before the
 * per-character fallback, so {@code sin} becomes {@code \sin} and not {@code sin}.</p>
 */
public final class SymbolTable {

    private static final Map<String, String> DEFAULT_SYMBOLS = Map.ofEntries(
            // Greek, lower case
            entry("α", "\\alpha"),
            entry("β", "\\beta"),
            entry("γ", "\\gamma"),
            entry("δ", "\\delta"),
            entry("ε", "\\varepsilon"),
            entry("ϵ", "\\epsilon"),
            entry("ζ", "\\zeta"),
            entry("η", "\\eta"),
            entry("θ", "\\theta"),
            entry("ϑ", "\\vartheta"),
            entry("ι", "\\iota"),
            entry("κ", "\\kappa"),
            entry("λ", "\\lambda"),
            entry("μ", "\\mu"),
            entry("ν", "\\nu"),
            entry("ξ", "\\xi"),
            entry("π", "\\pi"),
            entry("ρ", "\\rho"),
            entry("σ", "\\sigma"),
            entry("ς", "\\varsigma"),
            entry("τ", "\\tau"),
            entry("υ", "\\upsilon"),
            entry("φ", "\\varphi"),
            entry("ϕ", "\\phi"),
            entry("χ", "\\chi"),
            entry("ψ", "\\psi"),
            entry("ω", "\\omega"),
            // Greek, upper case (the rest coincide with Latin letters)
            entry("Γ", "\\Gamma"),
            entry("Δ", "\\Delta"),
            entry("Θ", "\\Theta"),
            entry("Λ", "\\Lambda"),
            entry("Ξ", "\\Xi"),
            entry("Π", "\\Pi"),
            entry("Σ", "\\Sigma"),
            entry("Υ", "\\Upsilon"),
            entry("Φ", "\\Phi"),
            entry("Ψ", "\\Psi"),
            entry("Ω", "\\Omega"),
            // relations and arithmetic
            entry("−", "-"),
            entry("–", "-"),
            entry("—", "-"),
            entry("≤", "\\leq"),
            entry("≥", "\\geq"),
            entry("≈", "\\approx"),
            entry("∼", "\\sim"),
            entry("~", "\\sim"),
            entry("≠", "\\neq"),
            entry("≡", "\\equiv"),
            entry("∝", "\\propto"),
            entry("≪", "\\ll"),
            entry("≫", "\\gg"),
            entry("×", "\\times"),
            entry("·", "\\cdot"),
            entry("⋅", "\\cdot"),
            entry("∗", "*"),
            entry("÷", "\\div"),
            entry("±", "\\pm"),
            entry("∓", "\\mp"),
            entry("…", "\\ldots"),
            entry("⋯", "\\cdots"),
            entry("∞", "\\infty"),
            entry("∂", "\\partial"),
            entry("∇", "\\nabla"),
            entry("√", "\\surd"),
            entry("∑", "\\sum"),
            entry("∏", "\\prod"),
            entry("∫", "\\int"),
            entry("°", "^{\\circ}"),
            entry("′", "'"),
            entry("″", "''"),
            entry("∠", "\\angle"),
            entry("⊥", "\\perp"),
            entry("∣", "\\mid"),
            // sets and logic
            entry("∈", "\\in"),
            entry("∉", "\\notin"),
            entry("⊂", "\\subset"),
            entry("⊃", "\\supset"),
            entry("⊆", "\\subseteq"),
            entry("⊇", "\\supseteq"),
            entry("∪", "\\cup"),
            entry("∩", "\\cap"),
            entry("∅", "\\emptyset"),
            entry("∖", "\\setminus"),
            entry("∧", "\\wedge"),
            entry("∨", "\\vee"),
            entry("¬", "\\neg"),
            entry("∀", "\\forall"),
            entry("∃", "\\exists"),
            // arrows
            entry("→", "\\to"),
            entry("←", "\\leftarrow"),
            entry("⇒", "\\Rightarrow"),
            entry("⇔", "\\Leftrightarrow"),
            // characters reserved by LaTeX or by the surrounding markup
            entry("<", "\\lt"),
            entry(">", "\\gt"),
            entry("&", "\\&"),
            entry("%", "\\%"),
            entry("#", "\\#"),
            entry("$", "\\$"),
            entry("{", "\\{"),
            entry("}", "\\}"),
            entry("\\", "\\backslash"),
            // invisible operators carry no rendering
            entry("\u2061", ""),
            entry("\u2062", ""),
            entry("\u2063", ""),
            entry("\u2064", ""),
            entry("\u00A0", " "),
            // function names
            entry("sin", "\\sin"),
            entry("cos", "\\cos"),
            entry("tan", "\\tan"),
            entry("sec", "\\sec"),
            entry("csc", "\\csc"),
            entry("cot", "\\cot"),
            entry("arcsin", "\\arcsin"),
            entry("arccos", "\\arccos"),
            entry("arctan", "\\arctan"),
            entry("sinh", "\\sinh"),
            entry("cosh", "\\cosh"),
            entry("tanh", "\\tanh"),
            entry("log", "\\log"),
            entry("ln", "\\ln"),
            entry("exp", "\\exp"),
            entry("lim", "\\lim"),
            entry("max", "\\max"),
            entry("min", "\\min"),
            entry("det", "\\det"),
            entry("gcd", "\\gcd"),
            entry("Pr", "\\Pr")
    );

    private static final Map<String, String> OPERATOR_SYMBOLS = Map.of(
            "Σ", "\\sum",
            "Π", "\\prod"
    );

    private static final Map<String, String> LIMIT_BASE_SYMBOLS = Map.of(
            "Σ", "\\sum",
            "Π", "\\prod",
            "∪", "\\bigcup",
            "∩", "\\bigcap"
    );

    /** Results that render as large operators taking limits below/above instead of being decorated. */
    private static final Set<String> LIMIT_OPERATORS = Set.of(
            "\\sum", "\\prod", "\\int", "\\bigcup", "\\bigcap", "\\lim", "\\max", "\\min");

    private SymbolTable() {
    }

    /**
     * Looks up one symbol for the given role.
     *
     * @return LaTeX for the symbol, or null when it is not mapped
     */
    public static String lookup(String symbol, SymbolRole role) {
        String mapped = null;
        if (role == SymbolRole.LIMIT_BASE) {
            mapped = LIMIT_BASE_SYMBOLS.get(symbol);
            if (mapped == null) {
                mapped = OPERATOR_SYMBOLS.get(symbol);
            }
        } else if (role == SymbolRole.OPERATOR) {
            mapped = OPERATOR_SYMBOLS.get(symbol);
        }
        return mapped != null ? mapped : DEFAULT_SYMBOLS.get(symbol);
    }

    /**
     * Translates leaf text: the whole token when mapped, otherwise character by character,
     * leaving unmapped characters as they are. Surrounding whitespace is insignificant.
     */
    public static String translate(String text, SymbolRole role) {
        if (text == null) {
            return "";
        }
        String token = text.trim();
        if (token.isEmpty()) {
            return "";
        }

        String whole = lookup(token, role);
        if (whole != null) {
            return whole;
        }

        StringBuilder sb = new StringBuilder();
        token.codePoints().forEach(cp -> {
            String symbol = new String(Character.toChars(cp));
            String mapped = lookup(symbol, role);
            LatexMathBuilder.appendPart(sb, mapped != null ? mapped : symbol);
        });
        return sb.toString();
    }

    /**
     * True for LaTeX operators that take limits as sub/superscripts ({@code \sum}, {@code \lim}, ...).
     */
    public static boolean isLimitOperator(String latex) {
        return latex != null && LIMIT_OPERATORS.contains(latex.trim());
    }
}
