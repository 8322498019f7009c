package org.example.chapters.service.math;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites inline markup into plain text with LaTeX-style math spans.
 *
 * <p>Sub/superscript tags become {@code _{...}} / {@code ^{...}} groups,
 * remaining tags are dropped, full-width punctuation is replaced with ASCII,
 * adjacent script groups of the same kind are merged and recognizable
 * expressions are wrapped in {@code $...$}. Finally neighbouring spans are
 * coalesced by {@link MathSpanCoalescer}.
 */
@Component
public class MathMarkupNormalizer {

    private static final Pattern LINE_BREAK = Pattern.compile("<\\s*br\\s*/?\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUB_OPEN = Pattern.compile("<\\s*sub\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUB_CLOSE = Pattern.compile("<\\s*/\\s*sub\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUP_OPEN = Pattern.compile("<\\s*sup\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUP_CLOSE = Pattern.compile("<\\s*/\\s*sup\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern BRACE_OPEN_SPACE = Pattern.compile("\\{\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern BRACE_CLOSE_SPACE = Pattern.compile("\\s+}", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[^\\S\\n]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SPACE_AROUND_NEWLINE = Pattern.compile(" ?\\n ?");

    private static final Pattern ADJACENT_SUPERSCRIPTS = Pattern.compile("\\^\\{([^}]+)}\\^\\{([^}]+)}");
    private static final Pattern ADJACENT_SUBSCRIPTS = Pattern.compile("_\\{([^}]+)}_\\{([^}]+)}");

    // A \command{...} run, or an identifier / parenthesized group followed by script groups
    private static final Pattern MATH_EXPRESSION = Pattern.compile(
        "\\\\[A-Za-z]+(?:\\{[^}]+})+"
            + "|(?:\\([^)]+\\)|[A-Za-zΑ-Ωα-ω][A-Za-z0-9Α-Ωα-ω]*)(?:_\\{[^}]+}|\\^\\{[^}]+})+");

    private static final String OPERATORS = "=+-*/";

    private static final List<Map.Entry<String, String>> FULL_WIDTH = List.of(
        Map.entry("（", "("),
        Map.entry("）", ")"),
        Map.entry("，", ", "),
        Map.entry("。", ". "),
        Map.entry("．", ". "),
        Map.entry("；", "; "),
        Map.entry("：", ": "),
        Map.entry("＋", "+"),
        Map.entry("－", "-"),
        Map.entry("＝", "="),
        Map.entry("＜", "<"),
        Map.entry("＞", ">")
    );

    private final MathSpanCoalescer coalescer;

    public MathMarkupNormalizer(MathSpanCoalescer coalescer) {
        this.coalescer = coalescer;
    }

    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return text == null ? "" : text.strip();
        }
        String lowered = lowerMarkup(text);
        String merged = mergeScripts(lowered);
        String wrapped = wrapMathSpans(merged);
        return coalescer.coalesce(wrapped);
    }

    /**
     * Stage A: markup to text, full-width punctuation to ASCII.
     */
    String lowerMarkup(String text) {
        String result = text.replace('\u00a0', ' ').replace("&nbsp;", " ");
        result = LINE_BREAK.matcher(result).replaceAll("\n");
        result = SUB_OPEN.matcher(result).replaceAll("_{");
        result = SUB_CLOSE.matcher(result).replaceAll("}");
        result = SUP_OPEN.matcher(result).replaceAll("^{");
        result = SUP_CLOSE.matcher(result).replaceAll("}");
        result = ANY_TAG.matcher(result).replaceAll("");
        for (Map.Entry<String, String> replacement : FULL_WIDTH) {
            result = result.replace(replacement.getKey(), replacement.getValue());
        }
        result = BRACE_OPEN_SPACE.matcher(result).replaceAll("{");
        return BRACE_CLOSE_SPACE.matcher(result).replaceAll("}");
    }

    /**
     * Stage B: {@code ^{a}^{b}} becomes {@code ^{ab}} (likewise for
     * subscripts) until nothing changes; whitespace is then tidied.
     */
    String mergeScripts(String text) {
        String result = mergeAdjacent(ADJACENT_SUPERSCRIPTS, "^", text);
        result = mergeAdjacent(ADJACENT_SUBSCRIPTS, "_", result);
        result = HORIZONTAL_SPACE.matcher(result).replaceAll(" ");
        result = SPACE_AROUND_NEWLINE.matcher(result).replaceAll("\n");
        return result.strip();
    }

    private String mergeAdjacent(Pattern pattern, String marker, String text) {
        String current = text;
        while (true) {
            Matcher matcher = pattern.matcher(current);
            if (!matcher.find()) {
                return current;
            }
            current = matcher.replaceAll(match ->
                Matcher.quoteReplacement(marker + "{" + match.group(1) + match.group(2) + "}"));
        }
    }

    /**
     * Stage C: wraps recognizable expressions in {@code $...$}, keeping a
     * space between a span and a neighbouring word or operator.
     */
    String wrapMathSpans(String text) {
        Matcher matcher = MATH_EXPRESSION.matcher(text);
        StringBuilder out = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            out.append(text, last, matcher.start());
            if (out.length() > 0 && needsSpace(out.charAt(out.length() - 1))) {
                out.append(' ');
            }
            out.append('$').append(matcher.group()).append('$');
            last = matcher.end();
            if (last < text.length() && needsSpace(text.charAt(last))) {
                out.append(' ');
            }
        }
        out.append(text.substring(last));
        return out.toString();
    }

    private boolean needsSpace(char c) {
        return isWordChar(c) || OPERATORS.indexOf(c) >= 0 || c == '$';
    }

    private boolean isWordChar(char c) {
        return (c >= '0' && c <= '9')
            || (c >= 'A' && c <= 'Z')
            || (c >= 'a' && c <= 'z')
            || (c >= 'Α' && c <= 'Ω')
            || (c >= 'α' && c <= 'ω');
    }
}
