package org.example.chapters.service.math;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Merges {@code $...$} spans that are separated only by connector text
 * (whitespace, digits, punctuation, arithmetic operators) into one span and
 * writes each span's interior in a canonical spacing.
 *
 * <p>The result is stable: coalescing an already coalesced string returns
 * it unchanged.
 */
@Component
public class MathSpanCoalescer {

    private static final Pattern CONNECTOR = Pattern.compile("[\\s,;:.·+\\-*/=0-9，。．]+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern ARITHMETIC = Pattern.compile("\\s*([+\\-*/])\\s*");
    private static final Pattern EQUALS = Pattern.compile("\\s*=\\s*");
    private static final Pattern COMMA = Pattern.compile("\\s*,\\s*");
    private static final Pattern OPEN_PAREN = Pattern.compile("\\(\\s+");
    private static final Pattern CLOSE_PAREN = Pattern.compile("\\s+\\)");
    private static final Pattern SUPERSCRIPT = Pattern.compile("\\s*\\^\\s*");
    private static final Pattern SUBSCRIPT = Pattern.compile("\\s*_\\s*");
    private static final Pattern BRACE_OPEN = Pattern.compile("\\{\\s+");
    private static final Pattern BRACE_CLOSE = Pattern.compile("\\s+}");

    private record Segment(boolean math, String content) {}

    public String coalesce(String text) {
        if (text == null || text.indexOf('$') < 0) {
            return text;
        }

        StringBuilder out = new StringBuilder();
        StringBuilder buffer = null;
        String pending = "";

        for (Segment segment : split(text)) {
            if (segment.math()) {
                if (buffer == null) {
                    buffer = new StringBuilder(segment.content());
                } else {
                    buffer.append(pending).append(segment.content());
                }
                pending = "";
                continue;
            }
            if (buffer != null) {
                if (CONNECTOR.matcher(segment.content()).matches()) {
                    pending += segment.content();
                    continue;
                }
                appendSpan(out, buffer + pending);
                buffer = null;
                pending = "";
            }
            out.append(segment.content());
        }

        if (buffer != null) {
            appendSpan(out, buffer + pending);
        }
        return out.toString();
    }

    /**
     * Canonical spacing inside a math span: tight arithmetic operators,
     * one space on each side of {@code =}, no padding inside parentheses,
     * braces or around script markers.
     */
    String formatExpression(String expression) {
        String result = WHITESPACE.matcher(expression.strip()).replaceAll(" ");
        if (result.isEmpty()) {
            return result;
        }
        result = ARITHMETIC.matcher(result).replaceAll("$1");
        result = EQUALS.matcher(result).replaceAll(" = ");
        result = COMMA.matcher(result).replaceAll(", ");
        result = OPEN_PAREN.matcher(result).replaceAll("(");
        result = CLOSE_PAREN.matcher(result).replaceAll(")");
        result = SUPERSCRIPT.matcher(result).replaceAll("^");
        result = SUBSCRIPT.matcher(result).replaceAll("_");
        result = BRACE_OPEN.matcher(result).replaceAll("{");
        result = BRACE_CLOSE.matcher(result).replaceAll("}");
        return result.strip();
    }

    private void appendSpan(StringBuilder out, String expression) {
        String formatted = formatExpression(expression);
        if (!formatted.isEmpty()) {
            out.append('$').append(formatted).append('$');
        }
    }

    private List<Segment> split(String text) {
        List<Segment> segments = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            if (text.charAt(i) == '$') {
                int close = text.indexOf('$', i + 1);
                if (close < 0) {
                    // Unpaired marker: keep the rest as literal text
                    segments.add(new Segment(false, text.substring(i)));
                    break;
                }
                segments.add(new Segment(true, text.substring(i + 1, close)));
                i = close + 1;
            } else {
                int next = text.indexOf('$', i);
                if (next < 0) {
                    next = text.length();
                }
                segments.add(new Segment(false, text.substring(i, next)));
                i = next;
            }
        }
        return segments;
    }
}
