package org.example.chapters.markup;

import org.example.chapters.model.ImageRef;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Text extraction helpers that keep the markup the math normalizer needs:
 * line breaks become {@code <br/>} and sub/superscripts keep their tags.
 */
public final class MarkupText {

    // Unicode-aware so the ideographic space U+3000 collapses like ASCII blanks
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private MarkupText() {
    }

    public static String flatten(Node node) {
        return clean(stringify(node));
    }

    public static String stringify(Node node) {
        if (node instanceof TextNode textNode) {
            return textNode.getWholeText();
        }
        if (!(node instanceof Element element)) {
            return "";
        }
        String tag = element.normalName();
        if (tag.equals("br")) {
            return "<br/>";
        }
        StringBuilder inner = new StringBuilder();
        for (Node child : element.childNodes()) {
            inner.append(stringify(child));
        }
        if (tag.equals("sub") || tag.equals("sup")) {
            String trimmed = inner.toString().strip();
            if (trimmed.isEmpty()) {
                return "";
            }
            return "<" + tag + ">" + trimmed + "</" + tag + ">";
        }
        return inner.toString();
    }

    public static String clean(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    public static boolean isImage(Element element) {
        return element.hasClass(MarkupVocabulary.IMAGE_CLASS);
    }

    /**
     * Reads an image marker, or empty when it carries no URL.
     */
    public static Optional<ImageRef> imageRef(Element element) {
        String src = element.attr(MarkupVocabulary.IMAGE_SRC);
        if (src.isBlank()) {
            src = element.attr(MarkupVocabulary.IMAGE_SRC_FALLBACK);
        }
        if (src.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new ImageRef(
            src.strip(),
            attrOrNull(element, MarkupVocabulary.IMAGE_WIDTH),
            attrOrNull(element, MarkupVocabulary.IMAGE_HEIGHT)
        ));
    }

    private static String attrOrNull(Element element, String name) {
        if (!element.hasAttr(name)) {
            return null;
        }
        String value = element.attr(name).strip();
        return value.isEmpty() ? null : value;
    }
}
