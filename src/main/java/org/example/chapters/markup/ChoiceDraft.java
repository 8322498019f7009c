package org.example.chapters.markup;

import org.example.chapters.model.RichPart;
import org.example.chapters.model.TextSegment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * One labelled choice of an open question and the content routed to it.
 */
public class ChoiceDraft {

    private final String label;
    private final List<RichPart> content = new ArrayList<>();

    ChoiceDraft(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public List<RichPart> content() {
        return Collections.unmodifiableList(content);
    }

    void add(RichPart part) {
        content.add(part);
    }

    void rewriteText(UnaryOperator<String> rewriter) {
        RichParts.rewrite(content, rewriter);
    }

    void addText(String text) {
        if (text != null && !text.isEmpty()) {
            content.add(new TextSegment(text));
        }
    }
}
