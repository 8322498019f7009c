package org.example.chapters.markup;

import org.example.chapters.model.ChapterItem;
import org.example.chapters.model.HeadingItem;
import org.example.chapters.model.TextItem;

import java.util.function.UnaryOperator;

/**
 * Holder for a non-question item (heading, text or image block).
 */
public class BlockDraft implements ItemDraft {

    private ChapterItem item;

    public BlockDraft(ChapterItem item) {
        this.item = item;
    }

    public ChapterItem item() {
        return item;
    }

    @Override
    public void rewriteText(UnaryOperator<String> rewriter) {
        if (item instanceof HeadingItem heading) {
            item = new HeadingItem(heading.level(), rewriter.apply(heading.text()));
        } else if (item instanceof TextItem text) {
            item = new TextItem(rewriter.apply(text.text()));
        }
    }
}
