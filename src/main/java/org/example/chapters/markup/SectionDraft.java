package org.example.chapters.markup;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

public class SectionDraft {

    private String title;
    private final List<ItemDraft> items = new ArrayList<>();

    public SectionDraft(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }

    public List<ItemDraft> items() {
        return items;
    }

    void add(ItemDraft item) {
        items.add(item);
    }

    public void rewriteText(UnaryOperator<String> rewriter) {
        if (title != null && !title.isEmpty()) {
            title = rewriter.apply(title);
        }
        for (ItemDraft item : items) {
            item.rewriteText(rewriter);
        }
    }
}
