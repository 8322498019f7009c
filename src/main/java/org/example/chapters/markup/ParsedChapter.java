package org.example.chapters.markup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Result of reading one chapter document: the section tree in document
 * order plus the chapter's image ledger. Questions are still in their
 * accumulated, unfinalized form.
 */
public class ParsedChapter {

    private final String id;
    private String title = "";
    private final List<SectionDraft> sections = new ArrayList<>();
    private final ImageLedger images = new ImageLedger();

    public ParsedChapter(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    void setTitle(String title) {
        this.title = title == null ? "" : title;
    }

    public List<SectionDraft> sections() {
        return Collections.unmodifiableList(sections);
    }

    SectionDraft addSection(String title) {
        SectionDraft section = new SectionDraft(title);
        sections.add(section);
        return section;
    }

    public ImageLedger images() {
        return images;
    }

    /**
     * URLs of every image in the chapter, in first-seen order, for the
     * caller to resolve to local files.
     */
    public List<String> imageUrls() {
        return images.urls();
    }

    public void rewriteText(UnaryOperator<String> rewriter) {
        title = rewriter.apply(title);
        for (SectionDraft section : sections) {
            section.rewriteText(rewriter);
        }
    }
}
