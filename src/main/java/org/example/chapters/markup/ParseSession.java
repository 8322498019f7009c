package org.example.chapters.markup;

import org.example.chapters.model.ImageRef;

import java.util.Optional;

/**
 * Cursor state while walking a chapter's blocks: the open section and the
 * open question, if any.
 */
public class ParseSession {

    private final ParsedChapter chapter;
    private SectionDraft currentSection;
    private QuestionAccumulator currentQuestion;

    public ParseSession(ParsedChapter chapter) {
        this.chapter = chapter;
    }

    public ParsedChapter chapter() {
        return chapter;
    }

    public Optional<QuestionAccumulator> openQuestion() {
        return Optional.ofNullable(currentQuestion);
    }

    public void closeQuestion() {
        if (currentQuestion != null) {
            currentQuestion.close();
            currentQuestion = null;
        }
    }

    public void setChapterTitle(String title) {
        closeQuestion();
        chapter.setTitle(title);
    }

    public void openSection(String title) {
        closeQuestion();
        currentSection = chapter.addSection(title);
    }

    public void addItem(ItemDraft item) {
        section().add(item);
    }

    public void startQuestion(QuestionAccumulator question) {
        closeQuestion();
        section().add(question);
        currentQuestion = question;
    }

    public ImageRef registerImage(ImageRef image) {
        return chapter.images().register(image);
    }

    private SectionDraft section() {
        if (currentSection == null) {
            currentSection = chapter.addSection(null);
        }
        return currentSection;
    }
}
