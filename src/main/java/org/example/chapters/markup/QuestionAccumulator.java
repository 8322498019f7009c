package org.example.chapters.markup;

import org.example.chapters.model.ImageRef;
import org.example.chapters.model.RichPart;
import org.example.chapters.model.TextSegment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * The question currently being read, together with the lines that follow
 * its title node.
 *
 * <p>Before the first answer line, free text may open or extend a choice;
 * afterwards all free text belongs to the analysis. The active choice is
 * tracked as an index into this question's own choices.
 */
public class QuestionAccumulator implements ItemDraft {

    public enum State {
        OPEN_PRE_ANSWER,
        OPEN_POST_ANSWER,
        CLOSED
    }

    private static final String ASCII_LABELS = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String FULL_WIDTH_LABELS = "ＡＢＣＤＥＦＧＨＩＪＫＬＭＮＯＰＱＲＳＴＵＶＷＸＹＺ";
    private static final String LABEL_DELIMITERS = "．.、)）：: ";

    private final String number;
    private final List<RichPart> questionRich;
    private String fallbackText;
    private final List<ChoiceDraft> choices = new ArrayList<>();
    private final List<String> answerLines = new ArrayList<>();
    private final List<RichPart> analysisLines = new ArrayList<>();
    private final List<RichPart> questionExtra = new ArrayList<>();
    private Integer activeChoice;
    private State state = State.OPEN_PRE_ANSWER;

    public QuestionAccumulator(String number, List<RichPart> questionRich, String fallbackText) {
        this.number = number;
        this.questionRich = new ArrayList<>(questionRich);
        this.fallbackText = fallbackText == null ? "" : fallbackText;
    }

    public record ChoiceLine(String label, String remainder) {}

    /**
     * Splits a line such as {@code "A．red"} into its label and remainder.
     * A line made of a single label character is a choice with no text.
     */
    public static Optional<ChoiceLine> splitChoice(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String stripped = text.strip();
        if (stripped.isEmpty()) {
            return Optional.empty();
        }
        char label = stripped.charAt(0);
        if (ASCII_LABELS.indexOf(label) < 0 && FULL_WIDTH_LABELS.indexOf(label) < 0) {
            return Optional.empty();
        }
        if (stripped.length() == 1) {
            return Optional.of(new ChoiceLine(String.valueOf(label), ""));
        }
        if (LABEL_DELIMITERS.indexOf(stripped.charAt(1)) < 0) {
            return Optional.empty();
        }
        int start = 2;
        while (start < stripped.length() && LABEL_DELIMITERS.indexOf(stripped.charAt(start)) >= 0) {
            start++;
        }
        return Optional.of(new ChoiceLine(String.valueOf(label), stripped.substring(start)));
    }

    /**
     * Records an answer line. A blank line (an empty or image-only answer
     * box) adds nothing but still ends the choice list.
     */
    public void addAnswerLine(String text) {
        requireOpen();
        if (text != null && !text.isBlank()) {
            answerLines.add(text);
        }
        if (state == State.OPEN_PRE_ANSWER) {
            state = State.OPEN_POST_ANSWER;
            activeChoice = null;
        }
    }

    public void addAnalysisLine(String text) {
        requireOpen();
        if (text == null || text.isEmpty()) {
            return;
        }
        analysisLines.add(new TextSegment(text));
    }

    /**
     * Routes a free text line according to the current state.
     */
    public void addText(String text) {
        requireOpen();
        if (text == null || text.isEmpty()) {
            return;
        }
        if (state == State.OPEN_POST_ANSWER) {
            analysisLines.add(new TextSegment(text));
            return;
        }
        Optional<ChoiceLine> choiceLine = splitChoice(text);
        if (choiceLine.isPresent()) {
            openChoice(choiceLine.get());
            return;
        }
        Optional<ChoiceDraft> active = activeChoice();
        if (active.isPresent()) {
            active.get().addText(text);
        } else {
            questionExtra.add(new TextSegment(text));
        }
    }

    public void addImage(ImageRef image) {
        requireOpen();
        if (state == State.OPEN_POST_ANSWER) {
            analysisLines.add(image);
            return;
        }
        Optional<ChoiceDraft> active = activeChoice();
        if (active.isPresent()) {
            active.get().add(image);
        } else {
            questionExtra.add(image);
        }
    }

    public void close() {
        state = State.CLOSED;
        activeChoice = null;
    }

    private void openChoice(ChoiceLine line) {
        int index = indexOfLabel(line.label());
        if (index < 0) {
            choices.add(new ChoiceDraft(line.label()));
            index = choices.size() - 1;
        }
        activeChoice = index;
        choices.get(index).addText(line.remainder());
    }

    private int indexOfLabel(String label) {
        for (int i = 0; i < choices.size(); i++) {
            if (choices.get(i).label().equals(label)) {
                return i;
            }
        }
        return -1;
    }

    private void requireOpen() {
        if (state == State.CLOSED) {
            throw new IllegalStateException("Question " + (number == null ? "" : number + " ") + "is closed");
        }
    }

    @Override
    public void rewriteText(UnaryOperator<String> rewriter) {
        RichParts.rewrite(questionRich, rewriter);
        fallbackText = rewriter.apply(fallbackText);
        answerLines.replaceAll(rewriter);
        RichParts.rewrite(analysisLines, rewriter);
        RichParts.rewrite(questionExtra, rewriter);
        for (ChoiceDraft choice : choices) {
            choice.rewriteText(rewriter);
        }
    }

    public Optional<ChoiceDraft> activeChoice() {
        if (activeChoice == null) {
            return Optional.empty();
        }
        return Optional.of(choices.get(activeChoice));
    }

    public State state() {
        return state;
    }

    public String number() {
        return number;
    }

    public String fallbackText() {
        return fallbackText;
    }

    public List<RichPart> questionRich() {
        return Collections.unmodifiableList(questionRich);
    }

    public List<ChoiceDraft> choices() {
        return Collections.unmodifiableList(choices);
    }

    public List<String> answerLines() {
        return Collections.unmodifiableList(answerLines);
    }

    public List<RichPart> analysisLines() {
        return Collections.unmodifiableList(analysisLines);
    }

    public List<RichPart> questionExtra() {
        return Collections.unmodifiableList(questionExtra);
    }
}
