package org.example.chapters.service;

import org.example.chapters.markup.ChoiceDraft;
import org.example.chapters.markup.QuestionAccumulator;
import org.example.chapters.markup.RichParts;
import org.example.chapters.model.Choice;
import org.example.chapters.model.ImageRef;
import org.example.chapters.model.QuestionItem;
import org.example.chapters.model.RichPart;
import org.example.chapters.model.TextSegment;
import org.example.chapters.service.math.MathSpanCoalescer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns an accumulated question into its finished record: compacted rich
 * sequences, the flattened question line, deduplicated answer lines and the
 * joined analysis text. Image usages are attached later.
 */
@Component
public class QuestionFinalizer {

    private static final Logger log = LoggerFactory.getLogger(QuestionFinalizer.class);

    private final MathSpanCoalescer coalescer;

    public QuestionFinalizer(MathSpanCoalescer coalescer) {
        this.coalescer = coalescer;
    }

    public QuestionItem finalizeQuestion(QuestionAccumulator draft) {
        List<RichPart> questionRich = compact(draft.questionRich());
        String question = questionRich.isEmpty()
            ? draft.fallbackText().strip()
            : coalescer.coalesce(RichParts.withPlaceholders(questionRich));

        List<Choice> choices = draft.choices().stream()
            .map(choice -> new Choice(choice.label(), compact(choice.content())))
            .toList();

        Set<String> labels = draft.choices().stream()
            .map(ChoiceDraft::label)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        List<String> answerLines = resolveAnswerLines(draft.number(), draft.answerLines(), labels);
        String answer = answerLines.isEmpty() ? null : String.join(" ", answerLines);

        List<RichPart> analysisLines = compact(draft.analysisLines());
        String analysis = analysisLines.stream()
            .filter(TextSegment.class::isInstance)
            .map(part -> ((TextSegment) part).text())
            .collect(Collectors.joining("\n"));

        return new QuestionItem(
            draft.number(),
            question,
            questionRich,
            choices,
            answerLines,
            answer,
            analysisLines,
            analysis.isEmpty() ? null : analysis,
            compact(draft.questionExtra()),
            List.of()
        );
    }

    /**
     * Trimmed raw lines in order, exact duplicates dropped. A line equal to
     * one of the choice labels is an echo: echoes are skipped during the scan
     * and the first one seen is appended once at the end.
     */
    List<String> resolveAnswerLines(String number, List<String> rawLines, Set<String> labels) {
        List<String> raw = rawLines.stream()
            .map(String::strip)
            .filter(line -> !line.isEmpty())
            .toList();

        warnOnRepeatedLabels(number, raw, labels);

        String preferredEcho = null;
        Set<String> kept = new LinkedHashSet<>();
        for (String line : raw) {
            if (labels.contains(line)) {
                if (preferredEcho == null) {
                    preferredEcho = line;
                }
                continue;
            }
            kept.add(line);
        }
        if (preferredEcho != null) {
            kept.add(preferredEcho);
        }
        return List.copyOf(kept);
    }

    private void warnOnRepeatedLabels(String number, List<String> raw, Set<String> labels) {
        if (labels.isEmpty()) {
            return;
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String line : raw) {
            if (labels.contains(line)) {
                counts.merge(line, 1, Integer::sum);
            }
        }
        counts.forEach((label, count) -> {
            if (count > 2) {
                log.warn("Question {} repeats choice label {} {} times in its answer lines",
                    number == null ? "(unnumbered)" : number, label, count);
            }
        });
    }

    static List<RichPart> compact(List<RichPart> parts) {
        List<RichPart> compacted = new ArrayList<>();
        for (RichPart part : parts) {
            if (part instanceof ImageRef) {
                compacted.add(part);
            } else if (part instanceof TextSegment segment && segment.text() != null) {
                String text = segment.text().strip();
                if (!text.isEmpty()) {
                    compacted.add(new TextSegment(text));
                }
            }
        }
        return List.copyOf(compacted);
    }
}
