package org.example.chapters.service;

import org.example.chapters.markup.ChapterMarkupParser;
import org.example.chapters.markup.MarkupText;
import org.example.chapters.model.Chapter;
import org.example.chapters.model.QuestionItem;
import org.example.chapters.model.Section;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.example.chapters.markup.MarkupVocabulary.BLOCK_TAG;
import static org.example.chapters.markup.MarkupVocabulary.QUESTION_NUMBERS;
import static org.example.chapters.markup.MarkupVocabulary.QUESTION_TITLE;

/**
 * Developer aid for debugging question parsing: shows each question title
 * node of a chapter next to the structured question it produced.
 */
@Service
public class QuestionInspectionService {

    private static final Logger log = LoggerFactory.getLogger(QuestionInspectionService.class);

    private final ChapterConversionService conversionService;

    public QuestionInspectionService(ChapterConversionService conversionService) {
        this.conversionService = conversionService;
    }

    public record QuestionInspection(
        int index,
        String number,
        Integer occurrence,
        String rawHtml,
        String flattenedText,
        QuestionItem structured
    ) {}

    /**
     * Lists question title nodes in document order.
     *
     * @param index  1-based node index; when set, {@code number} is ignored
     * @param number question number to keep
     * @param limit  maximum number of results, ignored when not positive
     * @throws QuestionNotFoundException when no node matches
     */
    public List<QuestionInspection> inspect(String markup, String chapterId,
                                            Integer index, String number, Integer limit) {
        Chapter chapter = conversionService.convert(markup, chapterId, Map.of()).chapter();
        Map<String, List<QuestionItem>> structuredByNumber = questionsByNumber(chapter);

        List<Element> nodes = Jsoup.parse(markup).select(BLOCK_TAG + "." + QUESTION_TITLE);
        Map<String, Integer> occurrences = new HashMap<>();
        List<String> availableNumbers = new ArrayList<>();
        List<QuestionInspection> matches = new ArrayList<>();

        for (int i = 0; i < nodes.size(); i++) {
            Element node = nodes.get(i);
            int nodeIndex = i + 1;
            String nodeNumber = ChapterMarkupParser.questionNumber(node).orElse(null);
            Integer occurrence = null;
            if (nodeNumber != null) {
                occurrence = occurrences.merge(nodeNumber, 1, Integer::sum);
                availableNumbers.add(nodeNumber);
            }

            boolean selected = index != null
                ? index == nodeIndex
                : number == null || number.isBlank() || number.strip().equals(nodeNumber);
            if (selected) {
                matches.add(new QuestionInspection(
                    nodeIndex,
                    nodeNumber,
                    occurrence,
                    node.outerHtml(),
                    flattenWithoutNumber(node),
                    structuredFor(structuredByNumber, nodeNumber, occurrence)
                ));
            }
        }

        if (matches.isEmpty()) {
            String hint = availableNumbers.isEmpty()
                ? ""
                : " Available question numbers: " + String.join(", ", availableNumbers);
            throw new QuestionNotFoundException("No matching questions found." + hint, availableNumbers);
        }
        if (limit != null && limit > 0 && matches.size() > limit) {
            matches = matches.subList(0, limit);
        }
        log.debug("Inspected chapter {}: {} of {} question nodes selected", chapterId, matches.size(), nodes.size());
        return List.copyOf(matches);
    }

    private String flattenWithoutNumber(Element node) {
        Element copy = node.clone();
        for (String numberClass : QUESTION_NUMBERS) {
            copy.select("span." + numberClass).remove();
        }
        return MarkupText.flatten(copy);
    }

    private Map<String, List<QuestionItem>> questionsByNumber(Chapter chapter) {
        Map<String, List<QuestionItem>> lookup = new LinkedHashMap<>();
        for (Section section : chapter.sections()) {
            section.items().stream()
                .filter(QuestionItem.class::isInstance)
                .map(QuestionItem.class::cast)
                .filter(question -> question.number() != null)
                .forEach(question -> lookup.computeIfAbsent(question.number(), key -> new ArrayList<>()).add(question));
        }
        return lookup;
    }

    private QuestionItem structuredFor(Map<String, List<QuestionItem>> lookup, String number, Integer occurrence) {
        if (number == null || occurrence == null) {
            return null;
        }
        List<QuestionItem> candidates = lookup.getOrDefault(number, List.of());
        return occurrence - 1 < candidates.size() ? candidates.get(occurrence - 1) : null;
    }
}
