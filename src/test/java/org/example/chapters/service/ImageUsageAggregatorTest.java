package org.example.chapters.service;

import org.example.chapters.markup.ImageLedger;
import org.example.chapters.model.ChapterImage;
import org.example.chapters.model.Choice;
import org.example.chapters.model.ImageRef;
import org.example.chapters.model.ImageUsage;
import org.example.chapters.model.QuestionItem;
import org.example.chapters.model.TextSegment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ImageUsageAggregatorTest {

    private static final String FIGURE = "http://img/figure.png";
    private static final String SKETCH = "http://img/sketch.png";

    private ImageUsageAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new ImageUsageAggregator();
    }

    @Test
    void attachUsagesRecordsEveryContextOncePerUrl() {
        QuestionItem question = new QuestionItem(
            "1",
            "See [图1]",
            List.of(new TextSegment("See"), new ImageRef(FIGURE, "100", null)),
            List.of(
                new Choice("A", List.of(new ImageRef(FIGURE, null, "60"))),
                new Choice("B", List.of(new TextSegment("none"), new ImageRef(FIGURE, "1", "1")))
            ),
            List.of("A"),
            "A",
            List.of(new ImageRef(SKETCH, null, null), new ImageRef(SKETCH, null, null)),
            null,
            List.of(new ImageRef(FIGURE, null, null)),
            List.of()
        );

        QuestionItem result = aggregator.attachUsages(question, Map.of(FIGURE, "figure.png"));

        assertEquals(List.of(
            new ImageUsage(FIGURE, "100", "60", "figure.png", List.of("question", "choice:A", "choice:B")),
            new ImageUsage(SKETCH, null, null, null, List.of("analysis"))
        ), result.images());
        assertEquals(question.questionRich(), result.questionRich());
    }

    @Test
    void attachUsagesLeavesQuestionWithoutImagesEmpty() {
        QuestionItem question = new QuestionItem("2", "Plain", List.of(new TextSegment("Plain")), List.of(),
            List.of(), null, List.of(), null, List.of(), List.of());

        assertTrue(aggregator.attachUsages(question, Map.of()).images().isEmpty());
    }

    @Test
    void chapterImagesFollowLedgerOrderWithResolvedFiles() {
        ImageLedger ledger = new ImageLedger();
        ledger.register(new ImageRef(SKETCH, "20", "10"));
        ledger.register(new ImageRef(FIGURE, null, null));

        List<ChapterImage> images = aggregator.chapterImages(ledger, Map.of(FIGURE, "figure.png"));

        assertEquals(List.of(
            new ChapterImage(SKETCH, "20", "10", null),
            new ChapterImage(FIGURE, null, null, "figure.png")
        ), images);
    }
}
