package org.example.chapters.service;

import org.example.chapters.config.ChapterExportProperties;
import org.example.chapters.markup.ChapterMarkupParser;
import org.example.chapters.service.math.MathMarkupNormalizer;
import org.example.chapters.service.math.MathSpanCoalescer;

/**
 * Wires the real conversion pipeline without a Spring context.
 */
final class ChapterPipelineFixture {

    private ChapterPipelineFixture() {
    }

    static ChapterConversionService conversionService() {
        MathSpanCoalescer coalescer = new MathSpanCoalescer();
        return new ChapterConversionService(
            new ChapterMarkupParser(),
            new DraftMathPass(new MathMarkupNormalizer(coalescer)),
            new QuestionFinalizer(coalescer),
            new ImageUsageAggregator(),
            new MarkdownRenderer(new ChapterExportProperties())
        );
    }
}
