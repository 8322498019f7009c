package org.example.chapters.service;

import org.example.chapters.markup.BlockDraft;
import org.example.chapters.markup.ChapterMarkupParser;
import org.example.chapters.markup.ItemDraft;
import org.example.chapters.markup.ParsedChapter;
import org.example.chapters.markup.QuestionAccumulator;
import org.example.chapters.markup.SectionDraft;
import org.example.chapters.model.Chapter;
import org.example.chapters.model.ChapterItem;
import org.example.chapters.model.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs one chapter through parse, math normalization, question
 * finalization, image aggregation and Markdown rendering.
 *
 * <p>Callers that download images themselves can {@link #parse} first, use
 * {@link ParsedChapter#imageUrls()} to fetch them and then {@link #assemble}
 * with the resulting URL to file map.
 */
@Service
public class ChapterConversionService {

    private static final Logger log = LoggerFactory.getLogger(ChapterConversionService.class);

    private final ChapterMarkupParser parser;
    private final DraftMathPass mathPass;
    private final QuestionFinalizer finalizer;
    private final ImageUsageAggregator imageAggregator;
    private final MarkdownRenderer renderer;

    public ChapterConversionService(ChapterMarkupParser parser,
                                    DraftMathPass mathPass,
                                    QuestionFinalizer finalizer,
                                    ImageUsageAggregator imageAggregator,
                                    MarkdownRenderer renderer) {
        this.parser = parser;
        this.mathPass = mathPass;
        this.finalizer = finalizer;
        this.imageAggregator = imageAggregator;
        this.renderer = renderer;
    }

    public record ConvertedChapter(
        Chapter chapter,
        String markdown
    ) {}

    /**
     * Parses the markup and normalizes its text in place. The result is
     * ready for {@link #assemble}.
     */
    public ParsedChapter parse(String markup, String chapterId) {
        ParsedChapter parsed = parser.parse(markup, chapterId);
        mathPass.apply(parsed);
        return parsed;
    }

    public Chapter assemble(ParsedChapter parsed, Map<String, String> imageFiles) {
        Map<String, String> files = imageFiles == null ? Map.of() : imageFiles;

        List<Section> sections = new ArrayList<>();
        int questionCount = 0;
        for (SectionDraft draft : parsed.sections()) {
            List<ChapterItem> items = new ArrayList<>();
            for (ItemDraft item : draft.items()) {
                if (item instanceof QuestionAccumulator question) {
                    items.add(imageAggregator.attachUsages(finalizer.finalizeQuestion(question), files));
                    questionCount++;
                } else if (item instanceof BlockDraft block) {
                    items.add(block.item());
                }
            }
            sections.add(new Section(draft.title(), List.copyOf(items)));
        }

        Chapter chapter = new Chapter(
            parsed.id(),
            parsed.title(),
            List.copyOf(sections),
            imageAggregator.chapterImages(parsed.images(), files)
        );
        log.info("Assembled chapter {}: {} sections, {} questions, {} images",
            chapter.id(), sections.size(), questionCount, chapter.images().size());
        return chapter;
    }

    public String render(Chapter chapter) {
        return renderer.render(chapter);
    }

    public ConvertedChapter convert(String markup, String chapterId, Map<String, String> imageFiles) {
        Chapter chapter = assemble(parse(markup, chapterId), imageFiles);
        return new ConvertedChapter(chapter, renderer.render(chapter));
    }
}
