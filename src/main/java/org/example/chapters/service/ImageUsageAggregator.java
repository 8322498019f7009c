package org.example.chapters.service;

import org.example.chapters.markup.ImageLedger;
import org.example.chapters.model.ChapterImage;
import org.example.chapters.model.Choice;
import org.example.chapters.model.ImageRef;
import org.example.chapters.model.ImageUsage;
import org.example.chapters.model.QuestionItem;
import org.example.chapters.model.RichPart;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-references the images a question uses with the local files the
 * downloader produced.
 */
@Component
public class ImageUsageAggregator {

    static final String QUESTION_CONTEXT = "question";
    static final String ANALYSIS_CONTEXT = "analysis";
    static final String CHOICE_CONTEXT_PREFIX = "choice:";

    public QuestionItem attachUsages(QuestionItem question, Map<String, String> imageFiles) {
        Map<String, UsageBuilder> usages = new LinkedHashMap<>();
        record(usages, question.questionRich(), QUESTION_CONTEXT, imageFiles);
        record(usages, question.questionExtra(), QUESTION_CONTEXT, imageFiles);
        record(usages, question.analysisLines(), ANALYSIS_CONTEXT, imageFiles);
        for (Choice choice : question.choices()) {
            record(usages, choice.content(), CHOICE_CONTEXT_PREFIX + choice.label(), imageFiles);
        }
        return question.withImages(usages.values().stream().map(UsageBuilder::build).toList());
    }

    public List<ChapterImage> chapterImages(ImageLedger ledger, Map<String, String> imageFiles) {
        return ledger.images().stream()
            .map(image -> new ChapterImage(image.url(), image.width(), image.height(),
                imageFiles.get(image.url())))
            .toList();
    }

    private void record(Map<String, UsageBuilder> usages, List<RichPart> parts, String context,
                        Map<String, String> imageFiles) {
        for (RichPart part : parts) {
            if (part instanceof ImageRef image) {
                usages.computeIfAbsent(image.url(), url -> new UsageBuilder(url, imageFiles.get(url)))
                    .add(image, context);
            }
        }
    }

    private static final class UsageBuilder {
        private final String url;
        private final String file;
        private ImageRef dimensions;
        private final List<String> contexts = new ArrayList<>();

        UsageBuilder(String url, String file) {
            this.url = url;
            this.file = file;
        }

        void add(ImageRef image, String context) {
            dimensions = dimensions == null ? image : dimensions.fillMissing(image);
            if (!contexts.contains(context)) {
                contexts.add(context);
            }
        }

        ImageUsage build() {
            return new ImageUsage(url, dimensions.width(), dimensions.height(), file, List.copyOf(contexts));
        }
    }
}
