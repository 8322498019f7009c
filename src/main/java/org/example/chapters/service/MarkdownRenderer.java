package org.example.chapters.service;

import org.example.chapters.config.ChapterExportProperties;
import org.example.chapters.model.Chapter;
import org.example.chapters.model.ChapterImage;
import org.example.chapters.model.ChapterItem;
import org.example.chapters.model.Choice;
import org.example.chapters.model.HeadingItem;
import org.example.chapters.model.ImageItem;
import org.example.chapters.model.ImageRef;
import org.example.chapters.model.QuestionItem;
import org.example.chapters.model.RichPart;
import org.example.chapters.model.Section;
import org.example.chapters.model.TextItem;
import org.example.chapters.model.TextSegment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a finished chapter as Markdown. Each block is separated from the
 * next by one blank line; image links point into the configured image
 * directory, and images without a local file link to their source URL.
 */
@Component
public class MarkdownRenderer {

    static final String QUESTION_IMAGE_ALT = "题图";
    static final String CHOICE_IMAGE_ALT = "选项图";
    static final String ANALYSIS_IMAGE_ALT = "解析图";
    static final String BLOCK_IMAGE_ALT = "图";
    static final String ANSWER_LABEL = "- **答案：**";
    static final String ANALYSIS_LABEL = "- **解析：**";

    private static final int MIN_HEADING_LEVEL = 3;

    private final ChapterExportProperties properties;

    public MarkdownRenderer(ChapterExportProperties properties) {
        this.properties = properties;
    }

    public String render(Chapter chapter) {
        Map<String, String> files = new HashMap<>();
        for (ChapterImage image : chapter.images()) {
            if (image.file() != null) {
                files.put(image.url(), image.file());
            }
        }

        List<String> blocks = new ArrayList<>();
        if (!isBlank(chapter.title())) {
            blocks.add("# " + chapter.title());
        }
        for (Section section : chapter.sections()) {
            if (!isBlank(section.title())) {
                blocks.add("## " + section.title());
            }
            for (ChapterItem item : section.items()) {
                String rendered = renderItem(item, files);
                if (!rendered.isBlank()) {
                    blocks.add(rendered);
                }
            }
        }
        return String.join("\n\n", blocks).strip();
    }

    private String renderItem(ChapterItem item, Map<String, String> files) {
        if (item instanceof HeadingItem heading) {
            return "#".repeat(Math.max(MIN_HEADING_LEVEL, heading.level())) + " " + heading.text();
        }
        if (item instanceof TextItem text) {
            return text.text();
        }
        if (item instanceof ImageItem image) {
            return image(image.image(), BLOCK_IMAGE_ALT, files);
        }
        if (item instanceof QuestionItem question) {
            return renderQuestion(question, files);
        }
        throw new IllegalArgumentException("Unsupported chapter item: " + item.getClass().getSimpleName());
    }

    private String renderQuestion(QuestionItem question, Map<String, String> files) {
        List<String> lines = new ArrayList<>();

        String prefix = isBlank(question.number()) ? "" : question.number() + ". ";
        String questionLine = question.questionRich().isEmpty()
            ? question.question()
            : joinParts(question.questionRich(), QUESTION_IMAGE_ALT, files);
        lines.add("**" + prefix + questionLine + "**");

        for (RichPart extra : question.questionExtra()) {
            lines.add(part(extra, QUESTION_IMAGE_ALT, files));
        }

        if (!question.choices().isEmpty()) {
            lines.add("");
            for (Choice choice : question.choices()) {
                lines.addAll(renderChoice(choice, files));
            }
        }

        List<String> answers = question.answerLines();
        if (answers.size() == 1) {
            lines.add(ANSWER_LABEL + " " + answers.get(0));
        } else if (answers.size() > 1) {
            lines.add(ANSWER_LABEL);
            for (String answer : answers) {
                lines.add("  - " + answer);
            }
        }

        List<RichPart> analysis = question.analysisLines();
        if (analysis.size() == 1 && analysis.get(0) instanceof TextSegment only) {
            lines.add(ANALYSIS_LABEL + " " + only.text());
        } else if (!analysis.isEmpty()) {
            lines.add(ANALYSIS_LABEL);
            for (RichPart entry : analysis) {
                lines.add("  " + part(entry, ANALYSIS_IMAGE_ALT, files));
            }
        }

        return String.join("\n", lines);
    }

    /**
     * The choice line carries its text and first image; any further images
     * go on indented lines placed before it.
     */
    private List<String> renderChoice(Choice choice, Map<String, String> files) {
        List<String> texts = new ArrayList<>();
        List<ImageRef> images = new ArrayList<>();
        for (RichPart part : choice.content()) {
            if (part instanceof TextSegment segment) {
                texts.add(segment.text());
            } else if (part instanceof ImageRef image) {
                images.add(image);
            }
        }

        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder("- ").append(choice.label()).append('.');
        if (!texts.isEmpty()) {
            line.append(' ').append(String.join(" ", texts));
        }
        if (!images.isEmpty()) {
            line.append(' ').append(image(images.get(0), CHOICE_IMAGE_ALT, files));
            for (ImageRef extra : images.subList(1, images.size())) {
                lines.add("  " + image(extra, CHOICE_IMAGE_ALT, files));
            }
        }
        lines.add(line.toString().stripTrailing());
        return lines;
    }

    private String joinParts(List<RichPart> parts, String alt, Map<String, String> files) {
        List<String> rendered = new ArrayList<>();
        for (RichPart part : parts) {
            String piece = part(part, alt, files);
            if (!piece.isEmpty()) {
                rendered.add(piece);
            }
        }
        return String.join(" ", rendered).strip();
    }

    private String part(RichPart part, String alt, Map<String, String> files) {
        if (part instanceof ImageRef image) {
            return image(image, alt, files);
        }
        return part instanceof TextSegment segment ? segment.text() : "";
    }

    private String image(ImageRef image, String alt, Map<String, String> files) {
        String file = files.get(image.url());
        if (file != null) {
            return "![" + alt + "](" + properties.getImageDir() + "/" + file + ")";
        }
        return "[图像未下载](" + image.url() + ")";
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
