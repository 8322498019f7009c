package org.example.chapters.markup;

import org.example.chapters.markup.BlockRule.Block;
import org.example.chapters.model.HeadingItem;
import org.example.chapters.model.ImageItem;
import org.example.chapters.model.ImageRef;
import org.example.chapters.model.RichPart;
import org.example.chapters.model.TextItem;
import org.example.chapters.model.TextSegment;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import static org.example.chapters.markup.MarkupVocabulary.ANALYSIS_PREFIX;
import static org.example.chapters.markup.MarkupVocabulary.ANSWER_PREFIX;
import static org.example.chapters.markup.MarkupVocabulary.ANSWER_SPAN;
import static org.example.chapters.markup.MarkupVocabulary.CHAPTER_TITLE;
import static org.example.chapters.markup.MarkupVocabulary.HEADING;
import static org.example.chapters.markup.MarkupVocabulary.IMAGE_SPAN;
import static org.example.chapters.markup.MarkupVocabulary.QUESTION_NUMBERS;
import static org.example.chapters.markup.MarkupVocabulary.QUESTION_TITLE;
import static org.example.chapters.markup.MarkupVocabulary.RESOLVE_SPAN;
import static org.example.chapters.markup.MarkupVocabulary.SECTION_TITLE;
import static org.example.chapters.markup.MarkupVocabulary.SPLIT;
import static org.example.chapters.markup.MarkupVocabulary.TAG_BOX;

/**
 * Reads a decrypted chapter document into sections, headings, text blocks,
 * images and questions.
 */
@Service
public class ChapterMarkupParser {

    private static final Logger log = LoggerFactory.getLogger(ChapterMarkupParser.class);

    private static final int HEADING_LEVEL = 3;

    // Trailing punctuation after a question number, e.g. "4．" or "12)"
    private static final Pattern NUMBER_TRAILER = Pattern.compile("[．.、)）：:\\s]+$");

    // Block containers the HTML tree builder moves out of an enclosing <p>
    private static final Set<String> LIFTED_BLOCKS = Set.of(
        "div", "table", "ul", "ol", "dl", "blockquote", "pre", "section");

    private final List<BlockRule> rules = List.of(
        new BlockRule("chapter-title",
            (block, session) -> block.isParagraphWithClass(CHAPTER_TITLE),
            (block, session) -> session.setChapterTitle(block.text())),
        new BlockRule("section-title",
            (block, session) -> block.isParagraphWithClass(SECTION_TITLE),
            (block, session) -> session.openSection(block.text())),
        new BlockRule("split",
            (block, session) -> block.isParagraphWithClass(SPLIT) && block.text().isEmpty(),
            (block, session) -> { }),
        new BlockRule("answer-tag",
            (block, session) -> isTagBox(block, session, ANSWER_SPAN),
            this::onAnswerTag),
        new BlockRule("resolve-tag",
            (block, session) -> isTagBox(block, session, RESOLVE_SPAN),
            this::onResolveTag),
        new BlockRule("heading",
            (block, session) -> block.isParagraphWithClass(HEADING),
            this::onHeading),
        new BlockRule("question-start",
            (block, session) -> block.isParagraphWithClass(QUESTION_TITLE),
            this::onQuestionStart),
        new BlockRule("answer-prefix",
            (block, session) -> block.isParagraph() && block.text().startsWith(ANSWER_PREFIX),
            (block, session) -> onPrefixedLine(block, session, ANSWER_PREFIX, true)),
        new BlockRule("analysis-prefix",
            (block, session) -> block.isParagraph() && block.text().startsWith(ANALYSIS_PREFIX),
            (block, session) -> onPrefixedLine(block, session, ANALYSIS_PREFIX, false)),
        new BlockRule("free-text",
            (block, session) -> block.isParagraph(),
            this::onFreeText),
        new BlockRule("standalone-image",
            (block, session) -> block.element().normalName().equals("span") && MarkupText.isImage(block.element()),
            (block, session) -> routeImage(block.element(), session)),
        new BlockRule("lifted-block",
            (block, session) -> LIFTED_BLOCKS.contains(block.element().normalName())
                && session.openQuestion().isPresent(),
            this::onLiftedBlock)
    );

    public ParsedChapter parse(String markup, String chapterId) {
        if (chapterId == null || chapterId.isBlank()) {
            throw new ChapterParseException("Chapter id is required");
        }
        if (markup == null || markup.isBlank()) {
            throw new ChapterParseException("Chapter markup for " + chapterId + " is empty");
        }

        Document doc;
        try {
            doc = Jsoup.parse(markup);
        } catch (RuntimeException e) {
            throw new ChapterParseException("Failed to parse markup for chapter " + chapterId, e);
        }

        ParseSession session = new ParseSession(new ParsedChapter(chapterId.strip()));
        for (Element element : doc.body().children()) {
            classify(element, session);
        }

        ParsedChapter chapter = session.chapter();
        log.debug("Parsed chapter {}: {} sections, {} images",
            chapter.id(), chapter.sections().size(), chapter.images().size());
        return chapter;
    }

    /**
     * Names of the classification rules in the order they are tried.
     */
    public List<String> ruleNames() {
        return rules.stream().map(BlockRule::name).toList();
    }

    /**
     * Applies the first matching rule to a top-level node and returns its
     * name, or empty when the node was skipped.
     */
    Optional<String> classify(Element element, ParseSession session) {
        Block block = new Block(element, MarkupText.flatten(element));
        for (BlockRule rule : rules) {
            if (rule.matches().test(block, session)) {
                rule.handler().accept(block, session);
                return Optional.of(rule.name());
            }
        }
        log.debug("Skipping unclassified <{}> node (classes: {})", element.normalName(), element.classNames());
        return Optional.empty();
    }

    private boolean isTagBox(Block block, ParseSession session, String spanSelector) {
        return block.isParagraphWithClass(TAG_BOX)
            && session.openQuestion().isPresent()
            && block.element().selectFirst(spanSelector) != null;
    }

    private void onAnswerTag(Block block, ParseSession session) {
        Element answer = block.element().selectFirst(ANSWER_SPAN);
        session.openQuestion().ifPresent(question -> question.addAnswerLine(MarkupText.flatten(answer)));
    }

    private void onResolveTag(Block block, ParseSession session) {
        // Drop the "resolve" label and keep what follows it
        Element copy = block.element().clone();
        copy.select(RESOLVE_SPAN).remove();
        String text = MarkupText.flatten(copy);
        session.openQuestion().ifPresent(question -> question.addAnalysisLine(text));
    }

    private void onHeading(Block block, ParseSession session) {
        session.closeQuestion();
        session.addItem(new BlockDraft(new HeadingItem(HEADING_LEVEL, block.text())));
    }

    private void onQuestionStart(Block block, ParseSession session) {
        Element node = block.element().clone();
        String number = extractNumber(node);

        List<RichPart> parts = new ArrayList<>();
        StringBuilder pending = new StringBuilder();
        for (Node child : node.childNodes()) {
            if (child instanceof Element element && MarkupText.isImage(element)) {
                Optional<ImageRef> image = MarkupText.imageRef(element);
                if (image.isEmpty()) {
                    continue;
                }
                flushText(pending, parts);
                parts.add(image.get());
                session.registerImage(image.get());
            } else {
                pending.append(MarkupText.stringify(child));
            }
        }
        flushText(pending, parts);

        session.startQuestion(new QuestionAccumulator(number, parts, MarkupText.flatten(node)));
    }

    private String extractNumber(Element node) {
        Optional<String> number = questionNumber(node);
        numberSpan(node).ifPresent(Element::remove);
        return number.orElse(null);
    }

    /**
     * The number carried by a question title node, without its trailing
     * punctuation ({@code "4．"} reads as {@code "4"}).
     */
    public static Optional<String> questionNumber(Element node) {
        return numberSpan(node)
            .map(span -> NUMBER_TRAILER.matcher(MarkupText.flatten(span)).replaceAll(""))
            .filter(number -> !number.isEmpty());
    }

    private static Optional<Element> numberSpan(Element node) {
        for (String numberClass : QUESTION_NUMBERS) {
            Element span = node.selectFirst("span." + numberClass);
            if (span != null) {
                return Optional.of(span);
            }
        }
        return Optional.empty();
    }

    private void flushText(StringBuilder pending, List<RichPart> parts) {
        String text = MarkupText.clean(pending.toString());
        pending.setLength(0);
        if (!text.isEmpty()) {
            parts.add(new TextSegment(text));
        }
    }

    private void onPrefixedLine(Block block, ParseSession session, String prefix, boolean answer) {
        Optional<QuestionAccumulator> question = session.openQuestion();
        if (question.isEmpty()) {
            session.addItem(new BlockDraft(new TextItem(block.text())));
            return;
        }
        String line = block.text().substring(prefix.length()).strip();
        if (answer) {
            question.get().addAnswerLine(line);
        } else {
            question.get().addAnalysisLine(line);
        }
    }

    /**
     * A container that sat inside a question paragraph in the source. Its
     * text, and any loose text that followed it up to the next element,
     * is one free text line of the open question.
     */
    private void onLiftedBlock(Block block, ParseSession session) {
        StringBuilder text = new StringBuilder(MarkupText.stringify(block.element()));
        Node sibling = block.element().nextSibling();
        while (sibling instanceof TextNode textNode) {
            text.append(textNode.getWholeText());
            sibling = sibling.nextSibling();
        }
        onFreeText(new Block(block.element(), MarkupText.clean(text.toString())), session);
    }

    private void onFreeText(Block block, ParseSession session) {
        String text = block.text();
        if (!text.isEmpty()) {
            Optional<QuestionAccumulator> question = session.openQuestion();
            if (question.isPresent()) {
                question.get().addText(text);
            } else {
                session.addItem(new BlockDraft(new TextItem(text)));
            }
        }

        for (Element image : block.element().select(IMAGE_SPAN)) {
            routeImage(image, session);
        }
    }

    private void routeImage(Element element, ParseSession session) {
        Optional<ImageRef> image = MarkupText.imageRef(element);
        if (image.isEmpty()) {
            log.debug("Skipping image marker without a URL");
            return;
        }
        session.registerImage(image.get());
        Optional<QuestionAccumulator> question = session.openQuestion();
        if (question.isPresent()) {
            question.get().addImage(image.get());
        } else {
            session.addItem(new BlockDraft(new ImageItem(image.get())));
        }
    }
}
