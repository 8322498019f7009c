package org.example.chapters.markup;

import java.util.List;

/**
 * Class names, attributes and literal prefixes used by the reader's chapter
 * markup. Changing any of these breaks compatibility with the source pages.
 */
public final class MarkupVocabulary {

    public static final String BLOCK_TAG = "p";

    public static final String CHAPTER_TITLE = "ArtH1";
    public static final String SECTION_TITLE = "ArtH2";
    public static final String SPLIT = "PSplit";
    public static final String HEADING = "TiXing";
    public static final String QUESTION_TITLE = "QuestionTitle";
    public static final List<String> QUESTION_NUMBERS = List.of("QuestionNum1", "QuestionNum2");

    public static final String TAG_BOX = "TagBoxP";
    public static final String ANSWER_SPAN = "span.answer";
    public static final String RESOLVE_SPAN = "span.ResolveTag";

    public static final String IMAGE_CLASS = "img";
    public static final String IMAGE_SPAN = "span.img";
    public static final String IMAGE_SRC = "data-src";
    public static final String IMAGE_SRC_FALLBACK = "data-sr";
    public static final String IMAGE_WIDTH = "data-width";
    public static final String IMAGE_HEIGHT = "data-height";

    public static final String ANSWER_PREFIX = "【答案】";
    public static final String ANALYSIS_PREFIX = "【解析】";

    private MarkupVocabulary() {
    }
}
