package org.example.chapters.markup;

import org.jsoup.nodes.Element;

import java.util.function.BiConsumer;
import java.util.function.BiPredicate;

/**
 * One entry of the block classification table. Rules are tried in table
 * order and the first whose predicate matches handles the block.
 */
public record BlockRule(
    String name,
    BiPredicate<Block, ParseSession> matches,
    BiConsumer<Block, ParseSession> handler
) {

    /**
     * A top-level node together with its flattened text.
     */
    public record Block(Element element, String text) {

        public boolean isParagraph() {
            return element.normalName().equals(MarkupVocabulary.BLOCK_TAG);
        }

        public boolean isParagraphWithClass(String className) {
            return isParagraph() && element.hasClass(className);
        }
    }
}
