package org.example.chapters.markup;

import java.util.function.UnaryOperator;

/**
 * A section entry while the chapter is still being assembled.
 */
public interface ItemDraft {

    /**
     * Rewrites every text leaf of this entry in place.
     */
    void rewriteText(UnaryOperator<String> rewriter);
}
