package org.example.chapters.service;

import org.example.chapters.markup.ParsedChapter;
import org.example.chapters.service.math.MathMarkupNormalizer;
import org.springframework.stereotype.Component;

/**
 * Runs the math normalizer over every leaf string of a parsed chapter, in
 * place, before questions are finalized.
 */
@Component
public class DraftMathPass {

    private final MathMarkupNormalizer normalizer;

    public DraftMathPass(MathMarkupNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public void apply(ParsedChapter chapter) {
        chapter.rewriteText(normalizer::normalize);
    }
}
