package org.example.chapters.service.math;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MathSpanCoalescerTest {

    private MathSpanCoalescer coalescer;

    @BeforeEach
    void setUp() {
        coalescer = new MathSpanCoalescer();
    }

    @Test
    void coalesceMergesSpansSeparatedByConnectors() {
        assertEquals("$x^{2}+y^{2} = 1$", coalescer.coalesce("$x^{2}$ + $y^{2}$ =1"));
        assertEquals("$a, b$", coalescer.coalesce("$a$, $b$"));
    }

    @Test
    void coalesceKeepsSpansSeparatedByWords() {
        assertEquals("$a$ and $b$", coalescer.coalesce("$a$ and $b$"));
    }

    @Test
    void coalesceLeavesTextWithoutMarkersUnchanged() {
        assertEquals("no math here", coalescer.coalesce("no math here"));
        assertNull(coalescer.coalesce(null));
    }

    @Test
    void coalesceKeepsUnpairedMarkerAsLiteralText() {
        assertEquals("costs $5", coalescer.coalesce("costs $5"));
    }

    @Test
    void coalesceDropsEmptySpans() {
        assertEquals("a  b", coalescer.coalesce("a $ $ b"));
    }

    @Test
    void coalesceIsIdempotent() {
        List<String> inputs = List.of(
            "$x^{2}$ + $y^{2}$ =1",
            "求 $x^{2}$ + $y^{2}$ =1 的图像",
            "$a$, $b$ and $( c + d )$",
            "$a$ + $b$ $",
            "$x = -1$，$y = 2$。"
        );
        for (String input : inputs) {
            String once = coalescer.coalesce(input);
            assertEquals(once, coalescer.coalesce(once), () -> "not stable for " + input);
        }
    }

    @Test
    void formatExpressionAppliesCanonicalSpacing() {
        assertEquals("(a+b)", coalescer.formatExpression("( a + b )"));
        assertEquals("x^{2}", coalescer.formatExpression("x ^ { 2 }"));
        assertEquals("a_{1}, a_{2}", coalescer.formatExpression("a _ {1} ,a_{2}"));
        assertEquals("y = -x", coalescer.formatExpression("y=- x"));
        assertEquals("", coalescer.formatExpression("   "));
    }
}
