package org.example.chapters.service;

import org.example.chapters.markup.ChapterParseException;
import org.example.chapters.markup.ParsedChapter;
import org.example.chapters.model.Chapter;
import org.example.chapters.model.ChapterImage;
import org.example.chapters.model.Choice;
import org.example.chapters.model.ImageRef;
import org.example.chapters.model.ImageUsage;
import org.example.chapters.model.QuestionItem;
import org.example.chapters.model.TextItem;
import org.example.chapters.model.TextSegment;
import org.example.chapters.service.ChapterConversionService.ConvertedChapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChapterConversionServiceTest {

    private ChapterConversionService service;

    @BeforeEach
    void setUp() {
        service = ChapterPipelineFixture.conversionService();
    }

    @Test
    void convertProducesFinalizedChoiceQuestion() {
        String html = """
            <p class="ArtH1">第一章</p>
            <p class="ArtH2">一、选择题</p>
            <p class="QuestionTitle"><span class="QuestionNum1">4．</span>Which color is warm?</p>
            <p>A．red</p>
            <p>B．blue</p>
            <p class="TagBoxP"><span class="answer">A</span></p>
            <p class="TagBoxP"><span class="ResolveTag">解析</span>because red is correct</p>
            """;

        ConvertedChapter converted = service.convert(html, "c-1", Map.of());

        Chapter chapter = converted.chapter();
        assertEquals("第一章", chapter.title());
        QuestionItem question = (QuestionItem) chapter.sections().get(0).items().get(0);
        assertEquals("4", question.number());
        assertEquals("Which color is warm?", question.question());
        assertEquals(List.of(
            new Choice("A", List.of(new TextSegment("red"))),
            new Choice("B", List.of(new TextSegment("blue")))
        ), question.choices());
        assertEquals(List.of("A"), question.answerLines());
        assertEquals("A", question.answer());
        assertEquals("because red is correct", question.analysis());

        String expectedMarkdown = """
            # 第一章

            ## 一、选择题

            **4. Which color is warm?**

            - A. red
            - B. blue
            - **答案：** A
            - **解析：** because red is correct""";
        assertEquals(expectedMarkdown, converted.markdown());
    }

    @Test
    void convertNormalizesMathInQuestionText() {
        String html = """
            <p class="QuestionTitle"><span class="QuestionNum1">1.</span>x<sup>2</sup>+y<sup>2</sup>=1</p>
            <p>A．a<sub>1</sub><sub>2</sub></p>
            """;

        QuestionItem question = (QuestionItem) service.convert(html, "c-2", Map.of())
            .chapter().sections().get(0).items().get(0);

        assertEquals("$x^{2}+y^{2} = 1$", question.question());
        assertEquals(List.of(new TextSegment("$x^{2}+y^{2} = 1$")), question.questionRich());
        assertEquals(List.of(new TextSegment("$a_{12}$")), question.choices().get(0).content());
    }

    @Test
    void convertAttachesImageUsagesAndResolvesFiles() {
        String html = """
            <p class="QuestionTitle"><span class="QuestionNum1">2．</span>看图<span class="img" data-src="http://img/q.png" data-width="120" data-height="80"></span>回答</p>
            <p>A．<span class="img" data-src="http://img/a.png" data-width="30"></span></p>
            <p>B．<span class="img" data-src="http://img/q.png"></span></p>
            <p class="TagBoxP"><span class="answer">B</span></p>
            <p><span class="img" data-src="http://img/s.png"></span></p>
            """;

        ConvertedChapter converted = service.convert(html, "c-3", Map.of("http://img/q.png", "q.png"));

        Chapter chapter = converted.chapter();
        assertEquals(List.of(
            new ChapterImage("http://img/q.png", "120", "80", "q.png"),
            new ChapterImage("http://img/a.png", "30", null, null),
            new ChapterImage("http://img/s.png", null, null, null)
        ), chapter.images());

        QuestionItem question = (QuestionItem) chapter.sections().get(0).items().get(0);
        assertEquals("看图 [图1] 回答", question.question());
        assertEquals(List.of("B"), question.answerLines());
        assertEquals(List.of(new ImageRef("http://img/s.png", null, null)), question.analysisLines());
        assertNull(question.analysis());
        assertEquals(List.of(
            new ImageUsage("http://img/q.png", "120", "80", "q.png", List.of("question", "choice:B")),
            new ImageUsage("http://img/s.png", null, null, null, List.of("analysis")),
            new ImageUsage("http://img/a.png", "30", null, null, List.of("choice:A"))
        ), question.images());

        String markdown = converted.markdown();
        assertTrue(markdown.contains("**2. 看图 ![题图](images/q.png) 回答**"));
        assertTrue(markdown.contains("- A. [图像未下载](http://img/a.png)"));
        assertTrue(markdown.contains("- B. ![选项图](images/q.png)"));
        assertTrue(markdown.contains("- **解析：**\n  [图像未下载](http://img/s.png)"));
    }

    @Test
    void parseThenAssembleLetsCallerResolveImagesInBetween() {
        String html = """
            <p>Figure 1</p>
            <p><span class="img" data-src="http://img/f1.png"></span></p>
            """;

        ParsedChapter parsed = service.parse(html, "c-4");
        Map<String, String> files = Map.of(parsed.imageUrls().get(0), "f1.png");
        Chapter chapter = service.assemble(parsed, files);

        assertEquals(new TextItem("Figure 1"), chapter.sections().get(0).items().get(0));
        assertEquals("f1.png", chapter.images().get(0).file());
        assertEquals("Figure 1\n\n![图](images/f1.png)", service.render(chapter));
    }

    @Test
    void convertSeparatesDeferredEchoFromExplanation() {
        String html = """
            <p class="QuestionTitle"><span class="QuestionNum2">9．</span>Pick</p>
            <p>A．one</p>
            <p>C．three</p>
            <p class="TagBoxP"><span class="answer">A</span></p>
            <p>【答案】A,C explanation</p>
            """;

        QuestionItem question = (QuestionItem) service.convert(html, "c-5", null)
            .chapter().sections().get(0).items().get(0);

        assertEquals(List.of("A,C explanation", "A"), question.answerLines());
    }

    @Test
    void convertRejectsEmptyMarkup() {
        assertThrows(ChapterParseException.class, () -> service.convert("", "c-6", Map.of()));
    }
}
