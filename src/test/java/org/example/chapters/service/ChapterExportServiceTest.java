package org.example.chapters.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.chapters.config.ChapterExportProperties;
import org.example.chapters.model.Chapter;
import org.example.chapters.model.ChapterImage;
import org.example.chapters.model.Choice;
import org.example.chapters.model.ImageRef;
import org.example.chapters.model.ImageUsage;
import org.example.chapters.model.QuestionItem;
import org.example.chapters.model.Section;
import org.example.chapters.model.TextItem;
import org.example.chapters.model.TextSegment;
import org.example.chapters.service.ChapterConversionService.ConvertedChapter;
import org.example.chapters.service.ChapterExportService.ExportResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChapterExportServiceTest {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @Mock
    private ChapterConversionService conversionService;

    @TempDir
    Path tempDir;

    private ChapterExportService exportService;

    @BeforeEach
    void setUp() {
        ChapterExportProperties properties = new ChapterExportProperties();
        properties.setOutputDir(tempDir.toString());
        exportService = new ChapterExportService(conversionService, properties, OBJECT_MAPPER);
    }

    @Test
    void exportWritesJsonAndMarkdownIntoChapterDirectory() throws Exception {
        ImageRef figure = new ImageRef("http://img/f.png", "10", "20");
        QuestionItem question = new QuestionItem("1", "Q", List.of(new TextSegment("Q")),
            List.of(new Choice("A", List.of(figure))), List.of("A"), "A", List.of(), null, List.of(),
            List.of(new ImageUsage(figure.url(), "10", "20", "f.png", List.of("choice:A"))));
        Chapter chapter = new Chapter("c-1", "Title", List.of(
            new Section(null, List.of(new TextItem("Intro"), question))
        ), List.of(
            new ChapterImage(figure.url(), "10", "20", "f.png"),
            new ChapterImage("http://img/g.png", null, null, null)
        ));
        when(conversionService.convert("<p>Intro</p>", "c-1", Map.of()))
            .thenReturn(new ConvertedChapter(chapter, "# Title\n\nIntro"));

        ExportResult result = exportService.export("<p>Intro</p>", "c-1", Map.of());

        Path chapterDir = tempDir.resolve("c-1");
        assertEquals("c-1", result.chapterId());
        assertEquals(chapterDir.resolve("chapter.json").toString(), result.jsonPath());
        assertEquals(2, result.imageCount());
        assertEquals(1, result.resolvedImageCount());
        assertEquals("# Title\n\nIntro\n",
            Files.readString(chapterDir.resolve("chapter.md"), StandardCharsets.UTF_8));

        JsonNode root = OBJECT_MAPPER.readTree(chapterDir.resolve("chapter.json").toFile());
        assertEquals("c-1", root.get("id").asText());
        JsonNode items = root.get("sections").get(0).get("items");
        assertEquals("text", items.get(0).get("type").asText());
        assertEquals("qa", items.get(1).get("type").asText());
        assertEquals("Q", items.get(1).get("question_rich").get(0).get("text").asText());
        assertEquals("image", items.get(1).get("choices").get(0).get("content").get(0).get("type").asText());
        assertEquals("http://img/f.png", items.get(1).get("choices").get(0).get("images").get(0).get("url").asText());
        assertEquals("A", items.get(1).get("answer_lines").get(0).asText());
        assertTrue(items.get(1).get("analysis").isNull());
        assertEquals("choice:A", items.get(1).get("images").get(0).get("contexts").get(0).asText());
        assertTrue(root.get("images").get(1).get("file").isNull());
    }

    @Test
    void writeRejectsChapterIdOutsideOutputDirectory() {
        Chapter chapter = new Chapter("../escape", "", List.of(), List.of());

        assertThrows(IllegalArgumentException.class,
            () -> exportService.write(new ConvertedChapter(chapter, "")));
        assertFalse(Files.exists(tempDir.resolveSibling("escape")));
    }
}
