package org.example.chapters.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.example.chapters.config.ChapterExportProperties;
import org.example.chapters.model.Chapter;
import org.example.chapters.model.ChapterImage;
import org.example.chapters.service.ChapterConversionService.ConvertedChapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Converts a chapter and writes {@code chapter.json} and {@code chapter.md}
 * into {@code <output-dir>/<chapter id>/}.
 */
@Service
public class ChapterExportService {

    private static final Logger log = LoggerFactory.getLogger(ChapterExportService.class);

    static final String JSON_FILE = "chapter.json";
    static final String MARKDOWN_FILE = "chapter.md";

    private final ChapterConversionService conversionService;
    private final ChapterExportProperties properties;
    private final ObjectMapper objectMapper;

    public ChapterExportService(ChapterConversionService conversionService,
                                ChapterExportProperties properties,
                                ObjectMapper objectMapper) {
        this.conversionService = conversionService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public record ExportResult(
        String chapterId,
        String jsonPath,
        String markdownPath,
        int imageCount,
        int resolvedImageCount
    ) {}

    public ExportResult export(String markup, String chapterId, Map<String, String> imageFiles) {
        ConvertedChapter converted = conversionService.convert(markup, chapterId, imageFiles);
        return write(converted);
    }

    public ExportResult write(ConvertedChapter converted) {
        Chapter chapter = converted.chapter();
        Path chapterDir = chapterDirectory(chapter.id());
        Path jsonPath = chapterDir.resolve(JSON_FILE);
        Path markdownPath = chapterDir.resolve(MARKDOWN_FILE);

        ObjectWriter writer = properties.isPrettyPrint()
            ? objectMapper.writerWithDefaultPrettyPrinter()
            : objectMapper.writer();
        try {
            Files.createDirectories(chapterDir);
            writer.writeValue(jsonPath.toFile(), chapter);
            Files.writeString(markdownPath, converted.markdown() + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write chapter " + chapter.id() + " to " + chapterDir, e);
        }

        int resolved = (int) chapter.images().stream()
            .map(ChapterImage::file)
            .filter(file -> file != null)
            .count();
        log.info("Exported chapter {} to {} ({} of {} images resolved)",
            chapter.id(), chapterDir, resolved, chapter.images().size());
        return new ExportResult(chapter.id(), jsonPath.toString(), markdownPath.toString(),
            chapter.images().size(), resolved);
    }

    private Path chapterDirectory(String chapterId) {
        Path outputDir = Paths.get(properties.getOutputDir()).toAbsolutePath().normalize();
        Path chapterDir = outputDir.resolve(chapterId).normalize();
        if (chapterDir.getParent() == null || !chapterDir.getParent().equals(outputDir)) {
            throw new IllegalArgumentException("Chapter id is not a valid directory name: " + chapterId);
        }
        return chapterDir;
    }
}
