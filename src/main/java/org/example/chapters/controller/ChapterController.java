package org.example.chapters.controller;

import org.example.chapters.markup.ChapterParseException;
import org.example.chapters.service.ChapterConversionService;
import org.example.chapters.service.ChapterConversionService.ConvertedChapter;
import org.example.chapters.service.ChapterExportService;
import org.example.chapters.service.ChapterExportService.ExportResult;
import org.example.chapters.service.QuestionInspectionService;
import org.example.chapters.service.QuestionInspectionService.QuestionInspection;
import org.example.chapters.service.QuestionNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/chapters")
public class ChapterController {

    private final ChapterConversionService conversionService;
    private final ChapterExportService exportService;
    private final QuestionInspectionService inspectionService;

    public ChapterController(ChapterConversionService conversionService,
                             ChapterExportService exportService,
                             QuestionInspectionService inspectionService) {
        this.conversionService = conversionService;
        this.exportService = exportService;
        this.inspectionService = inspectionService;
    }

    public record ConvertRequest(
        String chapterId,
        String markup,
        Map<String, String> imageFiles
    ) {}

    public record InspectRequest(
        String chapterId,
        String markup,
        String number,
        Integer index,
        Integer limit
    ) {}

    @PostMapping("/convert")
    public ConvertedChapter convert(@RequestBody ConvertRequest request) {
        try {
            return conversionService.convert(request.markup(), request.chapterId(), imageFiles(request));
        } catch (ChapterParseException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    @PostMapping("/export")
    public ExportResult export(@RequestBody ConvertRequest request) {
        try {
            return exportService.export(request.markup(), request.chapterId(), imageFiles(request));
        } catch (ChapterParseException | IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    @PostMapping("/inspect")
    public List<QuestionInspection> inspect(@RequestBody InspectRequest request) {
        try {
            return inspectionService.inspect(request.markup(), request.chapterId(),
                request.index(), request.number(), request.limit());
        } catch (ChapterParseException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (QuestionNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        }
    }

    private Map<String, String> imageFiles(ConvertRequest request) {
        return request.imageFiles() == null ? Map.of() : request.imageFiles();
    }
}
