package com.smartexam.paper.api;

import com.smartexam.paper.service.PaperCompilationService;
import com.smartexam.paper.service.PaperCompilationService.PaperCompilationResult;
import com.smartexam.paper.service.PaperCompilationService.PaperInput;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/papers")
public class PaperAnalysisController {
    static final MediaType GRAPHVIZ = MediaType.parseMediaType("text/vnd.graphviz");

    private final PaperCompilationService compilationService;
    private final PaperSourceReader sourceReader;

    public PaperAnalysisController(PaperCompilationService compilationService, PaperSourceReader sourceReader) {
        this.compilationService = compilationService;
        this.sourceReader = sourceReader;
    }

    @PostMapping("/analyze")
    public ResponseEntity<PaperCompilationResult> analyze(@RequestBody AnalyzeRequest request) {
        return ResponseEntity.ok(compilationService.compile(request.toInput()));
    }

    @PostMapping(path = "/analyze/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<PaperCompilationResult> analyzeUpload(@RequestPart("paper") MultipartFile paper,
                                                                @RequestPart(value = "syllabus", required = false) MultipartFile syllabus) {
        String syllabusName = syllabus == null ? "" : nullToEmpty(syllabus.getOriginalFilename());
        PaperInput input = new PaperInput(sourceReader.read(paper), sourceReader.read(syllabus), syllabusName);
        return ResponseEntity.ok(compilationService.compile(input));
    }

    @PostMapping("/ast")
    public ResponseEntity<String> ast(@RequestBody AnalyzeRequest request) {
        return ResponseEntity.ok()
                .contentType(GRAPHVIZ)
                .body(compilationService.renderAst(request.toInput()));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    public record AnalyzeRequest(String content, String syllabus, String syllabusPath) {
        PaperInput toInput() {
            return new PaperInput(content, syllabus == null ? "" : syllabus, syllabusPath == null ? "" : syllabusPath);
        }
    }
}
