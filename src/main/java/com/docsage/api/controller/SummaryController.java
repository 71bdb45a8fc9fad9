package com.docsage.api.controller;

import com.docsage.api.service.QaService;
import com.docsage.api.service.SummaryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/agent")
@RequiredArgsConstructor
public class SummaryController {

    private final SummaryService summaryService;
    private final QaService qaService;

    @GetMapping("/summaries")
    public ResponseEntity<SummaryListResponse> listSummaries() {
        return ResponseEntity.ok(SummaryListResponse.of(summaryService.listSummaries()));
    }

    @GetMapping("/summaries/{filename}/history")
    public ResponseEntity<SummaryListResponse> history(@PathVariable String filename) {
        return ResponseEntity.ok(SummaryListResponse.of(summaryService.history(filename)));
    }

    @PostMapping("/summary_qa")
    public ResponseEntity<AnswerResponse> summaryQa(@Valid @RequestBody SummaryQaRequest request) {
        String answer = summaryService.answerQuestion(request.filename(), request.question());
        return ResponseEntity.ok(new AnswerResponse(answer));
    }

    @PostMapping("/search_qa")
    public ResponseEntity<AnswerResponse> searchQa(@Valid @RequestBody SearchQaRequest request) {
        String answer = qaService.answerFromSources(request.question(), request.sources());
        return ResponseEntity.ok(new AnswerResponse(answer));
    }
}
