package com.docsage.api.controller;

import com.docsage.api.service.JobService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
public class JobController {

    private final JobService jobService;

    @PostMapping("/agent/summarize")
    public ResponseEntity<JobResponse> summarize(@Valid @RequestBody SummarizeRequest request) {
        var receipt = jobService.submitSummarization(request.filename());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobResponse.from(receipt));
    }

    @PostMapping("/documents/ingest")
    public ResponseEntity<JobResponse> ingest(@Valid @RequestBody IngestRequest request) {
        var receipt = jobService.submitIngestion(request.filename(), request.documentSet());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobResponse.from(receipt));
    }

    @GetMapping("/agent/status/{taskId}")
    public ResponseEntity<TaskStatusResponse> status(@PathVariable String taskId) {
        return ResponseEntity.ok(TaskStatusResponse.from(jobService.taskStatus(taskId)));
    }
}
