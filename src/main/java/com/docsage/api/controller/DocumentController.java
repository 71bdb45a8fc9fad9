package com.docsage.api.controller;

import com.docsage.api.service.SummaryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class DocumentController {

    private final SummaryService summaryService;

    @DeleteMapping("/documents/{filename}")
    public ResponseEntity<DeleteDocumentResponse> deleteDocument(@PathVariable String filename) {
        int removed = summaryService.deleteForDocument(filename);
        return ResponseEntity.ok(new DeleteDocumentResponse("Deleted summary for " + filename.trim(), removed));
    }
}
