package com.docsage.api.service;

import com.docsage.api.model.SummaryRecord;

import java.util.List;
import java.util.Optional;

public interface SummaryService {
    List<SummaryRecord> listSummaries();
    Optional<SummaryRecord> findSummary(String filename);
    List<SummaryRecord> history(String filename);
    String answerQuestion(String filename, String question);
    int deleteForDocument(String filename);
}
