package com.docsage.api.repository;

import com.docsage.api.model.SummaryRecord;

import java.util.List;
import java.util.Optional;

public interface SummaryRepository {
    SummaryRecord upsert(String filename, String summary);
    Optional<SummaryRecord> findByFilename(String filename);
    List<SummaryRecord> findAll();
    List<SummaryRecord> findHistory(String filename);
    int deleteByFilename(String filename);
}
