package com.docsage.api.service;

import com.docsage.api.exception.EntityNotFoundException;
import com.docsage.api.exception.PayloadValidationException;
import com.docsage.api.exception.PersistenceException;
import com.docsage.api.model.SummaryRecord;
import com.docsage.api.repository.SummaryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class SummaryServiceImpl implements SummaryService {

    private final SummaryRepository summaryRepository;
    private final QaService qaService;

    @Override
    public List<SummaryRecord> listSummaries() {
        List<SummaryRecord> summaries = withStore("list summaries", summaryRepository::findAll);
        log.debug("Retrieved {} summaries", summaries.size());
        return summaries;
    }

    @Override
    public Optional<SummaryRecord> findSummary(String filename) {
        String key = normalizeFilename(filename);
        return withStore("read summary", () -> summaryRepository.findByFilename(key));
    }

    @Override
    public List<SummaryRecord> history(String filename) {
        String key = normalizeFilename(filename);
        return withStore("read summary history", () -> summaryRepository.findHistory(key));
    }

    @Override
    public String answerQuestion(String filename, String question) {
        SummaryRecord summary = findSummary(filename)
            .orElseThrow(() -> {
                log.warn("Summary not found for {}", filename);
                return EntityNotFoundException.summary(filename);
            });
        return qaService.answer(question, summary.summary());
    }

    @Override
    public int deleteForDocument(String filename) {
        String key = normalizeFilename(filename);
        int removed = withStore("delete summary", () -> summaryRepository.deleteByFilename(key));
        if (removed == 0) {
            log.warn("No summary to delete for {}", key);
            throw EntityNotFoundException.summary(key);
        }
        log.info("Deleted summary for {}", key);
        return removed;
    }

    // Same key the completion webhook stores under.
    static String normalizeFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new PayloadValidationException("filename is required");
        }
        return filename.trim();
    }

    private <T> T withStore(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.error("Failed to {}: {}", action, e.getMessage(), e);
            throw new PersistenceException("Failed to " + action, e);
        }
    }
}
