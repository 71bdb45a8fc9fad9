package com.docsage.api.service;

import com.docsage.api.model.SourceSnippet;

import java.util.List;

public interface QaService {
    String answer(String question, String context);
    String answerFromSources(String question, List<SourceSnippet> sources);
}
