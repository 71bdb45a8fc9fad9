package com.docsage.api.service;

import com.docsage.api.exception.PayloadValidationException;
import com.docsage.api.exception.UpstreamException;
import com.docsage.api.infra.RateLimiter;
import com.docsage.api.model.SourceSnippet;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
@Slf4j
public class QaServiceImpl implements QaService {

    public static final String CHAT_LIMIT = "chat_limit";
    static final String LLM_UPSTREAM = "llm";

    private final ChatModel chatModel;
    private final RateLimiter chatLimiter;

    @Value("${app.qa.max-context-chars:100000}")
    private int maxContextChars;

    private static final String QA_PROMPT_TEMPLATE =
        """
            Role: You are an assistant answering questions based ONLY on the provided context.
            Constraint: If the context does not contain the answer, say that you do not know.

            Context:
            %s

            Question: %s
            """;

    public QaServiceImpl(
        ChatModel chatModel,
        @Qualifier("chatLimiter") RateLimiter chatLimiter
    ) {
        this.chatModel = chatModel;
        this.chatLimiter = chatLimiter;
    }

    @Override
    public String answer(String question, String context) {
        if (question == null || question.isBlank()) {
            throw new PayloadValidationException("question is required");
        }
        String safeContext = context == null ? "" : context;
        String headContext = safeContext.substring(0, Math.min(safeContext.length(), maxContextChars));

        String answer;
        try {
            answer = chatLimiter.execute(CHAT_LIMIT, () ->
                chatModel.chat(String.format(QA_PROMPT_TEMPLATE, headContext, question.trim()))
            );
        } catch (RuntimeException e) {
            log.error("QA call failed: {}", e.getMessage(), e);
            throw new UpstreamException(LLM_UPSTREAM, "Failed to generate answer", e);
        }

        if (answer == null || answer.isBlank()) {
            throw new UpstreamException(LLM_UPSTREAM, "Language model returned an empty answer");
        }
        return answer.trim();
    }

    @Override
    public String answerFromSources(String question, List<SourceSnippet> sources) {
        String context = sources == null ? "" : sources.stream()
            .map(source -> String.format("Source '%s':%n%s",
                source.filename() == null ? "Unknown" : source.filename(),
                source.content() == null ? "" : source.content()))
            .collect(Collectors.joining("\n\n"));
        return answer(question, context);
    }
}
