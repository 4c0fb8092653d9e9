package com.nevis.dataroom.service;

import com.nevis.dataroom.config.SummaryProperties;
import com.nevis.dataroom.exception.RunCancelledException;
import com.nevis.dataroom.exception.SummarizationException;
import com.nevis.dataroom.infra.RateLimiter;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

@Service
@Slf4j
public class SummaryGeneratorServiceImpl implements SummaryGeneratorService {

    public static final String CHAT_LIMIT = "chat_limit";

    private static final String PAGE_PROMPT_TEMPLATE =
        """
            Role: Due-diligence analyst reviewing a data room.
            Task: Describe page %d of the attached document page image in 1-2 factual sentences.
            Focus: Main topic or section, parties, dates, amounts and obligations, and any signals of the
            document type (contract clause, financial statement, corporate record, correspondence).
            Constraint: Report only what is visible on the page. Do not speculate.

            Output: Output only the summary
            """;

    private static final String DOCUMENT_PROMPT_TEMPLATE =
        """
            Role: Due-diligence analyst reviewing a data room.
            Task: Based on the page-by-page summaries below, write a 2-3 sentence summary of the entire document.
            Focus: Document type and purpose, main parties, key terms, obligations or figures, overall significance.
            %s
            Output: Output only the summary

            Page summaries:
            %s
            """;

    private final ChatModel chatModel;
    private final RateLimiter chatLimiter;
    private final SummaryProperties properties;

    public SummaryGeneratorServiceImpl(
        ChatModel chatModel,
        @Qualifier("chatLimiter") RateLimiter chatLimiter,
        SummaryProperties properties
    ) {
        this.chatModel = chatModel;
        this.chatLimiter = chatLimiter;
        this.properties = properties;
    }

    @Override
    @Retryable(
        retryFor = RetriableException.class,
        maxAttemptsExpression = "${app.summary.max-attempts:4}",
        backoff = @Backoff(
            delayExpression = "${app.summary.initial-backoff-ms:1000}",
            multiplierExpression = "${app.summary.multiplier:2.0}",
            maxDelayExpression = "${app.summary.max-backoff-ms:30000}"
        )
    )
    public String summarizePage(Path imagePath, int pageNum, BooleanSupplier cancelled) {
        ensureActive(cancelled, "page " + pageNum);
        log.debug("Summarizing page {} from {}", pageNum, imagePath.getFileName());

        String image = encodeImage(imagePath);
        List<ChatMessage> messages = List.of(UserMessage.from(
            TextContent.from(PAGE_PROMPT_TEMPLATE.formatted(pageNum)),
            ImageContent.from(image, "image/png")
        ));

        ChatResponse response = chatLimiter.execute(CHAT_LIMIT, 1, () -> {
            ensureActive(cancelled, "page " + pageNum);
            return chatModel.chat(messages);
        });
        return requireText(response == null || response.aiMessage() == null ? null : response.aiMessage().text(),
            "page " + pageNum);
    }

    @Override
    @Retryable(
        retryFor = RetriableException.class,
        maxAttemptsExpression = "${app.summary.max-attempts:4}",
        backoff = @Backoff(
            delayExpression = "${app.summary.initial-backoff-ms:1000}",
            multiplierExpression = "${app.summary.multiplier:2.0}",
            maxDelayExpression = "${app.summary.max-backoff-ms:30000}"
        )
    )
    public String summarizeDocument(String docId, List<PageSummary> pageSummaries, List<Integer> skippedPages,
                                    BooleanSupplier cancelled) {
        ensureActive(cancelled, "doc " + docId);
        if (pageSummaries.isEmpty()) {
            throw new SummarizationException("Doc " + docId + ": no page summaries to roll up");
        }
        log.debug("Rolling up {} page summaries for doc {}", pageSummaries.size(), docId);

        String combined = pageSummaries.stream()
            .map(page -> "Page " + page.pageNum() + ": " + page.text())
            .collect(Collectors.joining("\n\n"));
        String skippedNote = skippedPages.isEmpty()
            ? ""
            : "Note: pages " + skippedPages + " could not be summarized and are missing from the list; say so briefly.\n";

        String summary = chatLimiter.execute(CHAT_LIMIT, 1, () -> {
            ensureActive(cancelled, "doc " + docId);
            return chatModel.chat(DOCUMENT_PROMPT_TEMPLATE.formatted(skippedNote, combined));
        });
        return requireText(summary, "doc " + docId);
    }

    @Override
    public String modelName() {
        return properties.model();
    }

    // Runs again after the limiter wait, which can outlast a cancel.
    private static void ensureActive(BooleanSupplier cancelled, String subject) {
        if (cancelled.getAsBoolean()) {
            throw new RunCancelledException("Run cancelled before summarizing " + subject);
        }
    }

    private static String encodeImage(Path imagePath) {
        try {
            return Base64.getEncoder().encodeToString(Files.readAllBytes(imagePath));
        } catch (IOException e) {
            throw new SummarizationException("Cannot read page image " + imagePath, e);
        }
    }

    private static String requireText(String text, String subject) {
        if (text == null || text.isBlank()) {
            throw new SummarizationException("Model returned an empty summary for " + subject);
        }
        return text.trim();
    }
}
