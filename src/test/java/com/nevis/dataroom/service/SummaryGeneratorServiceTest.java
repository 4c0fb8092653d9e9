package com.nevis.dataroom.service;

import com.nevis.dataroom.config.SummaryProperties;
import com.nevis.dataroom.exception.RunCancelledException;
import com.nevis.dataroom.exception.SummarizationException;
import com.nevis.dataroom.infra.RateLimiter;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

import static com.nevis.dataroom.service.SummaryGeneratorServiceImpl.CHAT_LIMIT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@SpringBootTest(classes = {SummaryGeneratorServiceImpl.class, SummaryGeneratorServiceTest.RetryConfig.class})
class SummaryGeneratorServiceTest {

    @TestConfiguration
    @EnableRetry
    @EnableConfigurationProperties(SummaryProperties.class)
    static class RetryConfig {
    }

    private static final BooleanSupplier NOT_CANCELLED = () -> false;

    @Autowired
    private SummaryGeneratorService summaryGeneratorService;

    @MockitoBean
    private ChatModel chatModel;

    @MockitoBean(name = "chatLimiter")
    private RateLimiter chatLimiter;

    @TempDir
    Path tempDir;

    private Path pageImage;

    @BeforeEach
    void setUp() throws IOException {
        pageImage = Files.write(tempDir.resolve("page_001.png"), new byte[]{(byte) 0x89, 'P', 'N', 'G'});

        when(chatLimiter.execute(anyString(), anyInt(), any()))
            .thenAnswer(invocation -> {
                Supplier<?> supplier = invocation.getArgument(2);
                return supplier.get();
            });
    }

    private static ChatResponse reply(String text) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
    }

    @Test
    @DisplayName("Sends the page image through the rate limiter and returns the trimmed text")
    @SuppressWarnings("unchecked")
    void shouldSummarizePageImage() {
        when(chatModel.chat(anyList())).thenReturn(reply("  Cover page of the lease.  "));

        String summary = summaryGeneratorService.summarizePage(pageImage, 1, NOT_CANCELLED);

        assertThat(summary).isEqualTo("Cover page of the lease.");
        verify(chatLimiter).execute(eq(CHAT_LIMIT), eq(1), any());
        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(chatModel).chat(captor.capture());
        UserMessage message = (UserMessage) captor.getValue().get(0);
        assertThat(message.contents()).anySatisfy(content -> assertThat(content).isInstanceOf(ImageContent.class));
    }

    @Test
    @DisplayName("Should retry transient failures and then succeed")
    void shouldRetryAndEventuallySucceed() {
        when(chatModel.chat(anyList()))
            .thenThrow(new RetriableException("429 Too Many Requests"))
            .thenReturn(reply("Signature page."));

        assertThat(summaryGeneratorService.summarizePage(pageImage, 4, NOT_CANCELLED)).isEqualTo("Signature page.");
        verify(chatModel, times(2)).chat(anyList());
    }

    @Test
    @DisplayName("Should give up after the configured number of attempts")
    void shouldStopAfterMaxAttempts() {
        when(chatModel.chat(anyList())).thenThrow(new RetriableException("Gemini is down"));

        assertThatThrownBy(() -> summaryGeneratorService.summarizePage(pageImage, 1, NOT_CANCELLED))
            .isInstanceOf(RetriableException.class);
        verify(chatModel, times(3)).chat(anyList());
    }

    @Test
    @DisplayName("Should not retry non-transient failures")
    void shouldNotRetryOtherErrors() {
        when(chatModel.chat(anyList())).thenThrow(new IllegalArgumentException("Invalid API key"));

        assertThatThrownBy(() -> summaryGeneratorService.summarizePage(pageImage, 1, NOT_CANCELLED))
            .isInstanceOf(IllegalArgumentException.class);
        verify(chatModel, times(1)).chat(anyList());
    }

    @Test
    @DisplayName("No retry reaches the model once the run is cancelled")
    void shouldStopRetryingAfterCancel() {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        when(chatModel.chat(anyList())).thenAnswer(invocation -> {
            cancelled.set(true);
            throw new RetriableException("503 Service Unavailable");
        });

        assertThatThrownBy(() -> summaryGeneratorService.summarizePage(pageImage, 1, cancelled::get))
            .isInstanceOf(RunCancelledException.class);
        verify(chatModel, times(1)).chat(anyList());
    }

    @Test
    @DisplayName("A cancel that lands while waiting for a rate limit permit prevents the call")
    void shouldNotCallModelWhenCancelledDuringLimiterWait() {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        doAnswer(invocation -> {
            cancelled.set(true);
            Supplier<?> supplier = invocation.getArgument(2);
            return supplier.get();
        }).when(chatLimiter).execute(anyString(), anyInt(), any());

        assertThatThrownBy(() -> summaryGeneratorService.summarizeDocument("doc_001",
            List.of(new PageSummary(1, "x")), List.of(), cancelled::get))
            .isInstanceOf(RunCancelledException.class);
        verifyNoInteractions(chatModel);
    }

    @Test
    @DisplayName("Empty model output is a summarization error")
    void shouldRejectEmptyOutput() {
        when(chatModel.chat(anyList())).thenReturn(reply(" "));

        assertThatThrownBy(() -> summaryGeneratorService.summarizePage(pageImage, 2, NOT_CANCELLED))
            .isInstanceOf(SummarizationException.class)
            .hasMessageContaining("page 2");
    }

    @Test
    @DisplayName("Unreadable page image fails without calling the model")
    void shouldFailOnMissingImage() {
        assertThatThrownBy(() -> summaryGeneratorService.summarizePage(tempDir.resolve("missing.png"), 1, NOT_CANCELLED))
            .isInstanceOf(SummarizationException.class);
        verifyNoInteractions(chatModel);
    }

    @Test
    @DisplayName("Roll-up prompt lists page summaries in order and mentions skipped pages")
    void shouldRollUpPageSummaries() {
        when(chatModel.chat(anyString())).thenReturn("Lease agreement for office space.");

        String summary = summaryGeneratorService.summarizeDocument("doc_001",
            List.of(new PageSummary(1, "Cover page."), new PageSummary(3, "Rent schedule.")),
            List.of(2), NOT_CANCELLED);

        assertThat(summary).isEqualTo("Lease agreement for office space.");
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(chatModel).chat(prompt.capture());
        assertThat(prompt.getValue())
            .contains("Page 1: Cover page.\n\nPage 3: Rent schedule.")
            .contains("pages [2]");
    }

    @Test
    @DisplayName("Roll-up is retried on transient failures")
    void shouldRetryRollUp() {
        when(chatModel.chat(anyString()))
            .thenThrow(new RetriableException("timeout"))
            .thenReturn("Recovered.");

        assertThat(summaryGeneratorService.summarizeDocument("doc_001", List.of(new PageSummary(1, "x")), List.of(),
            NOT_CANCELLED))
            .isEqualTo("Recovered.");
        verify(chatModel, times(2)).chat(anyString());
    }

    @Test
    void shouldReportConfiguredModel() {
        assertThat(summaryGeneratorService.modelName()).isEqualTo("test-model");
    }
}
