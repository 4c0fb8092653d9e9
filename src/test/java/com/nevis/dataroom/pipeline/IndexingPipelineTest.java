package com.nevis.dataroom.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.dataroom.config.ConverterProperties;
import com.nevis.dataroom.config.IndexerProperties;
import com.nevis.dataroom.exception.SummarizationException;
import com.nevis.dataroom.infra.ConverterClient;
import com.nevis.dataroom.model.DataRoomIndex;
import com.nevis.dataroom.model.DocumentRecord;
import com.nevis.dataroom.model.DocumentStatus;
import com.nevis.dataroom.model.PipelineStage;
import com.nevis.dataroom.repository.JsonIndexRepository;
import com.nevis.dataroom.service.SummaryGeneratorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IndexingPipelineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Mock
    private ConverterClient converterClient;

    @Mock
    private SummaryGeneratorService summaryGenerator;

    private Path inputRoot;
    private JsonIndexRepository repository;
    private IndexingPipeline pipeline;

    @BeforeEach
    void setUp() throws IOException {
        inputRoot = Files.createDirectories(tempDir.resolve("data_room"));
        IndexerProperties properties = new IndexerProperties(inputRoot.toString(), tempDir.resolve("index").toString(),
            72, 2, "data_room_index.json", true);
        ConverterProperties converterProperties = new ConverterProperties("soffice", Duration.ofSeconds(5),
            Duration.ofSeconds(1), 2, Duration.ofMillis(1), List.of("locked"));
        repository = new JsonIndexRepository(new ObjectMapper(), properties.indexFile());

        pipeline = new IndexingPipeline(
            properties,
            new DocumentDiscoverer(),
            new FormatNormalizer(converterClient, Runnable::run, properties, converterProperties),
            new PageRasterizer(Runnable::run, properties),
            new SummarizationEngine(summaryGenerator, Runnable::run),
            new IndexAssembler(repository, summaryGenerator, Clock.systemUTC())
        );

        lenient().when(summaryGenerator.modelName()).thenReturn("gemini-test");
        lenient().when(converterClient.convertToPdf(any(), any())).thenAnswer(invocation -> {
            Path source = invocation.getArgument(0);
            Path outDir = invocation.getArgument(1);
            String name = source.getFileName().toString();
            return TestPdfs.write(outDir.resolve(name.substring(0, name.lastIndexOf('.')) + ".pdf"), 2);
        });
    }

    private void dataRoom() throws IOException {
        Files.createDirectories(inputRoot.resolve("legal"));
        Files.writeString(inputRoot.resolve("legal/spa.docx"), "share purchase agreement");
        Files.writeString(inputRoot.resolve("legal/nda.docx"), "non disclosure agreement");
        Files.writeString(inputRoot.resolve("board_minutes.docx"), "minutes");
        TestPdfs.writeCorrupt(inputRoot.resolve("scan.pdf"));
    }

    private void summariesSucceed() {
        lenient().when(summaryGenerator.summarizePage(any(), anyInt(), any()))
            .thenAnswer(invocation -> "Summary of page " + invocation.getArgument(1));
        lenient().when(summaryGenerator.summarizeDocument(anyString(), anyList(), anyList(), any()))
            .thenAnswer(invocation -> "Summary of " + invocation.getArgument(0));
    }

    @Test
    @DisplayName("Three office files and one corrupt PDF give four entries with one failure")
    void shouldIndexDataRoom() throws IOException {
        dataRoom();
        summariesSucceed();

        RunReport report = pipeline.run(RunContext.start(RunMode.FULL, CLOCK));

        DataRoomIndex index = repository.load().orElseThrow();
        assertThat(index.totalDocuments()).isEqualTo(4);
        assertThat(index.documents()).extracting(DocumentRecord::getDocId).doesNotHaveDuplicates();
        assertThat(index.documents())
            .filteredOn(doc -> doc.getStatus() == DocumentStatus.SUMMARIZED)
            .hasSize(3)
            .allSatisfy(doc -> {
                assertThat(doc.getPages()).hasSize(2);
                assertThat(doc.getSummary().asText()).contains("Summary of " + doc.getDocId());
                assertThat(doc.getCanonicalPdfPath()).exists();
            });
        DocumentRecord corrupt = index.documents().stream()
            .filter(doc -> doc.getFilename().equals("scan.pdf"))
            .findFirst().orElseThrow();
        assertThat(corrupt.getStatus()).isEqualTo(DocumentStatus.FAILED);
        assertThat(corrupt.getFailure().stage()).isEqualTo(PipelineStage.RASTERIZE);

        assertThat(report.documentsInRun()).isEqualTo(4);
        assertThat(report.pagesTotal()).isEqualTo(6);
        assertThat(report.pagesSummarized()).isEqualTo(6);
        assertThat(report.cancelled()).isFalse();
        verify(converterClient, times(3)).convertToPdf(any(), any());
    }

    @Test
    @DisplayName("A cancelled run resumes without repeating finished work")
    void shouldResumeAfterCancellation() throws IOException {
        dataRoom();
        AtomicReference<RunContext> firstRun = new AtomicReference<>(RunContext.start(RunMode.FULL, CLOCK));
        when(summaryGenerator.summarizePage(any(), anyInt(), any())).thenAnswer(invocation -> {
            firstRun.get().cancel();
            return "Summary of page " + invocation.getArgument(1);
        });
        lenient().when(summaryGenerator.summarizeDocument(anyString(), anyList(), anyList(), any()))
            .thenAnswer(invocation -> "Summary of " + invocation.getArgument(0));

        RunReport interrupted = pipeline.run(firstRun.get());

        assertThat(interrupted.cancelled()).isTrue();
        assertThat(interrupted.pagesSummarized()).isEqualTo(1);
        assertThat(repository.load().orElseThrow().documents())
            .noneMatch(doc -> doc.getStatus() == DocumentStatus.SUMMARIZED);

        RunReport resumed = pipeline.run(RunContext.start(RunMode.FULL, CLOCK));

        assertThat(resumed.cancelled()).isFalse();
        assertThat(resumed.pagesSummarized()).isEqualTo(6);
        assertThat(resumed.documentsByStatus()).containsEntry(DocumentStatus.SUMMARIZED, 3);
        verify(summaryGenerator, times(6)).summarizePage(any(), anyInt(), any());
        verify(summaryGenerator, times(3)).summarizeDocument(anyString(), anyList(), anyList(), any());
        verify(converterClient, times(3)).convertToPdf(any(), any());
    }

    @Test
    @DisplayName("Rerunning a finished data room keeps ids and summaries byte-identical")
    void shouldBeStableAcrossRuns() throws IOException {
        dataRoom();
        summariesSucceed();
        pipeline.run(RunContext.start(RunMode.FULL, CLOCK));
        String first = Files.readString(repository.getIndexFile()).replaceAll("\"updated_at\" : \"[^\"]+\"", "")
            .replaceAll("\"version\" : \\d+", "");

        pipeline.run(RunContext.start(RunMode.FULL, CLOCK));
        String second = Files.readString(repository.getIndexFile()).replaceAll("\"updated_at\" : \"[^\"]+\"", "")
            .replaceAll("\"version\" : \\d+", "");

        assertThat(second).isEqualTo(first);
        verify(summaryGenerator, times(6)).summarizePage(any(), anyInt(), any());
    }

    @Test
    @DisplayName("Summary-only run retries documents whose summarization failed")
    void shouldRetryFailedSummariesOnly() throws IOException {
        Files.writeString(inputRoot.resolve("memo.docx"), "memo");
        when(summaryGenerator.summarizePage(any(), anyInt(), any()))
            .thenThrow(new SummarizationException("quota exhausted"))
            .thenThrow(new SummarizationException("quota exhausted"))
            .thenReturn("Recovered page.");
        when(summaryGenerator.summarizeDocument(anyString(), anyList(), anyList(), any())).thenReturn("Recovered document.");

        pipeline.run(RunContext.start(RunMode.FULL, CLOCK));
        DocumentRecord failed = repository.load().orElseThrow().find("doc_001").orElseThrow();
        assertThat(failed.getFailure().stage()).isEqualTo(PipelineStage.SUMMARIZE);

        pipeline.run(RunContext.start(RunMode.SUMMARIES_ONLY, CLOCK));

        DocumentRecord recovered = repository.load().orElseThrow().find("doc_001").orElseThrow();
        assertThat(recovered.getStatus()).isEqualTo(DocumentStatus.SUMMARIZED);
        assertThat(recovered.getSummary().asText()).contains("Recovered document.");
        verify(converterClient, times(1)).convertToPdf(any(), any());
    }

    @Test
    @DisplayName("Missing input folder aborts the run")
    void shouldFailOnMissingInput() throws IOException {
        Files.delete(inputRoot);

        assertThatThrownBy(() -> pipeline.run(RunContext.start(RunMode.FULL, CLOCK)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
