package com.nevis.dataroom.service;

import com.nevis.dataroom.controller.DocumentListItem;
import com.nevis.dataroom.controller.DocumentResponse;
import com.nevis.dataroom.controller.PageResponse;
import com.nevis.dataroom.exception.DocumentNotFoundException;
import com.nevis.dataroom.model.DataRoomIndex;
import com.nevis.dataroom.model.DocumentRecord;
import com.nevis.dataroom.model.DocumentStatus;
import com.nevis.dataroom.model.IndexMetadata;
import com.nevis.dataroom.model.PageRecord;
import com.nevis.dataroom.repository.IndexRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DataRoomServiceTest {

    @TempDir
    Path tempDir;

    @Mock
    private IndexRepository indexRepository;

    @InjectMocks
    private DataRoomServiceImpl dataRoomService;

    private Path pageOne;

    @BeforeEach
    void setUp() throws IOException {
        pageOne = Files.write(tempDir.resolve("page_001.png"), new byte[]{1, 2, 3});

        DocumentRecord doc = DocumentRecord.discovered("doc_001", Path.of("/in/lease.docx"), "lease.docx", "h");
        doc.markNormalized(Path.of("/out/pdfs/doc_001.pdf"));
        doc.markRasterized(List.of(
            PageRecord.rendered(1, pageOne),
            PageRecord.unrendered(2, "broken stream"),
            PageRecord.rendered(3, tempDir.resolve("page_003.png"))));
        doc.getPages().get(0).completeSummary("Cover page.");
        doc.getPages().get(2).completeSummary("Rent schedule.");
        doc.completeSummary("Office lease.");

        DataRoomIndex index = new DataRoomIndex(IndexMetadata.initial(OffsetDateTime.now(), "test-model"));
        index.add(doc);
        lenient().when(indexRepository.load()).thenReturn(Optional.of(index));
    }

    @Test
    @DisplayName("Lists documents with summary and page count")
    void shouldListDocuments() {
        assertThat(dataRoomService.listDocuments())
            .containsExactly(new DocumentListItem("doc_001", "lease.docx", "Office lease.", 3, DocumentStatus.SUMMARIZED));
    }

    @Test
    @DisplayName("Empty list before the first run")
    void shouldListNothingWithoutIndex() {
        when(indexRepository.load()).thenReturn(Optional.empty());

        assertThat(dataRoomService.listDocuments()).isEmpty();
    }

    @Test
    @DisplayName("Returns the full record of a document")
    void shouldReturnDocument() {
        DocumentResponse response = dataRoomService.getDocument("doc_001");

        assertThat(response.summary()).isEqualTo("Office lease.");
        assertThat(response.pages()).hasSize(3);
        assertThat(response.pages().get(1).rasterError()).isEqualTo("broken stream");
        assertThat(response.pages().get(1).summaryStatus()).isEqualTo("failed");
    }

    @Test
    @DisplayName("Concatenates page summaries with their page numbers")
    void shouldJoinPageSummaries() {
        assertThat(dataRoomService.getDocumentPagesSummary("doc_001").pagesSummary())
            .isEqualTo("Page 1: Cover page.\n\nPage 3: Rent schedule.");
    }

    @Test
    @DisplayName("Returns requested pages with images and errors for unknown pages")
    void shouldReturnRequestedPages() {
        List<PageResponse> pages = dataRoomService.getPages("doc_001", List.of(1, 9), true);

        assertThat(pages).hasSize(2);
        assertThat(pages.get(0).imageBase64()).isEqualTo(Base64.getEncoder().encodeToString(new byte[]{1, 2, 3}));
        assertThat(pages.get(0).summary()).isEqualTo("Cover page.");
        assertThat(pages.get(1).pageNum()).isEqualTo(9);
        assertThat(pages.get(1).error()).isEqualTo(DataRoomServiceImpl.PAGE_NOT_FOUND);
    }

    @Test
    @DisplayName("Pages whose image is gone report the image as unavailable")
    void shouldReportUnavailableImages() {
        List<PageResponse> pages = dataRoomService.getPages("doc_001", List.of(2, 3), true);

        assertThat(pages).extracting(PageResponse::error)
            .containsOnly(DataRoomServiceImpl.IMAGE_NOT_AVAILABLE);
    }

    @Test
    @DisplayName("All pages without images when no page numbers are given")
    void shouldReturnAllPagesByDefault() {
        List<PageResponse> pages = dataRoomService.getPages("doc_001", List.of(), false);

        assertThat(pages).extracting(PageResponse::pageNum).containsExactly(1, 2, 3);
        assertThat(pages).allMatch(page -> page.imageBase64() == null);
    }

    @Test
    @DisplayName("Unknown document id raises not found")
    void shouldThrowForUnknownDocument() {
        assertThatThrownBy(() -> dataRoomService.getDocument("doc_999"))
            .isInstanceOf(DocumentNotFoundException.class)
            .hasMessage("Document not found: doc_999");
    }
}
