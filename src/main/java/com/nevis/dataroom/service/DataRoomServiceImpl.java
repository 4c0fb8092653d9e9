package com.nevis.dataroom.service;

import com.nevis.dataroom.controller.DocumentListItem;
import com.nevis.dataroom.controller.DocumentPagesSummaryResponse;
import com.nevis.dataroom.controller.DocumentResponse;
import com.nevis.dataroom.controller.PageResponse;
import com.nevis.dataroom.exception.DocumentNotFoundException;
import com.nevis.dataroom.model.DataRoomIndex;
import com.nevis.dataroom.model.DocumentRecord;
import com.nevis.dataroom.model.PageRecord;
import com.nevis.dataroom.repository.IndexRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class DataRoomServiceImpl implements DataRoomService {

    static final String PAGE_NOT_FOUND = "Page not found";
    static final String IMAGE_NOT_AVAILABLE = "Page image not available";

    private final IndexRepository indexRepository;

    @Override
    public List<DocumentListItem> listDocuments() {
        return indexRepository.load()
            .map(index -> index.documents().stream().map(DocumentListItem::from).toList())
            .orElse(List.of());
    }

    @Override
    public DocumentResponse getDocument(String docId) {
        return DocumentResponse.from(findDocument(docId));
    }

    @Override
    public DocumentPagesSummaryResponse getDocumentPagesSummary(String docId) {
        DocumentRecord doc = findDocument(docId);
        String text = doc.getPages().stream()
            .filter(page -> page.getSummary().isDone())
            .map(page -> "Page " + page.getPageNum() + ": " + page.getSummary().asText().orElseThrow())
            .collect(Collectors.joining("\n\n"));
        return new DocumentPagesSummaryResponse(doc.getDocId(), doc.getFilename(), text);
    }

    @Override
    public List<PageResponse> getPages(String docId, List<Integer> pageNums, boolean includeImages) {
        DocumentRecord doc = findDocument(docId);
        Map<Integer, PageRecord> pages = doc.getPages().stream()
            .collect(Collectors.toMap(PageRecord::getPageNum, Function.identity()));
        List<Integer> requested = pageNums == null || pageNums.isEmpty()
            ? doc.getPages().stream().map(PageRecord::getPageNum).toList()
            : pageNums;

        return requested.stream()
            .map(pageNum -> {
                PageRecord page = pages.get(pageNum);
                if (page == null) {
                    return PageResponse.error(pageNum, PAGE_NOT_FOUND);
                }
                return includeImages ? withImage(docId, page) : PageResponse.from(page);
            })
            .toList();
    }

    private PageResponse withImage(String docId, PageRecord page) {
        if (!page.hasImage()) {
            return PageResponse.error(page.getPageNum(), IMAGE_NOT_AVAILABLE);
        }
        try {
            byte[] bytes = Files.readAllBytes(page.getImagePath());
            return PageResponse.withImage(page, Base64.getEncoder().encodeToString(bytes));
        } catch (IOException e) {
            log.warn("Doc {}: cannot read image of page {}: {}", docId, page.getPageNum(), e.getMessage());
            return PageResponse.error(page.getPageNum(), IMAGE_NOT_AVAILABLE);
        }
    }

    private DocumentRecord findDocument(String docId) {
        return indexRepository.load()
            .flatMap((DataRoomIndex index) -> index.find(docId))
            .orElseThrow(() -> {
                log.warn("Document not found with ID: {}", docId);
                return new DocumentNotFoundException(docId);
            });
    }
}
