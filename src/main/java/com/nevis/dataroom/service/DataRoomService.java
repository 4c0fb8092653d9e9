package com.nevis.dataroom.service;

import com.nevis.dataroom.controller.DocumentListItem;
import com.nevis.dataroom.controller.DocumentPagesSummaryResponse;
import com.nevis.dataroom.controller.DocumentResponse;
import com.nevis.dataroom.controller.PageResponse;

import java.util.List;

/**
 * Read-only view of the persisted data room index.
 */
public interface DataRoomService {

    List<DocumentListItem> listDocuments();

    DocumentResponse getDocument(String docId);

    DocumentPagesSummaryResponse getDocumentPagesSummary(String docId);

    /**
     * Returns the requested pages in request order; all pages when {@code pageNums} is empty.
     * Page numbers the document does not have yield an entry carrying only an error.
     */
    List<PageResponse> getPages(String docId, List<Integer> pageNums, boolean includeImages);
}
