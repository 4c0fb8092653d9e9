package com.nevis.dataroom.controller;

import com.nevis.dataroom.service.DataRoomService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
public class DataRoomController {

    private final DataRoomService dataRoomService;

    @GetMapping
    public ResponseEntity<List<DocumentListItem>> listDocuments() {
        return ResponseEntity.ok(dataRoomService.listDocuments());
    }

    @GetMapping("/{docId}")
    public ResponseEntity<DocumentResponse> getDocument(@PathVariable String docId) {
        return ResponseEntity.ok(dataRoomService.getDocument(docId));
    }

    @GetMapping("/{docId}/summary")
    public ResponseEntity<DocumentPagesSummaryResponse> getPagesSummary(@PathVariable String docId) {
        return ResponseEntity.ok(dataRoomService.getDocumentPagesSummary(docId));
    }

    @GetMapping("/{docId}/pages")
    public ResponseEntity<List<PageResponse>> getPages(
        @PathVariable String docId,
        @RequestParam(name = "page_nums", required = false) List<Integer> pageNums,
        @RequestParam(name = "include_images", defaultValue = "false") boolean includeImages) {

        return ResponseEntity.ok(dataRoomService.getPages(docId, pageNums, includeImages));
    }
}
