package com.nevis.dataroom.controller;

import com.nevis.dataroom.pipeline.RunMode;
import com.nevis.dataroom.service.IndexRunStatus;
import com.nevis.dataroom.service.IndexingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/index-runs")
@RequiredArgsConstructor
public class IndexRunController {

    private final IndexingService indexingService;

    @PostMapping
    public ResponseEntity<IndexRunStatus> startRun(@RequestBody(required = false) IndexRunRequest request) {
        RunMode mode = request == null || request.mode() == null ? RunMode.FULL : request.mode();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(indexingService.startRun(mode));
    }

    @GetMapping("/current")
    public ResponseEntity<IndexRunStatus> currentRun() {
        return ResponseEntity.of(indexingService.currentStatus());
    }

    @DeleteMapping("/current")
    public ResponseEntity<IndexRunStatus> cancelRun() {
        return indexingService.cancel()
            .map(status -> ResponseEntity.status(HttpStatus.ACCEPTED).body(status))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
