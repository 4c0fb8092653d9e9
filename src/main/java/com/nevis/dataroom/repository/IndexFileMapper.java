package com.nevis.dataroom.repository;

import com.nevis.dataroom.model.DataRoomIndex;
import com.nevis.dataroom.model.DocumentRecord;
import com.nevis.dataroom.model.DocumentStatus;
import com.nevis.dataroom.model.IndexMetadata;
import com.nevis.dataroom.model.PageRecord;
import com.nevis.dataroom.model.PipelineStage;
import com.nevis.dataroom.model.StageFailure;
import com.nevis.dataroom.model.SummaryState;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

final class IndexFileMapper {

    private static final String DONE = "done";
    private static final String FAILED = "failed";

    private IndexFileMapper() {
    }

    static IndexFile toFile(DataRoomIndex index) {
        IndexMetadata metadata = index.getMetadata();
        List<IndexFile.DocumentEntry> documents = index.documents().stream()
            .map(IndexFileMapper::toEntry)
            .toList();
        return new IndexFile(
            new IndexFile.Metadata(index.totalDocuments(), metadata.createdAt(), metadata.updatedAt(),
                metadata.modelUsed(), metadata.version()),
            documents
        );
    }

    static DataRoomIndex fromFile(IndexFile file) {
        IndexFile.Metadata metadata = file.metadata();
        DataRoomIndex index = new DataRoomIndex(new IndexMetadata(metadata.createdAt(), metadata.updatedAt(),
            metadata.modelUsed(), metadata.version()));
        if (file.documents() != null) {
            file.documents().forEach(entry -> index.add(fromEntry(entry)));
        }
        return index;
    }

    private static IndexFile.DocumentEntry toEntry(DocumentRecord doc) {
        StageFailure failure = doc.getFailure();
        return new IndexFile.DocumentEntry(
            doc.getDocId(),
            doc.getFilename(),
            doc.getOriginalPath().toString(),
            doc.getRelativePath(),
            doc.getContentHash(),
            pathString(doc.getCanonicalPdfPath()),
            doc.getStatus().name().toLowerCase(Locale.ROOT),
            failure == null ? null : new IndexFile.Failure(failure.stage().code(), failure.reason()),
            doc.getSummary().asText().orElse(null),
            doc.getSummary().code(),
            errorOf(doc.getSummary()),
            doc.getPages().stream().map(IndexFileMapper::toEntry).toList()
        );
    }

    private static IndexFile.PageEntry toEntry(PageRecord page) {
        return new IndexFile.PageEntry(
            page.getPageNum(),
            page.getSummary().asText().orElse(null),
            page.getSummary().code(),
            errorOf(page.getSummary()),
            pathString(page.getImagePath()),
            page.getRasterError()
        );
    }

    private static DocumentRecord fromEntry(IndexFile.DocumentEntry entry) {
        List<PageRecord> pages = entry.pages() == null ? List.of() : entry.pages().stream()
            .map(page -> PageRecord.restore(page.pageNum(), toPath(page.pageImage()), page.rasterError(),
                toState(page.summary(), page.summaryStatus(), page.summaryError())))
            .toList();
        IndexFile.Failure failure = entry.failure();
        return DocumentRecord.restore(
            entry.docId(),
            Path.of(entry.originalFile()),
            entry.relativePath(),
            entry.contentHash(),
            toPath(entry.pdfFile()),
            DocumentStatus.valueOf(entry.status().toUpperCase(Locale.ROOT)),
            failure == null ? null : new StageFailure(PipelineStage.fromCode(failure.stage()), failure.reason()),
            toState(entry.summary(), entry.summaryStatus(), entry.summaryError()),
            pages
        );
    }

    private static IndexFile.Failure errorOf(SummaryState state) {
        if (state instanceof SummaryState.Failed failed) {
            return new IndexFile.Failure(failed.stage().code(), failed.reason());
        }
        return null;
    }

    // Files written by older tools carry only the text; a present text means done.
    private static SummaryState toState(String text, String status, IndexFile.Failure error) {
        if (FAILED.equals(status) && error != null) {
            return SummaryState.failed(PipelineStage.fromCode(error.stage()), error.reason());
        }
        if (text != null && (status == null || DONE.equals(status))) {
            return SummaryState.done(text);
        }
        return SummaryState.pending();
    }

    private static String pathString(Path path) {
        return path == null ? null : path.toString();
    }

    private static Path toPath(String value) {
        return value == null ? null : Path.of(value);
    }
}
