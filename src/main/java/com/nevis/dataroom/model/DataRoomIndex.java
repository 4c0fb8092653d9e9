package com.nevis.dataroom.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Optional;

/**
 * The growing index of one data room. Documents keep discovery order; ids are unique.
 * <p>
 * Passed by reference through the pipeline stages and persisted by the index assembler.
 */
@ToString
@EqualsAndHashCode
public class DataRoomIndex {

    private IndexMetadata metadata;
    private final LinkedHashMap<String, DocumentRecord> documents = new LinkedHashMap<>();

    public DataRoomIndex(IndexMetadata metadata) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public IndexMetadata getMetadata() {
        return metadata;
    }

    public void setMetadata(IndexMetadata metadata) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public int totalDocuments() {
        return documents.size();
    }

    public Collection<DocumentRecord> documents() {
        return Collections.unmodifiableCollection(documents.values());
    }

    public Optional<DocumentRecord> find(String docId) {
        return Optional.ofNullable(documents.get(docId));
    }

    public boolean contains(String docId) {
        return documents.containsKey(docId);
    }

    public void add(DocumentRecord record) {
        if (documents.putIfAbsent(record.getDocId(), record) != null) {
            throw new IllegalArgumentException("Duplicate document id: " + record.getDocId());
        }
    }

    public Optional<DocumentRecord> findBySource(String relativePath, String contentHash) {
        return documents.values().stream()
            .filter(doc -> Objects.equals(doc.getRelativePath(), relativePath))
            .filter(doc -> Objects.equals(doc.getContentHash(), contentHash))
            .findFirst();
    }

    /**
     * Highest numeric suffix among {@code doc_NNN} ids, or 0 for an empty index.
     */
    public int highestDocumentNumber() {
        return documents.keySet().stream()
            .mapToInt(DataRoomIndex::documentNumber)
            .max()
            .orElse(0);
    }

    private static int documentNumber(String docId) {
        int separator = docId.lastIndexOf('_');
        try {
            return Integer.parseInt(docId.substring(separator + 1));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
