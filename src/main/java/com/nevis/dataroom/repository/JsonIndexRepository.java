package com.nevis.dataroom.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.nevis.dataroom.config.IndexerProperties;
import com.nevis.dataroom.exception.PersistenceException;
import com.nevis.dataroom.model.DataRoomIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps the data room index as one pretty-printed JSON file.
 * <p>
 * Writes go to a temporary file in the same directory which is then renamed over the index,
 * so a reader never sees a half-written file.
 */
@Repository
@Slf4j
public class JsonIndexRepository implements IndexRepository {

    private final ObjectMapper objectMapper;
    private final Path indexFile;

    @Autowired
    public JsonIndexRepository(ObjectMapper objectMapper, IndexerProperties properties) {
        this(objectMapper, properties.indexFile());
    }

    public JsonIndexRepository(ObjectMapper objectMapper, Path indexFile) {
        this.objectMapper = objectMapper.copy()
            .findAndRegisterModules()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.indexFile = indexFile;
    }

    @Override
    public Optional<DataRoomIndex> load() {
        if (!Files.exists(indexFile)) {
            log.debug("No index found at {}", indexFile);
            return Optional.empty();
        }
        try {
            IndexFile file = objectMapper.readValue(indexFile.toFile(), IndexFile.class);
            DataRoomIndex index = IndexFileMapper.fromFile(file);
            log.debug("Loaded index v{} with {} documents", index.getMetadata().version(), index.totalDocuments());
            return Optional.of(index);
        } catch (IOException | RuntimeException e) {
            throw new PersistenceException(indexFile, "Cannot read data room index", e);
        }
    }

    @Override
    public void save(DataRoomIndex index) {
        Path directory = indexFile.toAbsolutePath().getParent();
        Path tempFile = null;
        try {
            Files.createDirectories(directory);
            tempFile = Files.createTempFile(directory, indexFile.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(tempFile)) {
                objectMapper.writeValue(out, IndexFileMapper.toFile(index));
            }
            moveIntoPlace(tempFile);
            log.info("Index v{} written to {} ({} documents)",
                index.getMetadata().version(), indexFile, index.totalDocuments());
        } catch (IOException e) {
            deleteTemp(tempFile);
            throw new PersistenceException(indexFile, "Cannot write data room index", e);
        }
    }

    public Path getIndexFile() {
        return indexFile;
    }

    private void moveIntoPlace(Path tempFile) throws IOException {
        try {
            Files.move(tempFile, indexFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", indexFile);
            Files.move(tempFile, indexFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTemp(Path tempFile) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            log.warn("Could not remove temporary index file {}: {}", tempFile, e.getMessage());
        }
    }
}
