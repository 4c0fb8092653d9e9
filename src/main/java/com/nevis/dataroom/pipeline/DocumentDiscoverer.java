package com.nevis.dataroom.pipeline;

import com.nevis.dataroom.exception.DiscoveryException;
import com.nevis.dataroom.model.DataRoomIndex;
import com.nevis.dataroom.model.DocumentRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Finds the supported documents below an input folder and gives each one a document id.
 * <p>
 * Files are visited in relative-path order. A file that the previous index already knows
 * (same relative path and content hash) keeps its record; other files get the next free
 * {@code doc_NNN} number.
 */
@Service
@Slf4j
public class DocumentDiscoverer {

    static final Set<String> SUPPORTED_EXTENSIONS = Set.of(
        "pdf", "doc", "docx", "xls", "xlsx", "ppt", "pptx", "txt", "rtf", "odt", "ods", "odp"
    );

    /**
     * Enumerates the documents of {@code inputRoot}. The folder is listed up front; files are
     * hashed lazily as the stream is consumed. Folders or files that cannot be visited are
     * logged and skipped.
     *
     * @throws IllegalArgumentException if {@code inputRoot} is not a readable directory
     */
    public Stream<DocumentRecord> discover(Path inputRoot, DataRoomIndex previous) {
        if (!Files.isDirectory(inputRoot)) {
            throw new IllegalArgumentException("Input folder does not exist or is not a directory: " + inputRoot);
        }
        log.info("Discovering documents in {}", inputRoot);
        AtomicInteger counter = new AtomicInteger(previous.highestDocumentNumber());

        CandidateCollector collector = new CandidateCollector();
        try {
            Files.walkFileTree(inputRoot, collector);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot walk input folder " + inputRoot, e);
        }

        return collector.candidates.stream()
            .sorted(Comparator.comparing(path -> relativeName(inputRoot, path)))
            .map(path -> toRecord(inputRoot, path, previous, counter))
            .flatMap(Optional::stream);
    }

    static final class CandidateCollector extends SimpleFileVisitor<Path> {

        final List<Path> candidates = new ArrayList<>();

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && isCandidate(file.getFileName().toString())) {
                candidates.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException e) {
            log.warn("Skipping unreadable path {}: {}", file, e.getMessage());
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException e) {
            if (e != null) {
                log.warn("Listing of {} stopped early: {}", dir, e.getMessage());
            }
            return FileVisitResult.CONTINUE;
        }
    }

    static boolean isCandidate(String fileName) {
        if (fileName.startsWith(".") || fileName.startsWith("~$")) {
            return false;
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            log.debug("Skipping {}: no extension", fileName);
            return false;
        }
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (!SUPPORTED_EXTENSIONS.contains(extension)) {
            log.debug("Skipping {}: unsupported extension", fileName);
            return false;
        }
        return true;
    }

    static String formatDocId(int number) {
        return "doc_%03d".formatted(number);
    }

    private Optional<DocumentRecord> toRecord(Path inputRoot, Path path, DataRoomIndex previous, AtomicInteger counter) {
        String relativePath = relativeName(inputRoot, path);
        try {
            String hash = contentHash(path);
            Optional<DocumentRecord> known = previous.findBySource(relativePath, hash);
            if (known.isPresent()) {
                log.debug("Known document {} -> {}", relativePath, known.get().getDocId());
                return known;
            }
            String docId = formatDocId(counter.incrementAndGet());
            log.info("Discovered {} as {}", relativePath, docId);
            return Optional.of(DocumentRecord.discovered(docId, path.toAbsolutePath(), relativePath, hash));
        } catch (DiscoveryException e) {
            log.warn("Skipping unreadable file {}: {}", relativePath, e.getCause().getMessage());
            return Optional.empty();
        }
    }

    private static String relativeName(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    private static String contentHash(Path path) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            try (InputStream in = new DigestInputStream(Files.newInputStream(path), digest)) {
                in.transferTo(OutputStream.nullOutputStream());
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (IOException e) {
            throw new DiscoveryException(path, e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
