package com.nevis.dataroom.pipeline;

import com.nevis.dataroom.config.IndexerProperties;
import com.nevis.dataroom.exception.RasterizationException;
import com.nevis.dataroom.model.DocumentRecord;
import com.nevis.dataroom.model.DocumentStatus;
import com.nevis.dataroom.model.PageRecord;
import com.nevis.dataroom.model.PipelineStage;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Renders every page of a canonical PDF to {@code <output>/pages/<docId>/page_NNN.png}.
 * <p>
 * A PDF that cannot be opened fails the document. A page that cannot be rendered keeps its
 * slot with an error, and the remaining pages are still rendered.
 */
@Service
@Slf4j
public class PageRasterizer {

    private static final String IMAGE_FORMAT = "png";

    private final Executor rasterExecutor;
    private final IndexerProperties properties;

    public PageRasterizer(@Qualifier("rasterTaskExecutor") Executor rasterExecutor, IndexerProperties properties) {
        this.rasterExecutor = rasterExecutor;
        this.properties = properties;
    }

    public void rasterize(List<DocumentRecord> documents, RunContext context) {
        List<DocumentRecord> pending = documents.stream()
            .filter(doc -> doc.getStatus() == DocumentStatus.NORMALIZED)
            .toList();
        log.info("Rasterize: {} documents at {} dpi", pending.size(), properties.dpi());

        CompletableFuture<?>[] futures = pending.stream()
            .map(doc -> CompletableFuture.runAsync(() -> rasterizeOne(doc, context), rasterExecutor))
            .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(futures).join();
    }

    void rasterizeOne(DocumentRecord doc, RunContext context) {
        if (context.isCancelled()) {
            log.debug("Run cancelled, leaving {} un-rasterized", doc.getDocId());
            return;
        }
        try {
            List<PageRecord> pages = renderPages(doc);
            doc.markRasterized(pages);
            long failed = pages.stream().filter(page -> !page.hasImage()).count();
            if (failed > 0) {
                log.warn("Doc {}: {} of {} pages could not be rendered", doc.getDocId(), failed, pages.size());
            } else {
                log.info("Doc {}: {} pages rendered", doc.getDocId(), pages.size());
            }
        } catch (RasterizationException e) {
            log.warn("Doc {}: rasterization failed: {}", doc.getDocId(), e.getMessage());
            doc.markFailed(PipelineStage.RASTERIZE, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Doc {}: unexpected rasterization error", doc.getDocId(), e);
            doc.markFailed(PipelineStage.RASTERIZE, e.getMessage());
        }
    }

    private List<PageRecord> renderPages(DocumentRecord doc) {
        Path pdfPath = doc.getCanonicalPdfPath();
        Path pageDir = properties.pagesDir().resolve(doc.getDocId());

        try (PDDocument pdf = Loader.loadPDF(pdfPath.toFile())) {
            int pageCount = pdf.getNumberOfPages();
            if (pageCount == 0) {
                throw new RasterizationException(doc.getDocId(), "PDF has no pages", null);
            }
            Files.createDirectories(pageDir);

            PDFRenderer renderer = new PDFRenderer(pdf);
            int width = Math.max(3, String.valueOf(pageCount).length());
            List<PageRecord> pages = new ArrayList<>(pageCount);
            for (int index = 0; index < pageCount; index++) {
                int pageNum = index + 1;
                Path target = pageDir.resolve(imageName(pageNum, width));
                pages.add(renderPage(renderer, index, target, doc.getDocId()));
            }
            return pages;
        } catch (IOException e) {
            throw new RasterizationException(doc.getDocId(), "Cannot open PDF: " + e.getMessage(), e);
        }
    }

    private PageRecord renderPage(PDFRenderer renderer, int index, Path target, String docId) {
        int pageNum = index + 1;
        try {
            if (isReusable(target)) {
                log.debug("Doc {}: reusing {}", docId, target.getFileName());
                return PageRecord.rendered(pageNum, target);
            }
            BufferedImage image = renderer.renderImageWithDPI(index, properties.dpi(), ImageType.RGB);
            writeImage(image, target);
            return PageRecord.rendered(pageNum, target);
        } catch (IOException | RuntimeException e) {
            log.warn("Doc {}: page {} could not be rendered: {}", docId, pageNum, e.getMessage());
            return PageRecord.unrendered(pageNum, e.getMessage());
        }
    }

    static String imageName(int pageNum, int width) {
        return "page_" + String.format("%0" + width + "d", pageNum) + "." + IMAGE_FORMAT;
    }

    // A file left by an interrupted run is reused only if it still decodes.
    static boolean isReusable(Path target) {
        if (!Files.isRegularFile(target)) {
            return false;
        }
        try {
            return Files.size(target) > 0 && ImageIO.read(target.toFile()) != null;
        } catch (IOException | RuntimeException e) {
            log.debug("Discarding unreadable page image {}: {}", target, e.getMessage());
            return false;
        }
    }

    private static void writeImage(BufferedImage image, Path target) throws IOException {
        Path tempFile = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            if (!ImageIO.write(image, IMAGE_FORMAT, tempFile.toFile())) {
                throw new IOException("No " + IMAGE_FORMAT + " writer available");
            }
            moveIntoPlace(tempFile, target);
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }

    private static void moveIntoPlace(Path tempFile, Path target) throws IOException {
        try {
            Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
