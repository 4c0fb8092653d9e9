package com.nevis.dataroom.infra;

import com.nevis.dataroom.config.ConverterProperties;
import com.nevis.dataroom.exception.ConversionException;
import com.nevis.dataroom.exception.ConverterBusyException;
import com.nevis.dataroom.exception.ConverterUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Converts office documents to PDF with a headless LibreOffice process.
 * <p>
 * Every invocation gets its own user profile under the output directory, so parallel
 * conversions never contend for the profile lock of a shared instance.
 */
@Component
@Slf4j
public class LibreOfficeConverterClient implements ConverterClient {

    private static final String PROFILE_DIR = ".profile";
    private static final String CONSOLE_LOG = "converter.log";
    private static final Duration KILL_WAIT = Duration.ofSeconds(5);

    private final ConverterProperties properties;

    public LibreOfficeConverterClient(ConverterProperties properties) {
        this.properties = properties;
    }

    @Override
    public Path convertToPdf(Path source, Path outputDir) {
        log.info("Converting {} to PDF", source.getFileName());
        Path profileDir = outputDir.resolve(PROFILE_DIR);
        Path consoleLog = outputDir.resolve(CONSOLE_LOG);

        try {
            Files.createDirectories(profileDir);

            ProcessBuilder pb = new ProcessBuilder(buildCommand(source, outputDir, profileDir));
            pb.redirectErrorStream(true);
            pb.redirectOutput(consoleLog.toFile());

            Process process = pb.start();
            long timeoutMillis = properties.timeout().toMillis();
            boolean finished = process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS);
            if (!finished) {
                terminate(process);
                throw new ConversionException(source,
                    "Converter timeout after %d ms".formatted(timeoutMillis));
            }

            String output = readConsole(consoleLog);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                String detail = lastLines(output);
                if (isBusy(output)) {
                    log.warn("Converter busy for {} (exit code {}): {}", source.getFileName(), exitCode, detail);
                    throw new ConverterBusyException(source,
                        "Converter busy (exit code %d): %s".formatted(exitCode, detail));
                }
                throw new ConversionException(source,
                    "Conversion failed (exit code %d): %s".formatted(exitCode, detail));
            }

            Path pdf = locateOutput(source, outputDir);
            log.debug("Converter produced {} ({} bytes)", pdf, Files.size(pdf));
            return pdf;

        } catch (IOException e) {
            throw new ConversionException(source, "I/O error during conversion: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConversionException(source, "Conversion interrupted", e);
        } finally {
            deleteQuietly(profileDir);
        }
    }

    @Override
    public void verifyAvailable() {
        String command = properties.command();
        try {
            ProcessBuilder pb = new ProcessBuilder(command, "--version");
            pb.redirectErrorStream(true);
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
            Process process = pb.start();
            boolean finished = process.waitFor(properties.probeTimeout().toMillis(), TimeUnit.MILLISECONDS);

            if (!finished) {
                terminate(process);
                throw new ConverterUnavailableException("Converter '%s' did not answer within %s"
                    .formatted(command, properties.probeTimeout()));
            }
            if (process.exitValue() != 0) {
                throw new ConverterUnavailableException("Converter '%s' exited with code %d on --version"
                    .formatted(command, process.exitValue()));
            }
        } catch (IOException e) {
            throw new ConverterUnavailableException(
                "Converter '%s' not found. Install LibreOffice or set app.converter.command".formatted(command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConverterUnavailableException("Converter probe interrupted", e);
        }
    }

    // soffice forks soffice.bin, which holds the profile lock; kill the whole tree.
    private static void terminate(Process process) throws InterruptedException {
        List<ProcessHandle> children = process.descendants().toList();
        children.forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        if (!process.waitFor(KILL_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("Converter process {} still running after kill", process.pid());
        }
    }

    List<String> buildCommand(Path source, Path outputDir, Path profileDir) {
        List<String> command = new ArrayList<>();
        command.add(properties.command());
        command.add("-env:UserInstallation=" + profileDir.toAbsolutePath().toUri());
        command.add("--headless");
        command.add("--norestore");
        command.add("--convert-to");
        command.add("pdf");
        command.add("--outdir");
        command.add(outputDir.toAbsolutePath().toString());
        command.add(source.toAbsolutePath().toString());
        return command;
    }

    boolean isBusy(String output) {
        String normalized = output.toLowerCase(Locale.ROOT);
        return properties.busySignatures().stream()
            .map(signature -> signature.toLowerCase(Locale.ROOT))
            .anyMatch(normalized::contains);
    }

    private Path locateOutput(Path source, Path outputDir) throws IOException {
        String fileName = source.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        Path expected = outputDir.resolve(stem + ".pdf");
        if (Files.isRegularFile(expected)) {
            return expected;
        }
        try (Stream<Path> files = Files.list(outputDir)) {
            return files
                .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
                .findFirst()
                .orElseThrow(() -> new ConversionException(source, "Converter exited cleanly but produced no PDF"));
        }
    }

    private static String readConsole(Path consoleLog) throws IOException {
        return Files.exists(consoleLog) ? Files.readString(consoleLog, StandardCharsets.UTF_8) : "";
    }

    private static String lastLines(String output) {
        String[] lines = output.strip().split("\n");
        int start = Math.max(0, lines.length - 5);
        StringBuilder detail = new StringBuilder();
        for (int i = start; i < lines.length; i++) {
            detail.append(lines[i].trim()).append("; ");
        }
        String text = detail.toString().trim();
        return text.isEmpty() ? "no output" : text;
    }

    private static void deleteQuietly(Path directory) {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
        } catch (IOException e) {
            log.debug("Could not remove converter profile {}: {}", directory, e.getMessage());
        }
    }
}
