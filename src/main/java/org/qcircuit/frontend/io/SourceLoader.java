package org.qcircuit.frontend.io;

import org.qcircuit.circuit.CircuitFileException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Centralizes file loading for the importers. Failures surface as
 * {@link CircuitFileException}s so that they stay distinguishable from parse errors.
 */
public final class SourceLoader {

    /**
     * Result of loading a source file.
     *
     * @param content     The file content (line endings normalized to {@code \n}).
     * @param logicalName The normalized path used in diagnostics and include deduplication.
     */
    public record LoadResult(String content, String logicalName) {}

    private SourceLoader() {}

    /**
     * Loads content from a local filesystem path.
     *
     * @param path The path to read.
     * @return The loaded content and the normalized path as logical name.
     * @throws CircuitFileException If the file cannot be opened or read.
     */
    public static LoadResult loadFile(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        String logicalName = normalized.toString().replace('\\', '/');
        try {
            String content = normalizeLineEndings(Files.readString(normalized, StandardCharsets.UTF_8));
            return new LoadResult(content, logicalName);
        } catch (IOException e) {
            throw new CircuitFileException("Error opening/reading from file: " + path, e);
        }
    }

    /**
     * Resolves an included path against the directory of the including file.
     * Falls back to {@code baseDir} if the including file has no parent directory.
     *
     * @param pathValue The path as written in the include statement.
     * @param includingFileName The logical name of the including file, may be null.
     * @param baseDir The directory of the main source file.
     * @return The resolved path.
     */
    public static Path resolveInclude(String pathValue, String includingFileName, Path baseDir) {
        Path includingFileDir = baseDir;
        if (includingFileName != null && !includingFileName.isEmpty()) {
            Path parent = Path.of(includingFileName).getParent();
            if (parent != null) {
                includingFileDir = parent;
            }
        }
        if (includingFileDir == null) {
            return Path.of(pathValue).normalize();
        }
        return includingFileDir.resolve(pathValue).normalize();
    }

    /**
     * @param path A file path.
     * @return The file name without directory and without its last extension.
     */
    public static String baseName(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * @param path A file path.
     * @return The lower-case extension without the dot, or an empty string.
     */
    public static String extension(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 ? fileName.substring(dot + 1).toLowerCase() : "";
    }

    private static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
