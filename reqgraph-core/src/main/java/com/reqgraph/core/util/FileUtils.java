package com.reqgraph.core.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files matching a glob pattern starting from a root directory.
     *
     * <p>Results are sorted by path so callers see a stable order across platforms.
     * A missing root yields an empty list.
     *
     * @param rootPath root directory to search from
     * @param globPattern glob pattern, matched against the path relative to {@code rootPath}
     * @return sorted list of matching paths
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        if (!Files.isDirectory(rootPath)) {
            return List.of();
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);

        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> matcher.matches(rootPath.relativize(path)))
                .sorted(Comparator.comparing(path -> rootPath.relativize(path).toString()))
                .toList();
        }
    }

    /**
     * Writes content so that readers observe either the previous file or the complete new one.
     *
     * <p>Content goes to a temporary sibling first, which is then moved over the target.
     * Falls back to a replacing move where the file system has no atomic move.
     *
     * @param target file to write
     * @param content UTF-8 content
     * @throws IOException if writing or moving fails
     */
    public static void writeAtomically(Path target, String content) throws IOException {
        Path directory = target.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Appends a single line to a file, creating the file and its parent directories as needed.
     *
     * @param path file to append to
     * @param line line content without terminator
     * @throws IOException if writing fails
     */
    public static void appendLine(Path path, String line) throws IOException {
        Path directory = path.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Files.writeString(path, line + System.lineSeparator(), StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    /**
     * Reads a file as a UTF-8 string, or returns null if it does not exist.
     *
     * @param path path to file
     * @return file content, or null when absent
     * @throws IOException if reading fails
     */
    public static String readIfExists(Path path) throws IOException {
        return Files.isRegularFile(path) ? Files.readString(path, StandardCharsets.UTF_8) : null;
    }

    /**
     * Gets the file name without its extension.
     *
     * @param path file path
     * @return file name up to the last dot
     */
    public static String getBaseName(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }
}
