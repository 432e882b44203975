package com.tpanalyzer.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * File discovery and reading for program corpora.
 *
 * <p>Controller backups are written in ISO-8859-1, so program files are decoded with that
 * charset. The analysis core only receives the resulting texts.
 */
public final class FileUtils {

    private static final Logger log = LoggerFactory.getLogger(FileUtils.class);

    /**
     * Charset of teach pendant program files.
     */
    public static final Charset PROGRAM_CHARSET = StandardCharsets.ISO_8859_1;

    /**
     * Extension of ASCII program files, compared case-insensitively.
     */
    public static final String PROGRAM_EXTENSION = "ls";

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds program files ({@code *.LS}, any case) below a directory.
     *
     * @param rootPath directory to search
     * @return program files, sorted
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath) throws IOException {
        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> PROGRAM_EXTENSION.equals(getExtension(path).toLowerCase(Locale.ROOT)))
                .sorted()
                .toList();
        }
    }

    /**
     * Reads a program file.
     *
     * @param path program file
     * @return file text
     * @throws IOException if reading fails
     */
    public static String readProgram(Path path) throws IOException {
        return Files.readString(path, PROGRAM_CHARSET);
    }

    /**
     * Reads every program file below a directory.
     *
     * @param rootPath directory to search
     * @return file text keyed by path relative to the root, with {@code /} separators
     * @throws IOException if traversal or reading fails
     */
    public static SortedMap<String, String> readCorpus(Path rootPath) throws IOException {
        SortedMap<String, String> corpus = new TreeMap<>();
        for (Path file : findFiles(rootPath)) {
            String key = rootPath.relativize(file).toString().replace('\\', '/');
            corpus.put(key, readProgram(file));
        }
        log.debug("Read {} program files from {}", corpus.size(), rootPath);
        return corpus;
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }
}
