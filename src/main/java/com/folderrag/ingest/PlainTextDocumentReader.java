package com.folderrag.ingest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads UTF-8 text files whose extension is on an allow-list, compared case-insensitively.
 */
public class PlainTextDocumentReader implements DocumentReader {
    public static final List<String> DEFAULT_EXTENSIONS = List.of(".txt", ".md", ".csv");
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final Set<String> extensions;

    public PlainTextDocumentReader() {
        this(DEFAULT_EXTENSIONS);
    }

    public PlainTextDocumentReader(List<String> extensions) {
        this.extensions = extensions.stream()
                .map(PlainTextDocumentReader::normalizeExtension)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public boolean supports(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        return extensions.contains(name.substring(dot).toLowerCase(Locale.ROOT));
    }

    @Override
    public LoadedDocument read(Path path) throws IOException {
        // Malformed byte sequences are replaced rather than rejected.
        String content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        if (!content.isEmpty() && content.charAt(0) == BYTE_ORDER_MARK) {
            content = content.substring(1);
        }
        return new LoadedDocument(path, path.getFileName().toString(), content);
    }

    public Set<String> extensions() {
        return extensions;
    }

    private static String normalizeExtension(String extension) {
        String lower = extension.strip().toLowerCase(Locale.ROOT);
        return lower.startsWith(".") ? lower : "." + lower;
    }
}
