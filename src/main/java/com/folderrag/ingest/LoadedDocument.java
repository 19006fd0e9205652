package com.folderrag.ingest;

import java.nio.file.Path;

public record LoadedDocument(Path path, String source, String content) {
}
