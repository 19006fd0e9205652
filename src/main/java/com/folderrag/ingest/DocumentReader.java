package com.folderrag.ingest;

import java.io.IOException;
import java.nio.file.Path;

public interface DocumentReader {
    boolean supports(Path path);

    LoadedDocument read(Path path) throws IOException;
}
