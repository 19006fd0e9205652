package com.folderrag.error;

import java.nio.file.Path;

public class DocumentsNotFoundException extends RagException {
    private final Path folder;

    public DocumentsNotFoundException(Path folder) {
        super("Folder not found: " + folder);
        this.folder = folder;
    }

    public Path folder() {
        return folder;
    }
}
