package com.folderrag.error;

public class OperationCancelledException extends RagException {
    public OperationCancelledException(String message) {
        super(message);
    }
}
