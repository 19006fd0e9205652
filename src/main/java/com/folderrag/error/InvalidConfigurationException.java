package com.folderrag.error;

public class InvalidConfigurationException extends RagException {
    public InvalidConfigurationException(String message) {
        super(message);
    }
}
