package com.folderrag.error;

/**
 * The request never produced an HTTP response: connection refused, DNS failure,
 * or the call exceeded its timeout.
 */
public class TransportException extends RagException {
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
