package com.folderrag.error;

public class ServiceException extends RagException {
    private final int statusCode;

    public ServiceException(String url, int statusCode, String body) {
        super("Service at " + url + " answered HTTP " + statusCode + (body == null || body.isBlank() ? "" : ": " + body));
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }
}
