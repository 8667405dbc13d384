package com.openapi.simpleDeref.codec;

/**
 * A document node does not have the shape its position requires.
 */
public class OpenApiFormatException extends Exception {
    private final String path;

    public OpenApiFormatException(String path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public OpenApiFormatException(String path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    /**
     * JSON pointer of the offending node, relative to the node handed to the reader.
     */
    public String getPath() {
        return path;
    }
}
