package com.climaterisklens.assets;

/**
 * An uploaded site file was rejected. {@link #code()} is the API error code.
 */
public class InvalidUploadException extends Exception {
    private final String code;

    public InvalidUploadException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
