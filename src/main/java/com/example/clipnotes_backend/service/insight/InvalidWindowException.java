package com.example.clipnotes_backend.service.insight;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Raised for unsupported window values and for window/token mismatches on shared snapshots.
 */
public class InvalidWindowException extends ResponseStatusException {
    private final String value;

    public InvalidWindowException(String value, String detail) {
        super(HttpStatus.BAD_REQUEST, "INVALID_WINDOW");
        this.value = value;
        setDetail(detail);
    }

    /**
     * Returns the offending window value as supplied by the caller.
     */
    public String getValue() {
        return value;
    }
}
