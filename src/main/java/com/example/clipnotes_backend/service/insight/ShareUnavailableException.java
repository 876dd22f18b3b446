package com.example.clipnotes_backend.service.insight;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Sharing cannot be served by this deployment; operator-fixable configuration or token exhaustion.
 */
public class ShareUnavailableException extends ResponseStatusException {
    public ShareUnavailableException(String detail) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "SHARE_UNAVAILABLE");
        setDetail(detail);
    }
}
