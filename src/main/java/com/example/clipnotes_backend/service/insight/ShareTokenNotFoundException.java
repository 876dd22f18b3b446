package com.example.clipnotes_backend.service.insight;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class ShareTokenNotFoundException extends ResponseStatusException {
    public ShareTokenNotFoundException() {
        super(HttpStatus.NOT_FOUND, "SHARE_NOT_FOUND");
        setDetail("Share token was not found.");
    }
}
