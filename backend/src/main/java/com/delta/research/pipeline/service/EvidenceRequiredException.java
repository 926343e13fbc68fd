package com.delta.research.pipeline.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * A derived fact was offered without the source document that supports it.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class EvidenceRequiredException extends RuntimeException {
    public EvidenceRequiredException(String message) {
        super(message);
    }
}
