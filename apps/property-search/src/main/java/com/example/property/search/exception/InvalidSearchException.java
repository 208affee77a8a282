package com.example.property.search.exception;

import lombok.Getter;

/**
 * The search request is malformed. The only error a search ever surfaces to its caller.
 */
@Getter
public class InvalidSearchException extends RuntimeException {

    private final String field;

    public InvalidSearchException(String field, String message) {
        super(message);
        this.field = field;
    }
}
