package com.example.vulncases.validation;

/**
 * A single rejected field and the reason it was rejected.
 */
public record FieldError(String field, String message) { }
