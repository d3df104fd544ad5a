package com.intenovation.webmail;

/**
 * Thrown when OR is applied to an operand that is not a single phrase.
 */
public class InvalidQueryShapeException extends IllegalArgumentException {

    public InvalidQueryShapeException(String message) {
        super(message);
    }
}
