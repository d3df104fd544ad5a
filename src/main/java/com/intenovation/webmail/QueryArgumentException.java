package com.intenovation.webmail;

/**
 * Thrown while building a query when a predicate is given no usable argument.
 */
public class QueryArgumentException extends IllegalArgumentException {

    public QueryArgumentException(String message) {
        super(message);
    }
}
