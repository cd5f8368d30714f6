package com.mini_x.social_graph.exception;



public class InvalidInputException extends RuntimeException {
    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(Object value, String expected) {
        super(String.format("Invalid target %s (%s), expected %s",
                value, value == null ? "null" : value.getClass().getSimpleName(), expected));
    }
}
