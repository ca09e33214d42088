package com.bingo.cards.config;

/**
 * Exception thrown when an event configuration cannot be read or is invalid.
 */
public class EventConfigException extends Exception {
    public EventConfigException(String message) {
        super(message);
    }

    public EventConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
