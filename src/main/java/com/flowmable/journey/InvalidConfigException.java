package com.flowmable.journey;

/**
 * Thrown when a {@link JourneyConfig} cannot produce a journey.
 * The message names the offending field and value.
 */
public class InvalidConfigException extends IllegalArgumentException {

    private final String field;

    public InvalidConfigException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    /** Name of the config component that failed validation. */
    public String field() {
        return field;
    }
}
