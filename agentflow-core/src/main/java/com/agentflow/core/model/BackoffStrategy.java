package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How the retry delay grows between attempts.
 */
public enum BackoffStrategy {
    /**
     * The same delay after every failed attempt.
     */
    LINEAR,

    /**
     * The delay doubles after every failed attempt.
     */
    EXPONENTIAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BackoffStrategy fromValue(String value) {
        if (value == null) {
            return null;
        }
        return BackoffStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
