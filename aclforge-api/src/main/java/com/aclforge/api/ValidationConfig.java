/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.api;

import java.time.Clock;
import java.time.LocalDate;
import java.time.Period;
import java.util.Objects;

/**
 * Translation-time settings shared by all targets.
 *
 * <p>Configuration via environment variables or system properties:
 * <ul>
 *   <li>ACLFORGE_EXPIRY_WARN_WEEKS: weeks before expiration at which a term is
 *   reported as expiring soon (default: 2)</li>
 * </ul>
 *
 * @param today      the date terms are checked against
 * @param warnWindow how far ahead of expiration to start reporting
 */
public record ValidationConfig(LocalDate today, Period warnWindow) {

    public static final int DEFAULT_WARN_WEEKS = 2;

    public ValidationConfig {
        Objects.requireNonNull(today, "today");
        Objects.requireNonNull(warnWindow, "warnWindow");
        if (warnWindow.isNegative()) {
            throw new IllegalArgumentException("Expiry warn window cannot be negative: " + warnWindow);
        }
    }

    public static ValidationConfig defaults() {
        return of(Clock.systemDefaultZone(), DEFAULT_WARN_WEEKS);
    }

    public static ValidationConfig of(Clock clock, int warnWeeks) {
        return new ValidationConfig(LocalDate.now(clock), Period.ofWeeks(warnWeeks));
    }

    public static ValidationConfig of(LocalDate today) {
        return new ValidationConfig(today, Period.ofWeeks(DEFAULT_WARN_WEEKS));
    }

    public static ValidationConfig fromEnvironment() {
        String weeks = getEnvOrProperty("ACLFORGE_EXPIRY_WARN_WEEKS", String.valueOf(DEFAULT_WARN_WEEKS));
        int parsed;
        try {
            parsed = Integer.parseInt(weeks.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("ACLFORGE_EXPIRY_WARN_WEEKS must be an integer, got: " + weeks, e);
        }
        return of(Clock.systemDefaultZone(), parsed);
    }

    /**
     * Last date (inclusive) that still falls inside the warn window.
     */
    public LocalDate warnHorizon() {
        return today.plus(warnWindow);
    }

    private static String getEnvOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }
}
