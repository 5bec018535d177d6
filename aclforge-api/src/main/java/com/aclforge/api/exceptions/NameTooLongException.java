/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.api.exceptions;

/**
 * Thrown when an identifier cannot be made to fit the target's length limit.
 */
public class NameTooLongException extends PolicyCompilationException {

    private final String originalName;
    private final String abbreviatedName;
    private final int maxLength;

    public NameTooLongException(String originalName, String abbreviatedName, int maxLength) {
        super(ErrorKind.NAME_TOO_LONG, String.format(
                "Name %s (originally %s) is too long: limit is %d characters, got %d, and no abbreviations remain",
                abbreviatedName, originalName, maxLength, abbreviatedName.length()));
        this.originalName = originalName;
        this.abbreviatedName = abbreviatedName;
        this.maxLength = maxLength;
    }

    public String getOriginalName() {
        return originalName;
    }

    public String getAbbreviatedName() {
        return abbreviatedName;
    }

    public int getMaxLength() {
        return maxLength;
    }
}
