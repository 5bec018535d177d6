/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.api.exceptions;

/**
 * Thrown when two terms of the same filter share a name.
 */
public class DuplicateNameException extends PolicyCompilationException {

    private final String name;

    public DuplicateNameException(String name) {
        super(ErrorKind.DUPLICATE_NAME, "Duplicate term name: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
