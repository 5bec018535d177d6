/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.api.exceptions;

/**
 * Guards the nested-block emitters: raised when blocks are closed more often
 * than opened, or left open at the end of rendering. Indicates a renderer bug.
 */
public class StructuralException extends PolicyCompilationException {

    public StructuralException(String message) {
        super(ErrorKind.STRUCTURAL, message);
    }
}
