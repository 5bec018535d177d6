/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.api.exceptions;

/**
 * Base class of every fatal error raised while translating or rendering a policy.
 *
 * This is a RuntimeException so renderers and engines can propagate failures
 * without declaring them; callers decide whether to abort the whole run or to
 * continue with the remaining targets.
 */
public class PolicyCompilationException extends RuntimeException {

    private final ErrorKind kind;

    public PolicyCompilationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PolicyCompilationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
