/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.api.exceptions;

/**
 * Kinds of fatal translation failures.
 *
 * <p>Any of these aborts the whole {@code translate} call for a (policy, target) pair.
 * A partially translated configuration is never returned.
 */
public enum ErrorKind {
    /** A term uses a keyword the target does not support. */
    VALIDATION,
    /** A protocol, filter type, option or action cannot be expressed on the target. */
    UNSUPPORTED_FEATURE,
    /** Two terms in one filter share a name. */
    DUPLICATE_NAME,
    /** An identifier exceeds the target's limit even after abbreviation. */
    NAME_TOO_LONG,
    /** A block-nesting invariant was violated while emitting output. */
    STRUCTURAL
}
