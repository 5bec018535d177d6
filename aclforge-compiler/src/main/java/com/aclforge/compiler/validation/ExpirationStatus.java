package com.aclforge.compiler.validation;

/**
 * Result of checking a term's expiration date.
 */
public enum ExpirationStatus {
    /** Not expiring within the warn window, or no expiration set. */
    OK,
    /** Expires within the warn window; still rendered. */
    WARN,
    /** Already expired; omitted from output. */
    SKIP
}
