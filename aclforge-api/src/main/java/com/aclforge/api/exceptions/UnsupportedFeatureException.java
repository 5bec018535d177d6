/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.api.exceptions;

/**
 * Thrown when a protocol, filter type, filter option or action is not
 * expressible on the target platform.
 */
public class UnsupportedFeatureException extends PolicyCompilationException {

    public UnsupportedFeatureException(String message) {
        super(ErrorKind.UNSUPPORTED_FEATURE, message);
    }
}
