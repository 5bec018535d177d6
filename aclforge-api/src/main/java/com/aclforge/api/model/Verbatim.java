package com.aclforge.api.model;

/**
 * Raw target text attached to a term; bypasses translation on the named platform.
 */
public record Verbatim(String platform, String text) {}
