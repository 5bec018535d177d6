package com.aclforge.api;

/**
 * Record of a term omitted during translation.
 *
 * @param filterName filter the term belongs to, as named on the target platform
 * @param termName   term name as written in the policy
 * @param reason     skip category
 * @param detail     human readable explanation, also written to the log
 */
public record SkippedTerm(String filterName, String termName, SkipReason reason, String detail) {}
