package com.aclforge.api;

/**
 * Why a term was left out of a rendering. Skips are never fatal.
 */
public enum SkipReason {
    EXPIRED,
    PLATFORM_MISMATCH,
    ADDRESS_FAMILY_MISMATCH,
    PROTOCOL_FAMILY_MISMATCH,
    STATELESS_REPLY,
    PREFIX_LIST_UNSUPPORTED,
    // every include of one side is cancelled by an identical exclude
    ADDRESSES_EXCLUDED
}
