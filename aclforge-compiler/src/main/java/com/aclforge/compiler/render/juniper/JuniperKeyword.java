package com.aclforge.compiler.render.juniper;

/**
 * Match keywords whose spelling depends on the filter family.
 */
enum JuniperKeyword {
    SOURCE_ADDRESS,
    DESTINATION_ADDRESS,
    PROTOCOL,
    PROTOCOL_EXCEPT,
    TCP_ESTABLISHED
}
