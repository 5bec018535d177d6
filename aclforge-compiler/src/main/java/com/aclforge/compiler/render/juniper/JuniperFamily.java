/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.compiler.render.juniper;

import com.aclforge.compiler.address.AddressFamily;

import java.util.EnumMap;
import java.util.Map;

/**
 * Filter families a Juniper firewall accepts, with the keyword spelling of each.
 */
enum JuniperFamily {
    INET(AddressFamily.INET, Map.of(
            JuniperKeyword.SOURCE_ADDRESS, "source-address",
            JuniperKeyword.DESTINATION_ADDRESS, "destination-address",
            JuniperKeyword.PROTOCOL, "protocol",
            JuniperKeyword.PROTOCOL_EXCEPT, "protocol-except",
            JuniperKeyword.TCP_ESTABLISHED, "tcp-established")),
    INET6(AddressFamily.INET6, Map.of(
            JuniperKeyword.SOURCE_ADDRESS, "source-address",
            JuniperKeyword.DESTINATION_ADDRESS, "destination-address",
            JuniperKeyword.PROTOCOL, "next-header",
            JuniperKeyword.PROTOCOL_EXCEPT, "next-header-except",
            JuniperKeyword.TCP_ESTABLISHED, "tcp-established")),
    BRIDGE(AddressFamily.BRIDGE, Map.of(
            JuniperKeyword.SOURCE_ADDRESS, "ip-source-address",
            JuniperKeyword.DESTINATION_ADDRESS, "ip-destination-address",
            JuniperKeyword.PROTOCOL, "ip-protocol",
            JuniperKeyword.PROTOCOL_EXCEPT, "ip-protocol-except",
            JuniperKeyword.TCP_ESTABLISHED, "tcp-flags \"(ack|rst)\""));

    private final AddressFamily addressFamily;
    private final EnumMap<JuniperKeyword, String> keywords;

    JuniperFamily(AddressFamily addressFamily, Map<JuniperKeyword, String> keywords) {
        this.addressFamily = addressFamily;
        this.keywords = new EnumMap<>(keywords);
    }

    AddressFamily addressFamily() {
        return addressFamily;
    }

    String keyword(JuniperKeyword keyword) {
        return keywords.get(keyword);
    }

    String token() {
        return addressFamily.token();
    }

    /**
     * @return the family, or null if the token is not a Juniper filter family
     */
    static JuniperFamily fromToken(String token) {
        for (JuniperFamily family : values()) {
            if (family.token().equals(token)) {
                return family;
            }
        }
        return null;
    }
}
