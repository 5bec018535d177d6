/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.api.model;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Static enumeration of every keyword a {@link Term} can carry.
 *
 * <p>Required keywords are supported by every target. Each renderer declares the
 * optional keywords it can express; a term that sets any other keyword is rejected
 * so that output never silently drops part of the author's intent.
 */
public enum TermField {
    NAME("name", true, t -> true),
    ACTION("action", true, t -> t.action() != null),
    COMMENT("comment", true, t -> !t.comments().isEmpty()),
    OWNER("owner", true, t -> t.owner() != null),
    EXPIRATION("expiration", true, t -> t.expiration() != null),
    PROTOCOL("protocol", true, t -> !t.protocols().isEmpty()),
    SOURCE_ADDRESS("source_address", true, t -> !t.sourceAddresses().isEmpty()),
    SOURCE_ADDRESS_EXCLUDE("source_address_exclude", true, t -> !t.sourceAddressExcludes().isEmpty()),
    DESTINATION_ADDRESS("destination_address", true, t -> !t.destinationAddresses().isEmpty()),
    DESTINATION_ADDRESS_EXCLUDE("destination_address_exclude", true, t -> !t.destinationAddressExcludes().isEmpty()),
    SOURCE_PORT("source_port", true, t -> !t.sourcePorts().isEmpty()),
    DESTINATION_PORT("destination_port", true, t -> !t.destinationPorts().isEmpty()),
    ICMP_TYPE("icmp_type", true, t -> !t.icmpTypes().isEmpty()),
    OPTION("option", true, t -> !t.options().isEmpty()),
    PLATFORM("platform", true, t -> !t.platforms().isEmpty()),
    PLATFORM_EXCLUDE("platform_exclude", true, t -> !t.platformExcludes().isEmpty()),
    VERBATIM("verbatim", true, t -> !t.verbatim().isEmpty()),
    STATELESS_REPLY("stateless_reply", true, Term::statelessReply),

    LOGGING("logging", false, Term::isLogging),
    COUNTER("counter", false, t -> t.counter() != null),
    POLICER("policer", false, t -> t.policer() != null),
    QOS("qos", false, t -> t.qos() != null),
    LOSS_PRIORITY("loss_priority", false, t -> t.lossPriority() != null),
    ROUTING_INSTANCE("routing_instance", false, t -> t.routingInstance() != null),
    PACKET_LENGTH("packet_length", false, t -> t.packetLength() != null),
    FRAGMENT_OFFSET("fragment_offset", false, t -> t.fragmentOffset() != null),
    SOURCE_INTERFACE("source_interface", false, t -> t.sourceInterface() != null),
    DESTINATION_INTERFACE("destination_interface", false, t -> t.destinationInterface() != null),
    SOURCE_PREFIX("source_prefix", false, t -> !t.sourcePrefixes().isEmpty()),
    DESTINATION_PREFIX("destination_prefix", false, t -> !t.destinationPrefixes().isEmpty()),
    PRECEDENCE("precedence", false, t -> !t.precedence().isEmpty()),
    PROTOCOL_EXCEPT("protocol_except", false, t -> !t.protocolExcepts().isEmpty());

    private final String keyword;
    private final boolean required;
    private final Predicate<Term> present;

    TermField(String keyword, boolean required, Predicate<Term> present) {
        this.keyword = keyword;
        this.required = required;
        this.present = present;
    }

    /**
     * Policy-language keyword, e.g. {@code source_address_exclude}.
     */
    public String keyword() {
        return keyword;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean isSetOn(Term term) {
        return present.test(term);
    }

    public static Set<TermField> required() {
        EnumSet<TermField> fields = EnumSet.noneOf(TermField.class);
        for (TermField field : values()) {
            if (field.required) {
                fields.add(field);
            }
        }
        return fields;
    }

    /**
     * Keywords that have a non-empty value on the given term, in declaration order.
     */
    public static Set<TermField> setOn(Term term) {
        EnumSet<TermField> fields = EnumSet.noneOf(TermField.class);
        for (TermField field : values()) {
            if (field.present.test(term)) {
                fields.add(field);
            }
        }
        return fields;
    }
}
