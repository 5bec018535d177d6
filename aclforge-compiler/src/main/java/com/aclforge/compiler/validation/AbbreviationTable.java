/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.compiler.validation;

import java.util.List;

/**
 * Ordered literal substitutions used to shorten identifiers. Earlier entries are
 * applied first.
 */
public record AbbreviationTable(List<Entry> entries) {

    public record Entry(String literal, String code) {
    }

    public static final AbbreviationTable DEFAULT = new AbbreviationTable(List.of(
            new Entry("bogons", "BGN"),
            new Entry("bogon", "BGN"),
            new Entry("reserved", "RSV"),
            new Entry("rfc1918", "PRV"),
            new Entry("rfc-1918", "PRV"),
            new Entry("internet", "EXT"),
            new Entry("global", "GBL"),
            new Entry("internal", "INT"),
            new Entry("customer", "CUST"),
            new Entry("google", "GOOG"),
            new Entry("ballmer", "ASS"),
            new Entry("microsoft", "LOL"),
            new Entry("china", "BAN"),
            new Entry("border", "BDR"),
            new Entry("service", "SVC"),
            new Entry("router", "RTR"),
            new Entry("transit", "TRNS"),
            new Entry("experiment", "EXP"),
            new Entry("established", "EST"),
            new Entry("unreachable", "UNR"),
            new Entry("fragment", "FRG"),
            new Entry("accept", "OK"),
            new Entry("discard", "DSC"),
            new Entry("reject", "REJ"),
            new Entry("replies", "ACK"),
            new Entry("request", "REQ")));

    public AbbreviationTable {
        entries = List.copyOf(entries);
    }
}
