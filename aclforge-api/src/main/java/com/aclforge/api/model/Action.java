/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.api.model;

/**
 * Terminal action of a term.
 */
public enum Action {
    ACCEPT("accept"),
    DENY("deny"),
    REJECT("reject"),
    REJECT_WITH_TCP_RST("reject-with-tcp-rst"),
    NEXT("next");

    private final String token;

    Action(String token) {
        this.token = token;
    }

    /**
     * Policy-language spelling, e.g. {@code reject-with-tcp-rst}.
     */
    public String token() {
        return token;
    }

    /**
     * Resolves the policy-language spelling (case-insensitive).
     *
     * @return the action, or null if the token is unknown
     */
    public static Action fromToken(String token) {
        if (token == null) return null;
        for (Action action : values()) {
            if (action.token.equalsIgnoreCase(token.trim())) {
                return action;
            }
        }
        return null;
    }
}
