/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.compiler.validation;

import com.aclforge.api.exceptions.DuplicateNameException;
import com.aclforge.api.exceptions.NameTooLongException;
import com.aclforge.api.exceptions.ValidationException;
import com.aclforge.api.model.Term;
import com.aclforge.api.model.TermField;

import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Term-level checks shared by all renderers: duplicate names, expiration, keyword
 * support and identifier length.
 */
public class TermValidator {
    private static final Logger logger = Logger.getLogger(TermValidator.class.getName());

    private final AbbreviationTable abbreviations;

    public TermValidator() {
        this(AbbreviationTable.DEFAULT);
    }

    public TermValidator(AbbreviationTable abbreviations) {
        this.abbreviations = abbreviations;
    }

    /**
     * Rejects the first name seen twice.
     *
     * @throws DuplicateNameException naming the repeated term
     */
    public void checkDuplicateNames(List<Term> terms) {
        Set<String> seen = new HashSet<>();
        for (Term term : terms) {
            if (!seen.add(term.name())) {
                throw new DuplicateNameException(term.name());
            }
        }
    }

    /**
     * Classifies a term's expiration against today.
     *
     * <ul>
     *   <li>expiration on or before today: {@link ExpirationStatus#SKIP}</li>
     *   <li>expiration within {@code warnWindow} after today: {@link ExpirationStatus#WARN}</li>
     *   <li>otherwise, or no expiration: {@link ExpirationStatus#OK}</li>
     * </ul>
     */
    public ExpirationStatus checkExpiration(Term term, LocalDate today, Period warnWindow) {
        LocalDate expiration = term.expiration();
        if (expiration == null) {
            return ExpirationStatus.OK;
        }
        if (!expiration.isAfter(today)) {
            return ExpirationStatus.SKIP;
        }
        if (!expiration.isAfter(today.plus(warnWindow))) {
            return ExpirationStatus.WARN;
        }
        return ExpirationStatus.OK;
    }

    /**
     * Ensures every keyword set on the term is in the target's supported set.
     *
     * @throws ValidationException listing every unsupported keyword
     */
    public void checkSupportedKeywords(Term term, Set<TermField> supported) {
        List<String> unsupported = new ArrayList<>();
        for (TermField field : TermField.setOn(term)) {
            if (!supported.contains(field)) {
                unsupported.add(field.keyword());
            }
        }
        if (!unsupported.isEmpty()) {
            throw new ValidationException(String.format(
                    "Term %s uses unsupported keywords: %s", term.name(), String.join(", ", unsupported)));
        }
    }

    /**
     * Fits an identifier to a length limit.
     *
     * <p>Names already within the limit are returned unchanged. Otherwise, when
     * abbreviation is allowed, each table entry is applied once in table order (every
     * occurrence of its literal is replaced) and the length is re-checked after each one.
     *
     * @throws NameTooLongException if the name still does not fit
     */
    public String fitIdentifier(String name, int maxLength, boolean allowAbbreviation) {
        if (name.length() <= maxLength) {
            return name;
        }
        String fitted = name;
        if (allowAbbreviation) {
            for (AbbreviationTable.Entry entry : abbreviations.entries()) {
                fitted = fitted.replace(entry.literal(), entry.code());
                if (fitted.length() <= maxLength) {
                    logger.fine(String.format("Abbreviated %s to %s", name, fitted));
                    return fitted;
                }
            }
        }
        throw new NameTooLongException(name, fitted, maxLength);
    }
}
