/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.compiler.render.juniper;

import com.aclforge.api.exceptions.StructuralException;

import java.util.ArrayList;
import java.util.List;

/**
 * Line builder that indents nested blocks.
 *
 * <p>A line ending in {@code " {"} opens a block: following lines are indented one more
 * tab stop. A line ending in {@code "}"} closes one: the indent is reduced before the
 * line is written. Comment lines are indented at the current level without brace
 * tracking. Verbatim lines are written as given.
 */
public final class JuniperConfig {

    static final int TAB_STOP = 4;

    private final int initialIndent;
    private final List<String> lines = new ArrayList<>();
    private int indent;

    public JuniperConfig() {
        this(0);
    }

    public JuniperConfig(int initialIndent) {
        this.initialIndent = initialIndent;
        this.indent = initialIndent;
    }

    /**
     * @throws StructuralException if the line closes a block that was never opened
     */
    public JuniperConfig append(String line) {
        if (line.endsWith("}")) {
            indent -= TAB_STOP;
            if (indent < initialIndent) {
                throw new StructuralException("Too many closing braces at: " + line.strip());
            }
        }
        lines.add(" ".repeat(indent) + line.strip());
        if (line.endsWith(" {")) {
            indent += TAB_STOP;
        }
        return this;
    }

    /**
     * Appends a {@code /*}, {@code **} or closing comment line; braces inside it do not open or close blocks.
     */
    public JuniperConfig appendComment(String line) {
        lines.add(" ".repeat(indent) + line.strip());
        return this;
    }

    /**
     * Writes {@code comments} as one {@code /* ** *}{@code /} block, one {@code **} line per input line.
     */
    public JuniperConfig appendCommentBlock(List<String> comments) {
        appendComment("/*");
        for (String comment : comments) {
            for (String line : comment.split("\n")) {
                appendComment("** " + line);
            }
        }
        return appendComment("*/");
    }

    public JuniperConfig appendVerbatim(String text) {
        lines.add(text);
        return this;
    }

    int indent() {
        return indent;
    }

    /**
     * @throws StructuralException if a block is still open
     */
    @Override
    public String toString() {
        if (indent != initialIndent) {
            throw new StructuralException(String.format(
                    "Unbalanced blocks: expected indent %d but got %d", initialIndent, indent));
        }
        return String.join("\n", lines);
    }
}
