package com.aclforge.compiler.render;

import org.apache.commons.text.WordUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Word wrapping for comment lines.
 */
public final class TextWrapper {

    private TextWrapper() {
    }

    /**
     * Wraps each input line to at most {@code width} characters. Words longer than the
     * width are split. Blank lines are dropped.
     */
    public static List<String> wrap(List<String> lines, int width) {
        List<String> wrapped = new ArrayList<>();
        for (String line : lines) {
            wrapped.addAll(wrap(line, width));
        }
        return wrapped;
    }

    public static List<String> wrap(String text, int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("Wrap width must be positive, got " + width);
        }
        List<String> out = new ArrayList<>();
        for (String line : WordUtils.wrap(text.strip(), width, "\n", true).split("\n")) {
            if (!line.isBlank()) {
                out.add(line.strip());
            }
        }
        return out;
    }
}
