package com.luanvv.olx.listing;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;

/**
 * Factory for the {@link FieldStrategy} building blocks used by {@link Selectors}.
 */
public final class FieldStrategies {

    private FieldStrategies() {
    }

    /** Text of the first element matching {@code css} that has any. */
    public static FieldStrategy text(String css) {
        return root -> {
            for (Element el : root.select(css)) {
                String text = el.text().strip();
                if (!text.isEmpty()) {
                    return Optional.of(text);
                }
            }
            return Optional.empty();
        };
    }

    /** Attribute of the root element itself. */
    public static FieldStrategy ownAttr(String attribute) {
        return root -> nonEmpty(root.attr(attribute));
    }

    /** Attribute of the first element matching {@code css} that carries it. */
    public static FieldStrategy attr(String css, String attribute) {
        return root -> {
            for (Element el : root.select(css)) {
                String value = el.attr(attribute).strip();
                if (!value.isEmpty()) {
                    return Optional.of(value);
                }
            }
            return Optional.empty();
        };
    }

    /** First capture group of {@code regex} applied to the whole visible text. */
    public static FieldStrategy textPattern(Pattern regex) {
        return root -> {
            Matcher m = regex.matcher(root.text());
            return m.find() ? nonEmpty(m.group(1)) : Optional.empty();
        };
    }

    public static List<FieldStrategy> chain(FieldStrategy... strategies) {
        return List.of(strategies);
    }

    static Optional<String> nonEmpty(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String stripped = value.strip();
        return stripped.isEmpty() ? Optional.empty() : Optional.of(stripped);
    }
}
