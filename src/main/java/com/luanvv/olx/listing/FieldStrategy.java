package com.luanvv.olx.listing;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.jsoup.nodes.Element;

@FunctionalInterface
public interface FieldStrategy {

    Optional<String> extract(Element root);

    default FieldStrategy map(UnaryOperator<String> mapper) {
        return root -> extract(root)
            .map(mapper)
            .map(String::strip)
            .filter(v -> !v.isEmpty());
    }

    static Optional<String> firstMatch(List<FieldStrategy> chain, Element root) {
        if (root == null) {
            return Optional.empty();
        }
        for (FieldStrategy strategy : chain) {
            Optional<String> value = strategy.extract(root);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }
}
