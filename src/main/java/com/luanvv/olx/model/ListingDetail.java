package com.luanvv.olx.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Everything read from a listing's detail page. A field that could not be read is absent,
 * not empty: {@link #get(ListingField)} returns {@link Optional#empty()} for it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ListingDetail {
    Map<ListingField, String> fields;
    SortedSet<String> images;
    Map<String, String> specAttributes;
    String error;

    public Optional<String> get(ListingField field) {
        String value = fields.get(field);
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    public String getLink() {
        return fields.getOrDefault(ListingField.LINK, "");
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    /** A detail that carries nothing but the link, used when the page never became ready. */
    public static ListingDetail linkOnly(String link) {
        return builder(link).build();
    }

    public static ListingDetail failed(String link, String error) {
        return builder(link).error(error).build();
    }

    public static Builder builder(String link) {
        return new Builder().set(ListingField.LINK, link);
    }

    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.strip();
        return "N/A".equals(trimmed.toUpperCase(Locale.ROOT)) ? "" : trimmed;
    }

    public static class Builder {
        private final Map<ListingField, String> fields = new EnumMap<>(ListingField.class);
        private final SortedSet<String> images = new TreeSet<>();
        private final Map<String, String> specAttributes = new LinkedHashMap<>();
        private String error;

        public Builder set(ListingField field, String value) {
            String normalized = normalize(value);
            if (normalized.isEmpty()) {
                fields.remove(field);
            } else {
                fields.put(field, normalized);
            }
            return this;
        }

        /** Sets the field only when it has no non-empty value yet. */
        public Builder setIfAbsent(ListingField field, String value) {
            if (!has(field)) {
                set(field, value);
            }
            return this;
        }

        public boolean has(ListingField field) {
            return fields.containsKey(field);
        }

        public Builder images(Collection<String> urls) {
            urls.stream()
                .map(ListingDetail::normalize)
                .filter(url -> !url.isEmpty())
                .forEach(images::add);
            return this;
        }

        /** Adds an attribute unless the key is already taken; first value wins. */
        public Builder specAttribute(String key, String value) {
            String k = normalize(key);
            String v = normalize(value);
            if (!k.isEmpty() && !v.isEmpty()) {
                specAttributes.putIfAbsent(k, v);
            }
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public ListingDetail build() {
            return new ListingDetail(
                Collections.unmodifiableMap(new EnumMap<>(fields)),
                Collections.unmodifiableSortedSet(new TreeSet<>(images)),
                Collections.unmodifiableMap(new LinkedHashMap<>(specAttributes)),
                error);
        }
    }
}
