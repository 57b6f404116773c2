package com.luanvv.olx.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;

/**
 * A listing as handed to callers: basic and detail data merged, tagged with the location
 * it was found under, optionally enriched with seller contact data.
 *
 * <p>Scalar fields are never null. Contact data is the only mutable part.
 */
@Getter
public class ListingRecord {
    public static final String LOCATION_KEY = "location_key";
    public static final String LOCATION_NAME = "location_name";
    public static final String IMAGES = "Images";
    public static final String ERROR = "error";

    private final String locationKey;
    private final String locationName;
    private final Map<ListingField, String> fields;
    private final List<String> images;
    private final Map<String, String> specAttributes;
    private final String error;
    private final Map<String, Object> contact = new LinkedHashMap<>();

    public ListingRecord(String locationKey, String locationName, Map<ListingField, String> fields,
                         Collection<String> images, Map<String, String> specAttributes, String error) {
        this.locationKey = locationKey == null ? "" : locationKey;
        this.locationName = locationName == null ? "" : locationName;
        EnumMap<ListingField, String> copy = new EnumMap<>(ListingField.class);
        for (ListingField field : ListingField.values()) {
            String value = fields.get(field);
            copy.put(field, value == null ? "" : value);
        }
        this.fields = Collections.unmodifiableMap(copy);
        this.images = List.copyOf(images);
        this.specAttributes = Collections.unmodifiableMap(new LinkedHashMap<>(specAttributes));
        this.error = error;
    }

    public String get(ListingField field) {
        return fields.get(field);
    }

    public String getLink() {
        return get(ListingField.LINK);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public Map<String, Object> getContact() {
        return Collections.unmodifiableMap(contact);
    }

    /** True when the key is already used by a scraped field, a listed attribute or earlier contact data. */
    public boolean hasKey(String key) {
        if (LOCATION_KEY.equals(key) || LOCATION_NAME.equals(key) || IMAGES.equals(key)) {
            return true;
        }
        for (ListingField field : ListingField.values()) {
            if (field.getColumn().equals(key)) {
                return true;
            }
        }
        return specAttributes.containsKey(key) || contact.containsKey(key);
    }

    /**
     * Adds contact payload entries whose keys are neither present nor excluded.
     *
     * @return number of keys merged
     */
    public int mergeContact(Map<String, ?> payload, Set<String> excluded) {
        int merged = 0;
        for (Map.Entry<String, ?> entry : payload.entrySet()) {
            String key = entry.getKey();
            if (key == null || excluded.contains(key) || hasKey(key)) {
                continue;
            }
            contact.put(key, toFlatValue(entry.getValue()));
            merged++;
        }
        return merged;
    }

    /**
     * Flattens the record into string keys and scalar or list-of-string values.
     */
    public Map<String, Object> toFlatMap(Set<String> excluded) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (ListingField field : ListingField.values()) {
            out.put(field.getColumn(), fields.get(field));
        }
        out.put(IMAGES, images);
        out.put(LOCATION_KEY, locationKey);
        out.put(LOCATION_NAME, locationName);
        specAttributes.forEach(out::putIfAbsent);
        contact.forEach(out::putIfAbsent);
        if (error != null) {
            out.put(ERROR, error);
        }
        out.keySet().removeAll(excluded);
        return out;
    }

    private static Object toFlatValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Collection<?> collection) {
            List<String> list = new ArrayList<>();
            for (Object item : collection) {
                list.add(item == null ? "" : String.valueOf(item));
            }
            return list;
        }
        if (value instanceof Map<?, ?> map) {
            return map.toString();
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        return String.valueOf(value);
    }
}
