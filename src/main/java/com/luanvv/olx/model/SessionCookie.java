package com.luanvv.olx.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A browser cookie as persisted in the cookie file. Attributes other than name, value,
 * domain and path (expiry, flags, anything a browser adds) are carried through untouched.
 */
@Data
@NoArgsConstructor
public class SessionCookie {
    private String name;
    private String value;
    private String domain;
    private String path;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> extra = new LinkedHashMap<>();

    public SessionCookie(String name, String value, String domain, String path) {
        this.name = name;
        this.value = value;
        this.domain = domain;
        this.path = path;
    }

    @JsonAnyGetter
    public Map<String, Object> attributes() {
        return extra;
    }

    @JsonAnySetter
    public void attribute(String key, Object attributeValue) {
        extra.put(key, attributeValue);
    }

    public boolean hasValue() {
        return name != null && !name.isBlank() && value != null && !value.isEmpty();
    }
}
