package com.luanvv.olx.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class LocationConfig {
    String key;
    String displayName;
    String seedUrl;
    @Builder.Default
    boolean enabled = true;

    public String getDisplayName() {
        return displayName == null || displayName.isBlank() ? key : displayName;
    }
}
