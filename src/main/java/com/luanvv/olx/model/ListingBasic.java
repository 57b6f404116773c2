package com.luanvv.olx.model;

import java.util.Optional;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class ListingBasic {
    @Builder.Default String title = "";
    @NonNull String link;
    @Builder.Default String price = "";
    @Builder.Default String location = "";

    public Optional<String> get(ListingField field) {
        String value = switch (field) {
            case TITLE -> title;
            case LINK -> link;
            case PRICE -> price;
            case LOCATION -> location;
            default -> null;
        };
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
