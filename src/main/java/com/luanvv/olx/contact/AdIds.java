package com.luanvv.olx.contact;

import com.luanvv.olx.core.UrlUtils;
import com.luanvv.olx.model.ListingField;
import com.luanvv.olx.model.ListingRecord;
import java.util.Optional;

public final class AdIds {

    private AdIds() {
    }

    public static Optional<String> resolve(ListingRecord record) {
        String explicit = record.get(ListingField.AD_ID);
        if (explicit != null && !explicit.isBlank()) {
            return Optional.of(explicit.strip());
        }
        return UrlUtils.adIdFromLink(record.getLink());
    }
}
