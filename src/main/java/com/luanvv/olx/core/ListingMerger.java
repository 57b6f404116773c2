package com.luanvv.olx.core;

import com.luanvv.olx.model.ListingBasic;
import com.luanvv.olx.model.ListingDetail;
import com.luanvv.olx.model.ListingField;
import com.luanvv.olx.model.ListingRecord;
import com.luanvv.olx.model.LocationConfig;
import java.util.EnumMap;
import java.util.Map;

public final class ListingMerger {

    private ListingMerger() {
    }

    public static ListingRecord merge(ListingBasic basic, ListingDetail detail, LocationConfig location) {
        Map<ListingField, String> fields = new EnumMap<>(ListingField.class);
        for (ListingField field : ListingField.values()) {
            String value = detail.get(field)
                .or(() -> basic.get(field))
                .orElse("");
            fields.put(field, value);
        }
        return new ListingRecord(
            location.getKey(),
            location.getDisplayName(),
            fields,
            detail.getImages(),
            detail.getSpecAttributes(),
            detail.getError().orElse(null));
    }
}
