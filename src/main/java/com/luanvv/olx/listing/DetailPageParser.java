package com.luanvv.olx.listing;

import com.luanvv.olx.model.ListingDetail;
import com.luanvv.olx.model.ListingField;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/**
 * Turns the rendered HTML of a detail page into a {@link ListingDetail}: structured data
 * first, selector fallbacks for whatever is still missing, then images and free-form
 * attributes.
 */
@RequiredArgsConstructor
public class DetailPageParser {
    private final StructuredDataParser structuredData;
    private final SpecAttributeParser specAttributes;
    private final ImageCollector images;
    private final Set<String> excludedFields;

    public ListingDetail parse(String html, String url) {
        Document doc = Jsoup.parse(html, url);
        ListingDetail.Builder detail = ListingDetail.builder(url);

        structuredData.apply(doc, detail);

        for (Map.Entry<ListingField, List<FieldStrategy>> entry : Selectors.DETAIL.entrySet()) {
            ListingField field = entry.getKey();
            if (!detail.has(field)) {
                FieldStrategy.firstMatch(entry.getValue(), doc)
                    .ifPresent(value -> detail.set(field, value));
            }
        }

        detail.images(images.collect(doc));

        specAttributes.parse(doc).forEach((key, value) -> {
            if (!isExcluded(key) && !isColumn(key)) {
                detail.specAttribute(key, value);
            }
        });
        return detail.build();
    }

    // Attribute keys arrive normalized, configured names may not be.
    private boolean isExcluded(String key) {
        return excludedFields.contains(key)
            || excludedFields.stream().anyMatch(name -> SpecAttributeParser.normalizeKey(name).equals(key));
    }

    private static boolean isColumn(String key) {
        for (ListingField field : ListingField.values()) {
            if (field.getColumn().equals(key) || SpecAttributeParser.normalizeKey(field.getColumn()).equals(key)) {
                return true;
            }
        }
        return false;
    }
}
