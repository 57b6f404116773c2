package com.luanvv.olx.listing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.luanvv.olx.model.ListingDetail;
import com.luanvv.olx.model.ListingField;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Reads schema.org JSON-LD blocks. These are the most trustworthy source on a detail page,
 * so values found here are never replaced by selector fallbacks.
 */
@Slf4j
public class StructuredDataParser {
    private static final Set<String> TYPES = Set.of(
        "Product", "Offer", "Vehicle", "Car", "WebPage", "Organization");

    private final ObjectMapper mapper;

    public StructuredDataParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void apply(Document doc, ListingDetail.Builder detail) {
        List<String> images = new ArrayList<>();
        for (Element script : doc.select("script[type=application/ld+json]")) {
            String raw = script.data();
            if (raw.isBlank()) {
                continue;
            }
            JsonNode root;
            try {
                root = mapper.readTree(raw);
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD block: {}", e.getOriginalMessage());
                continue;
            }
            for (JsonNode node : candidates(root)) {
                if (isRelevant(node)) {
                    read(node, detail, images);
                }
            }
        }
        detail.images(images);
    }

    private List<JsonNode> candidates(JsonNode root) {
        List<JsonNode> out = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(n -> out.addAll(candidates(n)));
        } else if (root.isObject()) {
            out.add(root);
            JsonNode graph = root.get("@graph");
            if (graph != null && graph.isArray()) {
                graph.forEach(out::add);
            }
        }
        return out;
    }

    private boolean isRelevant(JsonNode node) {
        if (!node.isObject()) {
            return false;
        }
        JsonNode type = node.path("@type");
        if (type.isArray()) {
            for (JsonNode t : type) {
                if (TYPES.contains(t.asText())) {
                    return true;
                }
            }
            return false;
        }
        return TYPES.contains(type.asText());
    }

    private void read(JsonNode node, ListingDetail.Builder detail, List<String> images) {
        String name = text(node.get("name"));
        detail.setIfAbsent(ListingField.TITLE, name.isEmpty() ? text(node.get("headline")) : name);
        detail.setIfAbsent(ListingField.DESCRIPTION, text(node.get("description")));

        JsonNode image = node.get("image");
        if (image != null) {
            if (image.isArray()) {
                image.forEach(i -> addImage(i, images));
            } else {
                addImage(image, images);
            }
        }

        JsonNode offers = node.get("offers");
        if (offers != null && offers.isArray() && !offers.isEmpty()) {
            offers = offers.get(0);
        }
        if (offers != null && offers.isObject()) {
            String price = text(offers.get("price"));
            if (!price.isEmpty()) {
                String currency = text(offers.get("priceCurrency"));
                detail.setIfAbsent(ListingField.PRICE, (currency + " " + price).strip());
            }
        }

        JsonNode seller = node.get("seller");
        if (seller != null && seller.isObject()) {
            detail.setIfAbsent(ListingField.SELLER_NAME, text(seller.get("name")));
        }
    }

    private void addImage(JsonNode image, List<String> images) {
        if (image.isTextual()) {
            images.add(image.asText());
        } else if (image.isObject() && image.hasNonNull("url")) {
            images.add(image.get("url").asText());
        }
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return "";
        }
        if (node.isNumber()) {
            return node.decimalValue().stripTrailingZeros().toPlainString();
        }
        return node.asText().strip();
    }
}
