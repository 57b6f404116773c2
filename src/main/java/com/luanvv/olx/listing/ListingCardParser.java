package com.luanvv.olx.listing;

import com.luanvv.olx.model.ListingBasic;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Reads listing cards from the rendered HTML of a search-results page.
 */
@Slf4j
public class ListingCardParser {
    private final String itemLinkSelector;

    public ListingCardParser(String itemLinkSelector) {
        this.itemLinkSelector = itemLinkSelector == null || itemLinkSelector.isBlank()
            ? Selectors.DEFAULT_ITEM_LINK
            : itemLinkSelector;
    }

    /**
     * @param maxItems cap on returned cards; zero or negative means no cap
     * @return one card per distinct absolute link, in document order
     */
    public List<ListingBasic> parse(String html, String pageUrl, int maxItems) {
        Document doc = Jsoup.parse(html, pageUrl);
        Set<String> seen = new HashSet<>();
        List<ListingBasic> rows = new ArrayList<>();
        for (Element anchor : doc.select(itemLinkSelector)) {
            String href = anchor.absUrl("href");
            if (href.isEmpty()) {
                href = anchor.attr("href").strip();
            }
            if (!href.contains("/item/") || !href.contains("iid-") || !seen.add(href)) {
                continue;
            }
            rows.add(toCard(anchor, href));
            if (maxItems > 0 && rows.size() >= maxItems) {
                break;
            }
        }
        log.debug("Parsed {} distinct listing links from {}", rows.size(), pageUrl);
        return rows;
    }

    private ListingBasic toCard(Element anchor, String href) {
        Element card = findCard(anchor);
        String title = Selectors.CARD_TITLE_ON_ANCHOR.extract(anchor)
            .or(() -> FieldStrategy.firstMatch(Selectors.CARD_TITLE, card))
            .orElse("");
        return ListingBasic.builder()
            .link(href)
            .title(title)
            .price(FieldStrategy.firstMatch(Selectors.CARD_PRICE, card).orElse(""))
            .location(FieldStrategy.firstMatch(Selectors.CARD_LOCATION, card).orElse(""))
            .build();
    }

    static Element findCard(Element anchor) {
        for (String selector : Selectors.CARD) {
            Element card = anchor.closest(selector);
            if (card != null) {
                return card;
            }
        }
        return null;
    }
}
