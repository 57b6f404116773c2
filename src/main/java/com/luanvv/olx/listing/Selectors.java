package com.luanvv.olx.listing;

import static com.luanvv.olx.listing.FieldStrategies.attr;
import static com.luanvv.olx.listing.FieldStrategies.chain;
import static com.luanvv.olx.listing.FieldStrategies.ownAttr;
import static com.luanvv.olx.listing.FieldStrategies.text;
import static com.luanvv.olx.listing.FieldStrategies.textPattern;

import com.luanvv.olx.model.ListingField;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Locators for the listing site. Its markup changes often and class names are hashed, so
 * every field has several alternatives, most reliable first.
 */
public final class Selectors {

    private Selectors() {
    }

    public static final String DEFAULT_ITEM_LINK = "a[href*=\"/item/\"][href*=\"iid-\"]";

    /** Ancestors of an item link that delimit its result card. */
    public static final List<String> CARD = List.of(
        "[aria-label=Ad]",
        "li[aria-label=Listing]",
        "[data-cy=l-card]",
        "div[class*=_70cdfb32]",
        "div[class*=_63a946ba]",
        "article");

    // Card fields; the first title strategy runs against the anchor, the rest against the card.
    public static final FieldStrategy CARD_TITLE_ON_ANCHOR = ownAttr("title");

    public static final List<FieldStrategy> CARD_TITLE = chain(
        text("[aria-label=Title] h1, [aria-label=Title] h2, [aria-label=Title] span, [aria-label=Title] div"),
        text("[class*=_34bc0d5f] h1, [class*=_34bc0d5f] h2, [class*=_34bc0d5f] span, [class*=_34bc0d5f] div"),
        text("[class*=_562a2db2]"));

    public static final List<FieldStrategy> CARD_PRICE = chain(
        text("[aria-label=Price] span, [aria-label=Price] div"),
        text("span[class*=ddc1b288]"));

    public static final List<FieldStrategy> CARD_LOCATION = chain(
        text("[aria-label=Location] span, [aria-label=Location] div"),
        text("div[class*=f7d5e47e]"));

    private static final String DESCRIPTION_CONTAINERS = "[data-aut-id=itemDescriptionContent], "
        + "[data-testid=ad-description], #description, .description, [itemprop=description], "
        + "[aria-label=Description]";

    private static final Pattern AD_ID_TEXT = Pattern.compile("Ad\\s*ID\\s*:?\\s*(\\w+)", Pattern.CASE_INSENSITIVE);

    /** Detail-page fallbacks, run for each field the structured data left empty. */
    public static final Map<ListingField, List<FieldStrategy>> DETAIL = Collections.unmodifiableMap(detailChains());

    private static Map<ListingField, List<FieldStrategy>> detailChains() {
        Map<ListingField, List<FieldStrategy>> chains = new EnumMap<>(ListingField.class);
        chains.put(ListingField.TITLE, chain(
            text("h1"),
            text("[data-testid=ad-title]"),
            text("h1[class*=_562a2db2]"),
            text("h1[itemprop=name]")));
        chains.put(ListingField.PRICE, chain(
            text("[aria-label=Price] span"),
            text("[data-testid=ad-price]"),
            text("span[class*=ddc1b288]"),
            text(".price"),
            text("[itemprop=price]")));
        chains.put(ListingField.DESCRIPTION, chain(
            text(DESCRIPTION_CONTAINERS)));
        chains.put(ListingField.LOCATION, chain(
            text("[data-aut-id=item-location]"),
            text(".seller-location"),
            text("[aria-label=Location]"),
            text("div[class*=f7d5e47e]")));
        chains.put(ListingField.SELLER_NAME, chain(
            text("[data-testid=seller-name]"),
            text("[data-aut-id=profileCard] h4"),
            text("[aria-label=\"Seller description\"] [class*=_6d5b4928]")));
        chains.put(ListingField.SELLER_SINCE, chain(
            text(".seller-since"),
            text("[data-aut-id=sellerSince]")));
        chains.put(ListingField.AD_ID, chain(
            text("[data-aut-id=adId]").map(v -> v.replace("Ad ID", "").replace(":", "")),
            textPattern(AD_ID_TEXT)));
        chains.put(ListingField.SELLER_PROFILE, chain(
            attr("a[href*=\"/profile/\"]", "abs:href")));
        return chains;
    }
}
