package com.luanvv.olx.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Scalar listing fields and the column names they are exported under.
 */
@Getter
@RequiredArgsConstructor
public enum ListingField {
    AD_ID("Ad ID"),
    TITLE("Title"),
    PRICE("Price"),
    LOCATION("Location"),
    DESCRIPTION("Description"),
    LINK("Link"),
    SELLER_NAME("Seller Name"),
    SELLER_SINCE("Seller Since"),
    SELLER_PROFILE("seller_profile");

    private final String column;
}
