package com.luanvv.clearance.model;

import lombok.Builder;
import lombok.Value;

/**
 * One product tile as read from the listing page, before its image is downloaded.
 * Absent values are {@code null}; {@code title} and {@code priceText} are never {@code null}.
 */
@Value
@Builder(toBuilder = true)
public class RawProduct {
    @Builder.Default
    String title = "";
    @Builder.Default
    String priceText = "";
    Double price;
    boolean liquidation;
    String imageUrl;
    String productUrl;

    /** A tile with no title, no price and no image carries nothing worth keeping. */
    public boolean hasContent() {
        return !title.isBlank() || price != null || imageUrl != null;
    }
}
