package com.luanvv.clearance.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Output record: the extracted tile plus the local path of its downloaded image.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"title", "price_raw", "liquidation", "image", "url", "price", "image_path"})
public class Product {
    private String title;
    @JsonProperty("price_raw")
    private String priceRaw;
    private boolean liquidation;
    private String image;
    private String url;
    private Double price;
    @JsonProperty("image_path")
    private String imagePath;

    public static Product of(RawProduct raw, String imagePath) {
        return Product.builder()
            .title(raw.getTitle())
            .priceRaw(raw.getPriceText())
            .liquidation(raw.isLiquidation())
            .image(raw.getImageUrl())
            .url(raw.getProductUrl())
            .price(raw.getPrice())
            .imagePath(imagePath)
            .build();
    }
}
