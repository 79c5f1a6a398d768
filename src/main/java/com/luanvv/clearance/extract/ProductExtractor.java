package com.luanvv.clearance.extract;

import com.luanvv.clearance.core.Config;
import com.luanvv.clearance.dom.DomNode;
import com.luanvv.clearance.dom.DomPage;
import com.luanvv.clearance.model.RawProduct;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns the product tiles of the currently rendered listing into {@link RawProduct}s.
 * Reads the DOM only; never clicks, navigates or downloads. Tile handles are released after each pass.
 */
@Slf4j
public class ProductExtractor {
    static final int SNIPPET_LENGTH = 400;

    private final Config.Selectors selectors;
    private final SelectorChain chain;
    private final Pattern liquidationPattern;

    public ProductExtractor(Config.Selectors selectors) {
        this.selectors = selectors;
        this.chain = new SelectorChain(selectors.getImageAttributes());
        this.liquidationPattern = Pattern.compile(selectors.getLiquidationPattern(), Pattern.CASE_INSENSITIVE);
    }

    public List<RawProduct> extract(DomPage page) {
        List<DomNode> containers = findContainers(page);
        String baseUrl = page.url();
        List<RawProduct> out = new ArrayList<>(containers.size());
        try {
            for (DomNode container : containers) {
                RawProduct product = extractOne(container, baseUrl);
                if (product.hasContent()) {
                    out.add(product);
                }
            }
        } finally {
            containers.forEach(DomNode::dispose);
        }
        return out;
    }

    RawProduct extractOne(DomNode container, String baseUrl) {
        String title = chain.text(container, selectors.getTitle()).orElse("");
        String priceText = chain.text(container, selectors.getPrice()).orElse("");
        boolean badge = chain.matchesAny(container, selectors.getBadge());
        String snippet = container.text();
        if (snippet.length() > SNIPPET_LENGTH) {
            snippet = snippet.substring(0, SNIPPET_LENGTH);
        }
        boolean liquidation = badge
            || liquidationPattern.matcher(title).find()
            || liquidationPattern.matcher(snippet).find();

        return RawProduct.builder()
            .title(title)
            .priceText(priceText)
            .price(PriceParser.parseOrNull(priceText))
            .liquidation(liquidation)
            .imageUrl(chain.image(container, selectors.getImage(), baseUrl).orElse(null))
            .productUrl(chain.href(container, selectors.getLink(), baseUrl).orElse(null))
            .build();
    }

    /** Tiles from the first container selector that matches anything. */
    private List<DomNode> findContainers(DomPage page) {
        for (String selector : selectors.getProduct()) {
            try {
                List<DomNode> found = page.queryAll(selector);
                if (!found.isEmpty()) {
                    log.debug("Container selector '{}' matched {} tiles", selector, found.size());
                    return found;
                }
            } catch (RuntimeException e) {
                log.debug("Container selector '{}' failed: {}", selector, e.getMessage());
            }
        }
        return Collections.emptyList();
    }
}
