package com.luanvv.clearance.extract;

import com.luanvv.clearance.core.UrlUtils;
import com.luanvv.clearance.dom.DomNode;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves a logical field of a product tile by trying candidate selectors in priority order.
 * Every lookup returns {@link Optional#empty()} instead of throwing.
 */
@Slf4j
@RequiredArgsConstructor
public class SelectorChain {
    private final List<String> imageAttributes;

    /** Trimmed text of the first candidate that matches and has non-blank text. */
    public Optional<String> text(DomNode container, List<String> selectors) {
        for (String selector : selectors) {
            Optional<String> value = safeQuery(container, selector)
                .map(DomNode::text)
                .map(String::trim)
                .filter(s -> !s.isEmpty());
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * Absolute URL of the first candidate image. Attributes are tried in the configured order;
     * for {@code srcset} only the first URL token is used.
     */
    public Optional<String> image(DomNode container, List<String> selectors, String baseUrl) {
        for (String selector : selectors) {
            Optional<DomNode> node = safeQuery(container, selector);
            if (node.isEmpty()) {
                continue;
            }
            for (String attr : imageAttributes) {
                String raw = node.get().attribute(attr);
                if (raw == null || raw.isBlank()) {
                    continue;
                }
                String candidate = "srcset".equals(attr) ? firstSrcsetUrl(raw) : raw.trim();
                Optional<String> url = UrlUtils.toAbsolute(baseUrl, candidate);
                if (url.isPresent()) {
                    return url;
                }
            }
        }
        return Optional.empty();
    }

    /** Absolute {@code href} of the first candidate link. */
    public Optional<String> href(DomNode container, List<String> selectors, String baseUrl) {
        for (String selector : selectors) {
            Optional<String> url = safeQuery(container, selector)
                .map(n -> n.attribute("href"))
                .flatMap(href -> UrlUtils.toAbsolute(baseUrl, href));
            if (url.isPresent()) {
                return url;
            }
        }
        return Optional.empty();
    }

    public boolean matchesAny(DomNode container, List<String> selectors) {
        return selectors.stream().anyMatch(s -> safeQuery(container, s).isPresent());
    }

    static String firstSrcsetUrl(String srcset) {
        String first = srcset.split(",")[0].trim();
        int space = first.indexOf(' ');
        return space > 0 ? first.substring(0, space) : first;
    }

    private Optional<DomNode> safeQuery(DomNode container, String selector) {
        try {
            return container.query(selector);
        } catch (RuntimeException e) {
            log.debug("Selector '{}' failed: {}", selector, e.getMessage());
            return Optional.empty();
        }
    }
}
