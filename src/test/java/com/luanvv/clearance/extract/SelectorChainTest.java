package com.luanvv.clearance.extract;

import com.luanvv.clearance.core.Config;
import com.luanvv.clearance.dom.DomNode;
import com.luanvv.clearance.dom.FakeNode;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SelectorChainTest {
    private static final String BASE = "https://www.canadiantire.ca/fr/promotions/liquidation.html?store=271";

    private final SelectorChain chain = new SelectorChain(new Config.Selectors().getImageAttributes());

    @Test
    void fallsBackToLaterCandidate() {
        FakeNode tile = FakeNode.element().child(".product-name", FakeNode.text("  Perceuse 20V  "));

        Optional<String> title = chain.text(tile, List.of("[data-testid='product-title']", ".product-name"));

        assertThat(title).contains("Perceuse 20V");
    }

    @Test
    void firstCandidateWinsWhenBothMatch() {
        FakeNode tile = FakeNode.element()
            .child("[data-testid='product-title']", FakeNode.text("Specific"))
            .child("h3", FakeNode.text("Generic"));

        assertThat(chain.text(tile, List.of("[data-testid='product-title']", "h3"))).contains("Specific");
    }

    @Test
    void blankTextDoesNotCountAsMatch() {
        FakeNode tile = FakeNode.element()
            .child("[data-testid='product-title']", FakeNode.text("   "))
            .child("h3", FakeNode.text("Fallback"));

        assertThat(chain.text(tile, List.of("[data-testid='product-title']", "h3"))).contains("Fallback");
    }

    @Test
    void nothingMatchesGivesEmpty() {
        assertThat(chain.text(FakeNode.element(), List.of("h2", "h3"))).isEmpty();
        assertThat(chain.image(FakeNode.element(), List.of("img"), BASE)).isEmpty();
        assertThat(chain.href(FakeNode.element(), List.of("a[href]"), BASE)).isEmpty();
    }

    @Test
    void lazyImageAttributeIsResolvedAgainstBase() {
        FakeNode tile = FakeNode.element()
            .child("img", FakeNode.element().attr("data-src", "/is/image/ct/0541234.jpg"));

        assertThat(chain.image(tile, List.of("img"), BASE))
            .contains("https://www.canadiantire.ca/is/image/ct/0541234.jpg");
    }

    @Test
    void srcTakesPriorityOverDataSrc() {
        FakeNode img = FakeNode.element()
            .attr("data-src", "https://cdn.example.com/lazy.jpg")
            .attr("src", "https://cdn.example.com/real.jpg");
        FakeNode tile = FakeNode.element().child("img", img);

        assertThat(chain.image(tile, List.of("img"), BASE)).contains("https://cdn.example.com/real.jpg");
    }

    @Test
    void srcsetUsesFirstUrl() {
        FakeNode tile = FakeNode.element().child("img", FakeNode.element()
            .attr("srcset", "//cdn.example.com/a-320.webp 320w, //cdn.example.com/a-640.webp 640w"));

        assertThat(chain.image(tile, List.of("img"), BASE)).contains("https://cdn.example.com/a-320.webp");
    }

    @Test
    void imageFallsThroughToNextSelectorWhenFirstHasNoAttribute() {
        FakeNode tile = FakeNode.element()
            .child("img[data-testid='product-image']", FakeNode.element())
            .child("img", FakeNode.element().attr("src", "https://cdn.example.com/x.png"));

        assertThat(chain.image(tile, List.of("img[data-testid='product-image']", "img"), BASE))
            .contains("https://cdn.example.com/x.png");
    }

    @Test
    void hrefIsMadeAbsolute() {
        FakeNode tile = FakeNode.element()
            .child("a[href]", FakeNode.element().attr("href", "/fr/pdp/marteau-0581234p.html"));

        assertThat(chain.href(tile, List.of("a[href]"), BASE))
            .contains("https://www.canadiantire.ca/fr/pdp/marteau-0581234p.html");
    }

    @Test
    void throwingSelectorIsTreatedAsNoMatch() {
        DomNode broken = new DomNode() {
            @Override
            public Optional<DomNode> query(String selector) {
                if (selector.equals("bad[")) throw new IllegalArgumentException("invalid selector");
                return Optional.of(FakeNode.text("ok"));
            }

            @Override
            public String attribute(String name) {
                return null;
            }

            @Override
            public String text() {
                return "";
            }
        };

        assertThat(chain.text(broken, List.of("bad[", "h3"))).contains("ok");
        assertThat(chain.matchesAny(broken, List.of("bad["))).isFalse();
    }

    @Test
    void firstSrcsetUrlHandlesSingleEntry() {
        assertThat(SelectorChain.firstSrcsetUrl("a.jpg")).isEqualTo("a.jpg");
        assertThat(SelectorChain.firstSrcsetUrl(" a.jpg 2x")).isEqualTo("a.jpg");
    }
}
