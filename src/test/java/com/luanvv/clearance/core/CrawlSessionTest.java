package com.luanvv.clearance.core;

import com.luanvv.clearance.dom.DomPage;
import com.luanvv.clearance.dom.FakePage;
import com.luanvv.clearance.model.Product;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static com.luanvv.clearance.dom.ProductTiles.CONTAINER;
import static com.luanvv.clearance.dom.ProductTiles.LOAD_MORE;
import static com.luanvv.clearance.dom.ProductTiles.NEXT;
import static com.luanvv.clearance.dom.ProductTiles.tile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlSessionTest {
    private static final String START = "https://www.canadiantire.ca/fr/promotions/liquidation.html?store=271";

    @TempDir
    Path tmp;

    private Config config;
    private FakePage page;
    private AtomicInteger closed;

    @BeforeEach
    void setUp() {
        config = TestConfigs.fast(tmp);
        page = new FakePage();
        closed = new AtomicInteger();
    }

    @Test
    void singlePageWithoutPagination() {
        page.list(CONTAINER, tile("Marteau", "12,99 $", null, "/p/1"), tile("Tournevis", "4,49 $", null, "/p/2"));

        CrawlResult result = session().run(START, 20, true);

        assertThat(result.getProducts()).hasSize(2);
        assertThat(result.getPagesVisited()).isEqualTo(1);
        assertThat(page.getClicks()).isEmpty();
        assertThat(closed.get()).isEqualTo(1);
        assertThat(new ProductFeedReader().read(config.jsonPath())).hasSize(2);
        assertThat(Files.exists(config.csvPath())).isTrue();
    }

    @Test
    void loadMoreOnceAccumulatesBothPasses() {
        page.list(CONTAINER, tile("A", "1 $", null, null), tile("B", "2 $", null, null))
            .show(LOAD_MORE)
            .onClick(LOAD_MORE, () -> page
                .list(CONTAINER, tile("A", "1 $", null, null), tile("B", "2 $", null, null),
                    tile("C", "3 $", null, null))
                .hide(LOAD_MORE));

        CrawlResult result = session().run(START, 20, true);

        assertThat(result.getPagesVisited()).isEqualTo(2);
        assertThat(result.getProducts()).extracting(Product::getTitle)
            .containsExactly("A", "B", "A", "B", "C");
        assertThat(page.getClicks()).containsExactly(LOAD_MORE);
    }

    @Test
    void nextPageAppendsInPageOrder() {
        page.list(CONTAINER, tile("p1-a", "1 $", null, null), tile("p1-b", "1 $", null, null))
            .show(NEXT)
            .onClick(NEXT, () -> page.list(CONTAINER, tile("p2-a", "2 $", null, null)).hide(NEXT));

        CrawlResult result = session().run(START, 20, true);

        assertThat(result.getPagesVisited()).isEqualTo(2);
        assertThat(result.getProducts()).extracting(Product::getTitle).containsExactly("p1-a", "p1-b", "p2-a");
    }

    @Test
    void budgetStopsPerpetualPagination() {
        page.list(CONTAINER, tile("same", "1 $", null, null)).show(NEXT);

        CrawlResult result = session().run(START, 3, true);

        assertThat(result.getPagesVisited()).isEqualTo(3);
        assertThat(page.getClicks()).hasSize(2);
        assertThat(result.getProducts()).hasSize(3);
    }

    @Test
    void unreachableStartPageWritesNothingAndClosesBrowser() {
        page.failNavigation(new CrawlException("net::ERR_CONNECTION_REFUSED"));

        assertThatThrownBy(() -> session().run(START, 20, true)).isInstanceOf(CrawlException.class);

        assertThat(closed.get()).isEqualTo(1);
        assertThat(Files.exists(config.jsonPath())).isFalse();
        assertThat(Files.exists(config.csvPath())).isFalse();
    }

    @Test
    void browserLaunchFailurePropagates() {
        BrowserFactory failing = headless -> {
            throw new CrawlException("Cannot launch browser");
        };
        CrawlSession session = new CrawlSession(config, failing,
            new ImageDownloader(config.getDownload(), config.imageDir()), new OutputWriters(config.getOutput()));

        assertThatThrownBy(() -> session.run(START, 20, true)).hasMessage("Cannot launch browser");
        assertThat(Files.exists(config.jsonPath())).isFalse();
    }

    @Test
    void missingImageDoesNotFailTheRun() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setResponseCode(404));
            server.start();
            page.list(CONTAINER,
                tile("Sans image", "5 $", server.url("/missing.jpg").toString(), null),
                tile("Sans URL", "6 $", null, null));

            CrawlResult result = session().run(START, 20, true);

            assertThat(result.getProducts()).hasSize(2);
            assertThat(result.getProducts()).allMatch(p -> p.getImagePath() == null);
            assertThat(result.getProducts().get(0).getImage()).isEqualTo(server.url("/missing.jpg").toString());
            assertThat(result.getOutput().isComplete()).isTrue();
        }
    }

    @Test
    void headlessFlagReachesTheFactory() {
        boolean[] seen = new boolean[1];
        BrowserFactory factory = headless -> {
            seen[0] = headless;
            return handle(page);
        };
        new CrawlSession(config, factory, new ImageDownloader(config.getDownload(), config.imageDir()),
            new OutputWriters(config.getOutput())).run(START, 1, false);

        assertThat(seen[0]).isFalse();
    }

    @Test
    void budgetBelowOneIsRejected() {
        assertThatThrownBy(() -> session().run(START, 0, true)).isInstanceOf(IllegalArgumentException.class);
    }

    private CrawlSession session() {
        return new CrawlSession(config, headless -> handle(page),
            new ImageDownloader(config.getDownload(), config.imageDir()),
            new OutputWriters(config.getOutput()));
    }

    private BrowserHandle handle(DomPage domPage) {
        return new BrowserHandle() {
            @Override
            public DomPage page() {
                return domPage;
            }

            @Override
            public void close() {
                closed.incrementAndGet();
            }
        };
    }
}
