package com.luanvv.clearance.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Config {
    public static final String DEFAULT_START_URL =
        "https://www.canadiantire.ca/fr/promotions/liquidation.html?store=271";
    static final String CLASSPATH_CONFIG = "clearance-config.yaml";

    private String startUrl = DEFAULT_START_URL;
    private String store;
    private boolean headless = true;
    private int maxPages = 20;
    private String locale = "fr-CA";
    private Timeouts timeouts = new Timeouts();
    private RateLimit rateLimit = new RateLimit();
    private Retries retries = new Retries();
    private Download download = new Download();
    private Output output = new Output();
    private Selectors selectors = new Selectors();

    @Data
    public static class Timeouts {
        private long navigationMs = 120_000;
        private long listWaitMs = 15_000;
        private long settleMs = 1_000;
    }

    @Data
    public static class RateLimit {
        private double permitsPerSecond = 1.0;
        private int burst = 2;
    }

    @Data
    public static class Retries {
        private int maxAttempts = 3;
        private long backoffMs = 1000;
        private long maxBackoffMs = 8000;
    }

    @Data
    public static class Download {
        private int concurrency = 6;
        private long timeoutMs = 60_000;
        private String imageDir = "images";
    }

    @Data
    public static class Output {
        private String dir = ".";
        private String jsonFile = "data.json";
        private String csvFile = "data.csv";
        private boolean json = true;
        private boolean csv = true;
    }

    /**
     * Ordered selector candidates per logical field. Earlier entries are the more specific
     * product-tile template variants, later ones the generic fallbacks.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Selectors {
        private List<String> product = new ArrayList<>(List.of(
            "li[data-testid='product-grids'] article",
            "article[data-testid='product-tile']",
            "li[data-testid='product-grids']",
            "li[data-testid^='product-grid']",
            ".product-grid__item article"));
        private List<String> title = new ArrayList<>(List.of(
            "[data-testid='product-title']",
            ".product-name",
            ".pdp-link",
            "h3",
            "h2"));
        private List<String> price = new ArrayList<>(List.of(
            "[data-testid='sale-price']",
            "[data-testid='product-price']",
            ".price__value",
            ".sale-price__value",
            ".product-price",
            ".price",
            ".c-pricing__sale",
            ".c-pricing__current"));
        private List<String> badge = new ArrayList<>(List.of(
            ".badge--clearance",
            ".badge--liquidation",
            ".tag--clearance",
            "[data-testid='badge-clearance']"));
        private List<String> image = new ArrayList<>(List.of(
            "img[data-testid='product-image']",
            ".product-image img",
            "img"));
        private List<String> imageAttributes = new ArrayList<>(List.of(
            "src", "data-src", "data-original", "data-image", "srcset"));
        private List<String> link = new ArrayList<>(List.of("a[href]"));
        private List<String> loadMore = new ArrayList<>(List.of(
            "button[data-testid='load-more']",
            "button:has-text('Charger plus')",
            "button:has-text('Load more')"));
        private List<String> next = new ArrayList<>(List.of(
            "a[aria-label='Next']:not(.pagination_chevron--disabled)",
            "a[data-testid='chevron->']:not(.pagination_chevron--disabled)",
            "a[rel='next']:not(.disabled)"));
        private List<String> waitForList = new ArrayList<>(List.of(
            "ul[data-testid='product-grids']",
            ".product-grid"));
        private List<String> interstitial = new ArrayList<>(List.of(
            "button[aria-label='Fermer']",
            "button[aria-label='Close']",
            "button:has-text('Plus tard')",
            "button:has-text('Later')",
            "button:has-text('Continuer')"));
        private String liquidationPattern = "liquidation|clearance|soldes?";
    }

    public static Config load(Path path) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream in = Files.newInputStream(path)) {
            return mapper.readValue(in, Config.class);
        }
    }

    public static Config load(String configPath) throws IOException {
        return load(Path.of(configPath));
    }

    public static Config loadDefault() throws IOException {
        String[] defaultPaths = {
            "clearance-config.yaml",
            "clearance-config.yml",
            "config/clearance-config.yaml",
            "config/clearance-config.yml"
        };

        for (String defaultPath : defaultPaths) {
            Path path = Path.of(defaultPath);
            if (Files.exists(path)) {
                log.info("Using config file: {}", path);
                return load(path);
            }
        }

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(CLASSPATH_CONFIG)) {
            if (in != null) {
                log.info("Using bundled config {}", CLASSPATH_CONFIG);
                return new ObjectMapper(new YAMLFactory()).readValue(in, Config.class);
            }
        }

        log.info("No config file found, using built-in defaults");
        return new Config();
    }

    public Path jsonPath() {
        return Path.of(output.getDir()).resolve(output.getJsonFile());
    }

    public Path csvPath() {
        return Path.of(output.getDir()).resolve(output.getCsvFile());
    }

    public Path imageDir() {
        return Path.of(download.getImageDir());
    }
}
