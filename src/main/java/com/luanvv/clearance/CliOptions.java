package com.luanvv.clearance;

import com.luanvv.clearance.core.Config;
import com.luanvv.clearance.core.UrlUtils;
import lombok.Data;

/**
 * Command line flags. Anything given here wins over the config file.
 *
 * <pre>
 *   --url &lt;listing url&gt;   --maxPages &lt;n&gt;   --headful   --store &lt;id&gt;
 *   --config &lt;yaml&gt;   --out &lt;dir&gt;   --images &lt;dir&gt;
 * </pre>
 */
@Data
public class CliOptions {
    private String url;
    private Integer maxPages;
    private boolean headful;
    private String store;
    private String configPath;
    private String outDir;
    private String imageDir;

    public static CliOptions parse(String[] args) {
        CliOptions options = new CliOptions();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String value = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                value = arg.substring(eq + 1);
                arg = arg.substring(0, eq);
            }
            switch (arg) {
                case "--headful" -> options.headful = true;
                case "--url" -> options.url = value != null ? value : next(args, ++i, arg);
                case "--maxPages" -> options.maxPages = parsePositive(value != null ? value : next(args, ++i, arg));
                case "--store" -> options.store = value != null ? value : next(args, ++i, arg);
                case "--config" -> options.configPath = value != null ? value : next(args, ++i, arg);
                case "--out" -> options.outDir = value != null ? value : next(args, ++i, arg);
                case "--images" -> options.imageDir = value != null ? value : next(args, ++i, arg);
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
        }
        return options;
    }

    /** Applies the flags on top of {@code config}. */
    public void applyTo(Config config) {
        if (url != null) {
            config.setStartUrl(url);
            // a store already in --url beats one from the config file
            if (store == null && UrlUtils.hasQueryParam(url, "store")) config.setStore(null);
        }
        if (store != null) config.setStore(store);
        if (maxPages != null) config.setMaxPages(maxPages);
        if (headful) config.setHeadless(false);
        if (outDir != null) config.getOutput().setDir(outDir);
        if (imageDir != null) config.getDownload().setImageDir(imageDir);
    }

    /** Start URL of the crawl with the store parameter applied, if one is set. */
    public static String startUrl(Config config) {
        String url = config.getStartUrl();
        if (config.getStore() != null && !config.getStore().isBlank()) {
            url = UrlUtils.withQueryParam(url, "store", config.getStore().trim());
        }
        return url;
    }

    private static String next(String[] args, int i, String flag) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[i];
    }

    private static int parsePositive(String value) {
        try {
            int n = Integer.parseInt(value.trim());
            if (n < 1) throw new IllegalArgumentException("--maxPages must be at least 1: " + value);
            return n;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--maxPages is not a number: " + value, e);
        }
    }
}
