package com.luanvv.clearance;

import com.luanvv.clearance.core.Config;
import com.luanvv.clearance.core.CrawlResult;
import com.luanvv.clearance.core.CrawlSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class App {
    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            return 2;
        }
        try {
            Config config = options.getConfigPath() != null
                ? Config.load(options.getConfigPath())
                : Config.loadDefault();
            options.applyTo(config);

            CrawlResult result = new CrawlSession(config)
                .run(CliOptions.startUrl(config), config.getMaxPages(), config.isHeadless());
            if (!result.getOutput().isComplete()) {
                log.error("Crawl finished but output was not fully written");
                return 1;
            }
            return 0;
        } catch (Exception e) {
            log.error("Crawler failed", e);
            return 1;
        }
    }
}
