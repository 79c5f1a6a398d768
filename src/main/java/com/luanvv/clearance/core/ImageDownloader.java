package com.luanvv.clearance.core;

import com.luanvv.clearance.model.Product;
import com.luanvv.clearance.model.RawProduct;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Downloads the primary image of every product on a fixed pool of workers.
 * A failed download only clears that product's image path.
 */
@Slf4j
public class ImageDownloader {
    static final int MAX_SLUG_LENGTH = 40;
    private static final String USER_AGENT =
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    private final Path imageDir;
    private final int concurrency;
    private final Duration timeout;
    private final HttpClient client;

    public ImageDownloader(Config.Download cfg, Path imageDir) {
        this.imageDir = imageDir;
        this.concurrency = Math.max(1, cfg.getConcurrency());
        this.timeout = Duration.ofMillis(Math.max(1, cfg.getTimeoutMs()));
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(timeout)
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    /**
     * @return one {@link Product} per input, in input order
     */
    public List<Product> downloadAll(List<RawProduct> products) {
        if (products.isEmpty()) {
            return new ArrayList<>();
        }
        try {
            Files.createDirectories(imageDir);
        } catch (IOException e) {
            log.error("Cannot create image directory {}, skipping downloads", imageDir, e);
            return products.stream().map(p -> Product.of(p, null)).collect(Collectors.toList());
        }

        ExecutorService executor = Executors.newFixedThreadPool(concurrency);
        try {
            List<Future<String>> futures = new ArrayList<>(products.size());
            for (int i = 0; i < products.size(); i++) {
                RawProduct product = products.get(i);
                int sequence = i + 1;
                futures.add(executor.submit(() -> download(product, sequence)));
            }

            List<Product> out = new ArrayList<>(products.size());
            int saved = 0;
            for (int i = 0; i < products.size(); i++) {
                String imagePath = await(futures.get(i), products.get(i));
                if (imagePath != null) saved++;
                out.add(Product.of(products.get(i), imagePath));
            }
            log.info("Images saved: {}/{} into {}", saved, products.size(), imageDir);
            return out;
        } finally {
            executor.shutdownNow();
        }
    }

    private String await(Future<String> future, RawProduct product) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.warn("Image download failed: {} ({})", product.getImageUrl(), e.getCause().toString());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlException("Interrupted while downloading images", e);
        }
    }

    /**
     * @return the written path, or {@code null} when the product has no image
     */
    String download(RawProduct product, int sequence) throws IOException, InterruptedException {
        String url = product.getImageUrl();
        if (url == null) {
            return null;
        }
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
            .timeout(timeout)
            .header("User-Agent", USER_AGENT)
            .GET()
            .build();
        HttpResponse<byte[]> response = fetch(request);
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("HTTP " + response.statusCode() + " for " + url);
        }
        Path target = imageDir.resolve(fileName(sequence, product.getTitle(), url));
        Files.write(target, response.body());
        log.debug("Downloaded image: {} to {}", url, target);
        return target.toString();
    }

    /**
     * Bounds the whole exchange, body included; the request timeout alone only covers the headers.
     */
    private HttpResponse<byte[]> fetch(HttpRequest request) throws IOException, InterruptedException {
        CompletableFuture<HttpResponse<byte[]>> pending =
            client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        try {
            return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new IOException("Timed out after " + timeout.toMillis() + " ms: " + request.uri(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException("Download failed: " + request.uri(), cause);
        }
    }

    static String fileName(int sequence, String title, String url) {
        String base = title == null || title.isBlank() ? "product" : title;
        if (base.length() > MAX_SLUG_LENGTH) {
            base = base.substring(0, MAX_SLUG_LENGTH);
        }
        String name = UrlUtils.sanitizeForFilename(String.format("%04d-%s", sequence, base));
        return name + UrlUtils.fileExtension(url);
    }
}
