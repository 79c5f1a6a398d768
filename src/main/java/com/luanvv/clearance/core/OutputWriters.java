package com.luanvv.clearance.core;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.luanvv.clearance.model.Product;
import com.opencsv.CSVWriter;
import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes the product set as {@code data.json} and {@code data.csv}. Each file is replaced as a whole;
 * the two targets are independent and a failure of one does not stop the other.
 */
@Slf4j
public class OutputWriters {
    public static final String[] CSV_HEADER = {
        "title", "price", "price_raw", "liquidation", "url", "image", "image_path"
    };

    private final Path jsonPath;
    private final Path csvPath;
    private final boolean jsonEnabled;
    private final boolean csvEnabled;
    private final ObjectWriter jsonWriter;

    public OutputWriters(Config.Output cfg) {
        this(Path.of(cfg.getDir()).resolve(cfg.getJsonFile()), Path.of(cfg.getDir()).resolve(cfg.getCsvFile()),
            cfg.isJson(), cfg.isCsv());
    }

    public OutputWriters(Path jsonPath, Path csvPath, boolean jsonEnabled, boolean csvEnabled) {
        this.jsonPath = jsonPath;
        this.csvPath = csvPath;
        this.jsonEnabled = jsonEnabled;
        this.csvEnabled = csvEnabled;
        // arrays one element per line, two-space indent
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
            .withArrayIndenter(DefaultIndenter.SYSTEM_LINEFEED_INSTANCE);
        this.jsonWriter = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT).writer(printer);
    }

    public OutputReport write(List<Product> products) {
        boolean json = !jsonEnabled || writeJson(jsonPath, products);
        boolean csv = !csvEnabled || writeCsv(csvPath, products);
        return new OutputReport(jsonPath, json, csvPath, csv);
    }

    boolean writeJson(Path path, List<Product> products) {
        try {
            createParent(path);
            jsonWriter.writeValue(path.toFile(), products);
            log.info("JSON -> {}", path);
            return true;
        } catch (IOException e) {
            log.error("Failed to write JSON {}", path, e);
            return false;
        }
    }

    boolean writeCsv(Path path, List<Product> products) {
        try {
            createParent(path);
        } catch (IOException e) {
            log.error("Failed to write CSV {}", path, e);
            return false;
        }
        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
             CSVWriter csv = new CSVWriter(w)) {
            csv.writeNext(CSV_HEADER);
            for (Product p : products) {
                csv.writeNext(toRow(p));
            }
            log.info("CSV  -> {}", path);
            return true;
        } catch (IOException e) {
            log.error("Failed to write CSV {}", path, e);
            return false;
        }
    }

    static String[] toRow(Product p) {
        return new String[] {
            toStringSafe(p.getTitle()),
            formatPrice(p.getPrice()),
            toStringSafe(p.getPriceRaw()),
            String.valueOf(p.isLiquidation()),
            toStringSafe(p.getUrl()),
            toStringSafe(p.getImage()),
            toStringSafe(p.getImagePath())
        };
    }

    static String formatPrice(Double price) {
        if (price == null) return "";
        return BigDecimal.valueOf(price).stripTrailingZeros().toPlainString();
    }

    private static String toStringSafe(Object v) {
        return v == null ? "" : String.valueOf(v);
    }

    private static void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
