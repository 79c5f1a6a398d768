package com.luanvv.clearance.core;

import com.luanvv.clearance.model.Product;
import java.util.List;
import lombok.Value;

@Value
public class CrawlResult {
    List<Product> products;
    int pagesVisited;
    OutputReport output;
}
