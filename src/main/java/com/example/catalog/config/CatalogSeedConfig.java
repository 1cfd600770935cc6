package com.example.catalog.config;

import com.example.catalog.model.Product;
import com.example.catalog.service.ProductService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.util.List;

/**
 * Loads a handful of sample products once the application is ready, but only into an
 * empty catalog. Turned off with {@code catalog.seed.enabled=false}.
 */
@Configuration
public class CatalogSeedConfig {

    private static final Logger log = LoggerFactory.getLogger(CatalogSeedConfig.class);

    private final ProductService productService;

    @Value("${catalog.seed.enabled:true}")
    private boolean seedEnabled;

    public CatalogSeedConfig(ProductService productService) {
        this.productService = productService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (!seedEnabled) {
            return;
        }
        try {
            if (productService.getTotalProductCount() > 0) {
                log.info("Catalog already populated, skipping sample data");
                return;
            }
            int seeded = seed();
            log.info("Startup: seeded {} sample products", seeded);
        } catch (Exception e) {
            log.warn("Startup seeding failed (non-fatal): {}", e.getMessage());
        }
    }

    int seed() {
        List<Product> samples = samples();
        samples.forEach(productService::addProduct);
        return samples.size();
    }

    /**
     * Builds new, unsaved sample products on every call.
     */
    static List<Product> samples() {
        return List.of(
                new Product("Wireless Mouse", "Ergonomic wireless mouse with USB-C", 29.99, "Electronics"),
                new Product("Mechanical Keyboard", "Cherry MX Blue switches, RGB backlit", 89.99, "Electronics"),
                new Product("USB-C Hub", "7-in-1 USB-C hub with HDMI and Ethernet", 45.00, "Accessories"),
                new Product("Monitor Stand", "Adjustable aluminum monitor stand", 59.99, "Furniture"),
                new Product("Desk Lamp", "LED desk lamp with wireless charging base", 39.99, "Lighting")
        );
    }
}
