package com.example.catalog.controller;

import com.example.catalog.exception.ProductNotFoundException;
import com.example.catalog.model.Product;
import com.example.catalog.service.ProductService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Product catalog endpoints. Every handler makes its service call inside a try block and
 * translates failures into a fixed status for that endpoint; error responses have no body.
 */
@RestController
@RequestMapping("/api/products")
public class ProductController {
    private static final Logger log = LoggerFactory.getLogger(ProductController.class);

    private final ProductService service;

    public ProductController(ProductService service) { this.service = service; }

    @PostMapping
    public ResponseEntity<Void> addProduct(@RequestBody Product product) {
        try {
            service.addProduct(product);
        } catch (Exception e) {
            log.error("Failed to add product", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @GetMapping
    public ResponseEntity<List<Product>> getAllProducts() {
        List<Product> products;
        try {
            products = service.getAllProducts();
        } catch (Exception e) {
            log.warn("Failed to list products", e);
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(products);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Product> getProductById(@PathVariable Long id) {
        Product product;
        try {
            product = service.getProductById(id);
        } catch (ProductNotFoundException e) {
            log.debug("Product {} not found", id);
            return ResponseEntity.notFound().build();
        } catch (Exception e) {
            log.warn("Product {} could not be loaded", id, e);
            return ResponseEntity.notFound().build();
        }
        if (product == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(product);
    }

    @GetMapping("/search")
    public ResponseEntity<List<Product>> getProductsByName(@RequestParam(required = false) String name) {
        List<Product> products;
        try {
            products = service.getProductsByName(name);
        } catch (Exception e) {
            log.warn("Search by name '{}' failed", name, e);
            return ResponseEntity.badRequest().build();
        }
        if (products == null || products.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(products);
    }

    @GetMapping("/total-count")
    public ResponseEntity<Long> getTotalProductCount() {
        long totalCount;
        try {
            totalCount = service.getTotalProductCount();
        } catch (Exception e) {
            log.error("Failed to count products", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
        return ResponseEntity.ok(totalCount);
    }

    /**
     * Overwrites name, description, price and category of the stored product. The id in the
     * body is ignored; the path id decides which product changes.
     */
    @PutMapping("/{id}")
    public ResponseEntity<Void> updateProduct(@PathVariable Long id, @RequestBody Product updatedProduct) {
        try {
            Product product = service.getProductById(id);
            if (product == null) {
                throw new ProductNotFoundException(id);
            }
            product.copyDetailsFrom(updatedProduct);
            service.updateProduct(product);
        } catch (ProductNotFoundException e) {
            log.debug("Cannot update product {}: not found", id);
            return ResponseEntity.notFound().build();
        } catch (Exception e) {
            log.error("Failed to update product {}", id, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/sort")
    public ResponseEntity<List<Product>> getSortedList(@RequestParam(required = false) String criteria,
                                                       @RequestParam(required = false) String order) {
        List<Product> products;
        try {
            if ("name".equals(criteria)) {
                products = service.sortProductsByName(order);
            } else if ("category".equals(criteria)) {
                products = service.sortProductsByCategory(order);
            } else if ("price".equals(criteria)) {
                products = service.sortProductsByPrice(order);
            } else {
                log.debug("Unsupported sort criteria '{}'", criteria);
                return ResponseEntity.badRequest().build();
            }
        } catch (Exception e) {
            log.error("Failed to sort products by {} {}", criteria, order, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
        return ResponseEntity.ok(products);
    }

    @GetMapping("/category/{category}")
    public ResponseEntity<List<Product>> getProductsByCategory(@PathVariable String category) {
        List<Product> products;
        try {
            products = service.getProductsByCategory(category);
        } catch (Exception e) {
            log.warn("Lookup by category '{}' failed", category, e);
            return ResponseEntity.badRequest().build();
        }
        if (products == null || products.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(products);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteProduct(@PathVariable Long id) {
        try {
            Product product = service.getProductById(id);
            if (product == null) {
                throw new ProductNotFoundException(id);
            }
            service.deleteProduct(id);
        } catch (ProductNotFoundException e) {
            log.debug("Cannot delete product {}: not found", id);
            return ResponseEntity.notFound().build();
        } catch (Exception e) {
            log.warn("Failed to delete product {}", id, e);
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    public ResponseEntity<Void> deleteAllProducts() {
        try {
            service.deleteAllProducts();
        } catch (Exception e) {
            log.error("Failed to delete all products", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
        return ResponseEntity.noContent().build();
    }
}
