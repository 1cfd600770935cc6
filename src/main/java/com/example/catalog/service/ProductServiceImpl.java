package com.example.catalog.service;

import com.example.catalog.exception.ProductNotFoundException;
import com.example.catalog.model.Product;
import com.example.catalog.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Transactional
public class ProductServiceImpl implements ProductService {
    private static final Logger log = LoggerFactory.getLogger(ProductServiceImpl.class);

    private final ProductRepository repository;

    public ProductServiceImpl(ProductRepository repository) { this.repository = repository; }

    @Override
    public Product addProduct(Product product) {
        product.setId(null);
        Product saved = repository.save(product);
        log.info("Added product {} ({})", saved.getId(), saved.getName());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Product> getAllProducts() {
        return repository.findAll();
    }

    @Override
    @Transactional(readOnly = true)
    public Product getProductById(Long id) {
        log.debug("Fetching product {}", id);
        return repository.findById(id)
                .orElseThrow(() -> new ProductNotFoundException(id));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Product> getProductsByName(String name) {
        return repository.findByNameContainingIgnoreCase(name == null ? "" : name);
    }

    @Override
    @Transactional(readOnly = true)
    public long getTotalProductCount() {
        return repository.count();
    }

    @Override
    public Product updateProduct(Product product) {
        if (product.getId() == null || !repository.existsById(product.getId())) {
            throw new ProductNotFoundException(product.getId());
        }
        Product saved = repository.save(product);
        log.info("Updated product {}", saved.getId());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Product> sortProductsByName(String order) {
        return sortedBy("name", order);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Product> sortProductsByCategory(String order) {
        return sortedBy("category", order);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Product> sortProductsByPrice(String order) {
        return sortedBy("price", order);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Product> getProductsByCategory(String category) {
        return repository.findByCategoryIgnoreCase(category);
    }

    @Override
    public void deleteProduct(Long id) {
        if (id == null || !repository.existsById(id)) {
            throw new ProductNotFoundException(id);
        }
        repository.deleteById(id);
        log.info("Deleted product {}", id);
    }

    @Override
    public void deleteAllProducts() {
        long count = repository.count();
        repository.deleteAll();
        log.info("Deleted all products ({})", count);
    }

    private List<Product> sortedBy(String property, String order) {
        Sort.Direction direction = directionOf(order);
        log.debug("Sorting products by {} {}", property, direction);
        // id breaks ties so equal keys come back in insertion order
        return repository.findAll(Sort.by(direction, property).and(Sort.by(Sort.Direction.ASC, "id")));
    }

    static Sort.Direction directionOf(String order) {
        return "desc".equalsIgnoreCase(order) ? Sort.Direction.DESC : Sort.Direction.ASC;
    }
}
