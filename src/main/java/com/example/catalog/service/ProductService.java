package com.example.catalog.service;

import com.example.catalog.model.Product;

import java.util.List;

/**
 * Catalog operations behind the HTTP layer. Sort methods accept an order string:
 * {@code "desc"} sorts descending, anything else ascending.
 */
public interface ProductService {

    Product addProduct(Product product);

    List<Product> getAllProducts();

    /**
     * @throws com.example.catalog.exception.ProductNotFoundException if no product has this id
     */
    Product getProductById(Long id);

    List<Product> getProductsByName(String name);

    long getTotalProductCount();

    Product updateProduct(Product product);

    List<Product> sortProductsByName(String order);

    List<Product> sortProductsByCategory(String order);

    List<Product> sortProductsByPrice(String order);

    List<Product> getProductsByCategory(String category);

    void deleteProduct(Long id);

    void deleteAllProducts();
}
