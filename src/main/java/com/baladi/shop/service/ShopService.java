package com.baladi.shop.service;

import com.baladi.common.exception.ErrorCode;
import com.baladi.common.result.Failure;
import com.baladi.common.result.Result;
import com.baladi.shop.entity.Product;
import com.baladi.shop.entity.Shop;
import com.baladi.shop.repository.ProductRepository;
import com.baladi.shop.repository.ShopRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-side access to shops and their products for order placement.
 *
 * <p>Shops are cached in Caffeine (local, per JVM). The commission rate is
 * snapshotted into each order, so a stale cache entry never changes the
 * money on an existing order.</p>
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ShopService {

    private final ShopRepository shopRepository;
    private final ProductRepository productRepository;

    public Result<Shop> findOpenShop(Long shopId) {
        Shop shop = shopRepository.findCachedById(shopId).orElse(null);
        if (shop == null) {
            return Result.failure(Failure.notFound(ErrorCode.SHOP_NOT_FOUND));
        }
        if (!shop.isOpen()) {
            return Result.failure(Failure.businessRule(ErrorCode.SHOP_CLOSED));
        }
        return Result.success(shop);
    }

    /**
     * Loads the requested products, all of which must belong to the shop and be available.
     */
    public Result<Map<Long, Product>> findOrderableProducts(Long shopId, Collection<Long> productIds) {
        Map<Long, Product> products = productRepository.findByIdIn(productIds).stream()
                .collect(Collectors.toMap(Product::getId, Function.identity()));

        for (Long productId : productIds) {
            Product product = products.get(productId);
            if (product == null || !product.getShopId().equals(shopId)) {
                return Result.failure(new Failure.NotFoundFailure(ErrorCode.PRODUCT_NOT_FOUND,
                        "Product " + productId + " not found in shop " + shopId));
            }
            if (!product.isAvailable()) {
                return Result.failure(Failure.businessRule(ErrorCode.PRODUCT_UNAVAILABLE,
                        "Product \"" + product.getName() + "\" is not available"));
            }
        }
        return Result.success(products);
    }
}
