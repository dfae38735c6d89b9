package com.baladi.shop.repository;

import com.baladi.shop.entity.Shop;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ShopRepository extends JpaRepository<Shop, Long> {

    /** Caffeine-cached lookup; shops change rarely and orders snapshot what they need. */
    @Cacheable(value = "shops", key = "#p0", unless = "#result == null")
    Optional<Shop> findCachedById(Long id);
}
