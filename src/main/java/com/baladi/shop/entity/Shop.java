package com.baladi.shop.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * Shop selling on the marketplace.
 *
 * <p>{@code commissionRate} is the share of each order subtotal the platform
 * charges this shop (0.10 = 10%). It is read once at order placement and frozen
 * into the order's financial snapshot.</p>
 */
@Entity
@Table(name = "shops")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Shop {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "shop_seq")
    @SequenceGenerator(name = "shop_seq", sequenceName = "shop_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, precision = 5, scale = 4)
    private BigDecimal commissionRate;

    @Column(precision = 12, scale = 2)
    private BigDecimal deliveryFee;     // null = platform default fee

    private boolean open;

    @Builder
    public Shop(Long id, String name, BigDecimal commissionRate, BigDecimal deliveryFee, boolean open) {
        this.id = id;
        this.name = name;
        this.commissionRate = commissionRate;
        this.deliveryFee = deliveryFee;
        this.open = open;
    }
}
