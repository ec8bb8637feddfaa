package com.storefront.shipping.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartLineItem {
    private String productId;
    private int quantity;
    private BigDecimal unitPrice;
    private String sellerId;
}
