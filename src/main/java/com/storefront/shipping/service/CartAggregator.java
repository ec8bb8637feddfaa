package com.storefront.shipping.service;

import com.storefront.shipping.model.CartLineItem;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class CartAggregator {

    /** Key used for line items that carry no seller id. */
    public static final String UNKNOWN_SELLER = "";

    /**
     * Sums line quantities per seller. Sellers keep the order in which they first
     * appear in the cart; lines without a seller id share the {@link #UNKNOWN_SELLER} key.
     *
     * @throws IllegalArgumentException if a seller's quantities add up beyond {@code Integer.MAX_VALUE}
     */
    public Map<String, Integer> groupBySeller(List<CartLineItem> cart) {
        Map<String, Integer> itemCounts = new LinkedHashMap<>();
        if (cart == null) {
            return itemCounts;
        }
        for (CartLineItem item : cart) {
            if (item == null) {
                continue;
            }
            itemCounts.merge(sellerKey(item.getSellerId()), item.getQuantity(), CartAggregator::addQuantities);
        }
        return itemCounts;
    }

    private static Integer addQuantities(Integer current, Integer added) {
        try {
            return Math.addExact(current, added);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Cart quantities exceed the supported range.", e);
        }
    }

    static String sellerKey(String sellerId) {
        return sellerId == null || sellerId.isBlank() ? UNKNOWN_SELLER : sellerId;
    }
}
