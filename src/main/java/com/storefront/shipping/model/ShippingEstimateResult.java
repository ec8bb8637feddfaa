package com.storefront.shipping.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Shipping cost breakdown for one cart snapshot. Never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShippingEstimateResult {

    @Builder.Default
    private BigDecimal total = BigDecimal.ZERO;

    // One entry per distinct seller, in the order sellers first appear in the cart
    @Builder.Default
    private List<SellerShippingEstimate> breakdown = new ArrayList<>();

    private String warning;

    // Per-seller advisories, e.g. a seller without a rate for the destination
    @Builder.Default
    private List<String> notices = new ArrayList<>();

    public static ShippingEstimateResult empty() {
        return ShippingEstimateResult.builder().build();
    }

    public static ShippingEstimateResult withWarning(String warning) {
        return ShippingEstimateResult.builder().warning(warning).build();
    }
}
