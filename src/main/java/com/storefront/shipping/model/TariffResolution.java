package com.storefront.shipping.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of resolving one seller's tariff, with the path taken to reach it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TariffResolution {
    private String sellerId;
    private String province;
    private String city;
    private String normalizedProvince;
    private String normalizedCity;

    @Builder.Default
    private BigDecimal price = BigDecimal.ZERO;
    private boolean found;

    @Builder.Default
    private TariffSource source = TariffSource.NONE;
    @Builder.Default
    private TariffLevel level = TariffLevel.NONE;
    private ShippingRule appliedRule;

    private int sellerRuleCount;
    private int platformRuleCount;

    @Builder.Default
    private List<String> steps = new ArrayList<>();

    public void addStep(String message) {
        steps.add(message);
    }
}
