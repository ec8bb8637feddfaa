package com.storefront.shipping.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * A seller-defined shipping price for a destination.
 * A blank {@code city} makes the rule apply to the whole province.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShippingRule {
    private String sellerId;
    private String province;
    private String city; // null/blank => province-wide
    private BigDecimal price;
    @Builder.Default
    private boolean active = true;
    private String note; // Optional, informational only

    @JsonIgnore
    public boolean isProvinceWide() {
        return city == null || city.isBlank();
    }
}
