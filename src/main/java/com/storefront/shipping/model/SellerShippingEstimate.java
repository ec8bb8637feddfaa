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
public class SellerShippingEstimate {
    private String sellerId;
    private String province;
    private String city;
    private BigDecimal price;
    private int itemCount;
    private TariffSource source;
    private TariffLevel level;
}
