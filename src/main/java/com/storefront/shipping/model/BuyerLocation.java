package com.storefront.shipping.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuyerLocation {
    private String province;
    private String city;

    public boolean hasProvince() {
        return province != null && !province.isBlank();
    }

    public static BuyerLocation unknown() {
        return new BuyerLocation(null, null);
    }
}
