package com.storefront.shipping.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Estimate request with an explicit destination, used when the caller already
 * holds the cart (e.g. a checkout preview before the cart is saved).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShippingEstimateRequest {
    private String province; // Blank => the response carries the missing-province warning
    private String city;

    @NotNull(message = "Items are required")
    @Valid
    private List<CartLineItemDto> items;
}
