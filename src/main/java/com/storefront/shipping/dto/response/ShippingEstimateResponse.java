package com.storefront.shipping.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Wire shape of an estimate. Field names on the wire are the storefront's Spanish ones.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShippingEstimateResponse {

    @JsonProperty("totalEnvio")
    private BigDecimal totalShipping;

    @JsonProperty("detalle")
    @Builder.Default
    private List<SellerShippingDetail> details = new ArrayList<>();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String warning;

    @JsonProperty("mensajes")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @Builder.Default
    private List<String> notices = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SellerShippingDetail {
        @JsonProperty("vendedorId")
        private String sellerId;

        @JsonProperty("provincia")
        private String province;

        @JsonProperty("ciudad")
        private String city;

        @JsonProperty("precio")
        private BigDecimal price;

        @JsonProperty("items")
        private int items;
    }
}
