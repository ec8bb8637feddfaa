package com.storefront.shipping.mapper;

import com.storefront.shipping.dto.request.CartLineItemDto;
import com.storefront.shipping.dto.request.ShippingEstimateRequest;
import com.storefront.shipping.dto.response.ShippingEstimateResponse;
import com.storefront.shipping.model.CartLineItem;
import com.storefront.shipping.model.SellerShippingEstimate;
import com.storefront.shipping.model.ShippingEstimateResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ShippingEstimateMapperTest {

    private final ShippingEstimateMapper mapper = new ShippingEstimateMapper();

    @Test
    void toResponse_CopiesTotalsAndBreakdown() {
        ShippingEstimateResult result = ShippingEstimateResult.empty();
        result.setTotal(new BigDecimal("3.00"));
        result.getBreakdown().add(SellerShippingEstimate.builder()
                .sellerId("seller-1").province("Guayas").city("Guayaquil")
                .price(new BigDecimal("3.00")).itemCount(4).build());

        ShippingEstimateResponse response = mapper.toResponse(result);

        assertThat(response.getTotalShipping()).isEqualByComparingTo("3.00");
        assertThat(response.getWarning()).isNull();
        assertThat(response.getDetails()).singleElement().satisfies(detail -> {
            assertThat(detail.getSellerId()).isEqualTo("seller-1");
            assertThat(detail.getCity()).isEqualTo("Guayaquil");
            assertThat(detail.getItems()).isEqualTo(4);
        });
    }

    @Test
    void toCartLineItems_SkipsNullLines() {
        ShippingEstimateRequest request = ShippingEstimateRequest.builder()
                .province("Guayas")
                .items(Arrays.asList(
                        CartLineItemDto.builder().productId("p1").quantity(2).sellerId("seller-1").build(),
                        null))
                .build();

        List<CartLineItem> lines = mapper.toCartLineItems(request);

        assertThat(lines).singleElement().satisfies(line -> {
            assertThat(line.getProductId()).isEqualTo("p1");
            assertThat(line.getQuantity()).isEqualTo(2);
            assertThat(line.getSellerId()).isEqualTo("seller-1");
        });
        assertThat(mapper.toBuyerLocation(request).getProvince()).isEqualTo("Guayas");
    }

    @Test
    void toCartLineItems_NoItems() {
        assertThat(mapper.toCartLineItems(ShippingEstimateRequest.builder().build())).isEmpty();
        assertThat(mapper.toCartLineItems(null)).isEmpty();
    }
}
