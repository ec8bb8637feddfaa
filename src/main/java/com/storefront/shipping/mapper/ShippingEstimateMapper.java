package com.storefront.shipping.mapper;

import com.storefront.shipping.dto.request.CartLineItemDto;
import com.storefront.shipping.dto.request.ShippingEstimateRequest;
import com.storefront.shipping.dto.response.ShippingEstimateResponse;
import com.storefront.shipping.model.BuyerLocation;
import com.storefront.shipping.model.CartLineItem;
import com.storefront.shipping.model.SellerShippingEstimate;
import com.storefront.shipping.model.ShippingEstimateResult;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Component
public class ShippingEstimateMapper {

    public ShippingEstimateResponse toResponse(ShippingEstimateResult result) {
        if (result == null) {
            return null;
        }
        return ShippingEstimateResponse.builder()
                .totalShipping(result.getTotal())
                .details(result.getBreakdown().stream()
                        .map(this::toDetail)
                        .collect(Collectors.toList()))
                .warning(result.getWarning())
                .notices(result.getNotices())
                .build();
    }

    public ShippingEstimateResponse.SellerShippingDetail toDetail(SellerShippingEstimate estimate) {
        return ShippingEstimateResponse.SellerShippingDetail.builder()
                .sellerId(estimate.getSellerId())
                .province(estimate.getProvince())
                .city(estimate.getCity())
                .price(estimate.getPrice())
                .items(estimate.getItemCount())
                .build();
    }

    public List<CartLineItem> toCartLineItems(ShippingEstimateRequest request) {
        if (request == null || request.getItems() == null) {
            return Collections.emptyList();
        }
        return request.getItems().stream()
                .filter(Objects::nonNull)
                .map(this::toCartLineItem)
                .collect(Collectors.toList());
    }

    public BuyerLocation toBuyerLocation(ShippingEstimateRequest request) {
        return new BuyerLocation(request.getProvince(), request.getCity());
    }

    private CartLineItem toCartLineItem(CartLineItemDto dto) {
        return CartLineItem.builder()
                .productId(dto.getProductId())
                .quantity(dto.getQuantity())
                .unitPrice(dto.getUnitPrice())
                .sellerId(dto.getSellerId())
                .build();
    }
}
