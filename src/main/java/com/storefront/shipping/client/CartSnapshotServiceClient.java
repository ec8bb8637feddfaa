package com.storefront.shipping.client;

import com.storefront.shipping.model.CartLineItem;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

import java.util.List;

@FeignClient(name = "cart-service", url = "${services.cart.url}")
public interface CartSnapshotServiceClient {

    @GetMapping("/api/internal/carts/{buyerId}/items")
    List<CartLineItem> getCartItems(@PathVariable("buyerId") String buyerId);
}
