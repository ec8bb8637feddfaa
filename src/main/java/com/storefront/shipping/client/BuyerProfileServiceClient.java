package com.storefront.shipping.client;

import com.storefront.shipping.model.BuyerLocation;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

@FeignClient(name = "buyer-profile-service", url = "${services.buyer-profile.url}")
public interface BuyerProfileServiceClient {

    @GetMapping("/api/internal/buyers/{buyerId}/location")
    BuyerLocation getBuyerLocation(@PathVariable("buyerId") String buyerId);
}
