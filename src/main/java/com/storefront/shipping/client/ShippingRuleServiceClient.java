package com.storefront.shipping.client;

import com.storefront.shipping.model.ShippingRule;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;
import java.util.Map;

@FeignClient(name = "shipping-rule-service", url = "${services.shipping-rules.url}")
public interface ShippingRuleServiceClient {

    @GetMapping("/api/internal/shipping-rules/sellers/{sellerId}")
    List<ShippingRule> getRulesForSeller(@PathVariable("sellerId") String sellerId);

    @GetMapping("/api/internal/shipping-rules")
    Map<String, List<ShippingRule>> getRulesForSellers(@RequestParam("sellerIds") List<String> sellerIds);
}
