package com.storefront.shipping.service;

import com.storefront.shipping.model.ShippingRule;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only access to the shipping rules sellers have registered.
 * Implementations may throw {@link com.storefront.shipping.exception.ServiceCommunicationException}
 * when the underlying store cannot be reached.
 */
public interface ShippingRuleProvider {

    /**
     * @return the seller's rules in store order, active or not; never {@code null}
     */
    List<ShippingRule> getRulesForSeller(String sellerId);

    /**
     * Fetches several sellers at once. The default issues one lookup per seller;
     * stores that support a bulk query should override it.
     */
    default Map<String, List<ShippingRule>> getRulesForSellers(Collection<String> sellerIds) {
        Map<String, List<ShippingRule>> rulesBySeller = new LinkedHashMap<>();
        for (String sellerId : sellerIds) {
            rulesBySeller.put(sellerId, getRulesForSeller(sellerId));
        }
        return rulesBySeller;
    }
}
