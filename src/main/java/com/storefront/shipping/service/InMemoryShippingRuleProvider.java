package com.storefront.shipping.service;

import com.storefront.shipping.model.ShippingRule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Serves a fixed rule set, keeping each seller's rules in the order given.
 */
public class InMemoryShippingRuleProvider implements ShippingRuleProvider {

    private final Map<String, List<ShippingRule>> rulesBySeller;

    public InMemoryShippingRuleProvider(List<ShippingRule> rules) {
        this.rulesBySeller = rules.stream()
                .filter(Objects::nonNull)
                .filter(rule -> rule.getSellerId() != null)
                .collect(Collectors.groupingBy(
                        ShippingRule::getSellerId,
                        LinkedHashMap::new,
                        Collectors.toUnmodifiableList()));
    }

    @Override
    public List<ShippingRule> getRulesForSeller(String sellerId) {
        return rulesBySeller.getOrDefault(sellerId, Collections.emptyList());
    }
}
