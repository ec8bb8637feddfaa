package com.storefront.shipping.service;

import com.storefront.shipping.client.ShippingRuleServiceClient;
import com.storefront.shipping.exception.ServiceCommunicationException;
import com.storefront.shipping.model.ShippingRule;
import feign.FeignException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads seller rules from the rule store service. A seller the store does not know
 * simply has no rules.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "shipping.rule-store.mode", havingValue = "remote", matchIfMissing = true)
public class RemoteShippingRuleProvider implements ShippingRuleProvider {

    private final ShippingRuleServiceClient shippingRuleServiceClient;

    @Override
    public List<ShippingRule> getRulesForSeller(String sellerId) {
        try {
            List<ShippingRule> rules = shippingRuleServiceClient.getRulesForSeller(sellerId);
            if (rules == null) {
                log.debug("Rule store returned no body for sellerId: {}", sellerId);
                return Collections.emptyList();
            }
            log.debug("Fetched {} shipping rules for sellerId: {}", rules.size(), sellerId);
            return rules;
        } catch (FeignException.NotFound e) {
            log.info("No shipping rules registered for sellerId: {}", sellerId);
            return Collections.emptyList();
        } catch (FeignException e) {
            log.error("Failed to get shipping rules from Rule Store for sellerId: {}. Error: {}", sellerId, e.getMessage());
            throw new ServiceCommunicationException("Failed to retrieve shipping rules for seller " + sellerId + ".", e);
        }
    }

    @Override
    public Map<String, List<ShippingRule>> getRulesForSellers(Collection<String> sellerIds) {
        Map<String, List<ShippingRule>> rulesBySeller = new LinkedHashMap<>();
        if (sellerIds.isEmpty()) {
            return rulesBySeller;
        }

        Map<String, List<ShippingRule>> fetched;
        try {
            fetched = shippingRuleServiceClient.getRulesForSellers(new ArrayList<>(sellerIds));
        } catch (FeignException e) {
            log.error("Failed to get shipping rules in bulk for sellerIds: {}. Error: {}", sellerIds, e.getMessage());
            throw new ServiceCommunicationException("Failed to retrieve shipping rules for sellers " + sellerIds + ".", e);
        }

        // Sellers missing from the bulk answer have no rules
        for (String sellerId : sellerIds) {
            List<ShippingRule> rules = fetched != null ? fetched.get(sellerId) : null;
            rulesBySeller.put(sellerId, rules != null ? rules : Collections.emptyList());
        }
        log.debug("Fetched shipping rules in bulk for {} sellers", rulesBySeller.size());
        return rulesBySeller;
    }
}
