package com.storefront.shipping.service;

import com.storefront.shipping.config.ShippingProperties;
import com.storefront.shipping.exception.ServiceCommunicationException;
import com.storefront.shipping.exception.ShippingEstimateCancelledException;
import com.storefront.shipping.model.BuyerLocation;
import com.storefront.shipping.model.CartLineItem;
import com.storefront.shipping.model.SellerShippingEstimate;
import com.storefront.shipping.model.ShippingEstimateResult;
import com.storefront.shipping.model.ShippingRule;
import com.storefront.shipping.model.TariffResolution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Builds per-seller shipping estimates for a cart snapshot.
 *
 * <p>The service keeps no per-request state: everything an estimate needs is passed
 * in or fetched from the rule store, so one instance serves concurrent requests.
 */
@Service
@Slf4j
public class ShippingEstimateService {

    private final ShippingRuleProvider shippingRuleProvider;
    private final TariffResolver tariffResolver;
    private final CartAggregator cartAggregator;
    private final BuyerSnapshotService buyerSnapshotService;
    private final ShippingProperties shippingProperties;
    private final AsyncTaskExecutor shippingRuleExecutor;

    public ShippingEstimateService(ShippingRuleProvider shippingRuleProvider,
                                   TariffResolver tariffResolver,
                                   CartAggregator cartAggregator,
                                   BuyerSnapshotService buyerSnapshotService,
                                   ShippingProperties shippingProperties,
                                   @Qualifier("shippingRuleExecutor") AsyncTaskExecutor shippingRuleExecutor) {
        this.shippingRuleProvider = shippingRuleProvider;
        this.tariffResolver = tariffResolver;
        this.cartAggregator = cartAggregator;
        this.buyerSnapshotService = buyerSnapshotService;
        this.shippingProperties = shippingProperties;
        this.shippingRuleExecutor = shippingRuleExecutor;
    }

    /**
     * Estimates shipping for the buyer's stored cart and registered location.
     */
    public ShippingEstimateResult estimateForBuyer(String buyerId) {
        BuyerLocation location = buyerSnapshotService.loadLocation(buyerId);
        if (!location.hasProvince()) {
            // The cart is irrelevant without a province; skip loading it.
            log.info("Buyer {} has no province configured, returning an empty estimate.", buyerId);
            return ShippingEstimateResult.withWarning(shippingProperties.getMessages().getMissingProvince());
        }
        List<CartLineItem> cart = buyerSnapshotService.loadCart(buyerId);
        return estimate(cart, location);
    }

    /**
     * Estimates shipping for a cart delivered to {@code buyer}.
     *
     * @throws ServiceCommunicationException      if any seller's rules cannot be fetched; no partial result is returned
     * @throws ShippingEstimateCancelledException if the calling thread is interrupted while waiting for rules
     */
    public ShippingEstimateResult estimate(List<CartLineItem> cart, BuyerLocation buyer) {
        if (buyer == null || !buyer.hasProvince()) {
            log.info("Buyer has no province configured, skipping tariff resolution.");
            return ShippingEstimateResult.withWarning(shippingProperties.getMessages().getMissingProvince());
        }

        Map<String, Integer> itemCountsBySeller = cartAggregator.groupBySeller(cart);
        if (itemCountsBySeller.isEmpty()) {
            log.debug("Cart is empty, nothing to estimate.");
            return ShippingEstimateResult.empty();
        }

        Map<String, List<ShippingRule>> rulesBySeller = fetchRules(itemCountsBySeller.keySet());
        List<ShippingRule> platformRules = platformRules();

        ShippingEstimateResult result = ShippingEstimateResult.empty();
        BigDecimal total = BigDecimal.ZERO;

        for (Map.Entry<String, Integer> entry : itemCountsBySeller.entrySet()) {
            String sellerId = entry.getKey();
            TariffResolution resolution = tariffResolver.resolveDetailed(
                    sellerId,
                    rulesBySeller.getOrDefault(sellerId, Collections.emptyList()),
                    platformRules,
                    buyer.getProvince(),
                    buyer.getCity());

            BigDecimal price = resolution.getPrice();
            if (price.signum() < 0) {
                log.warn("Negative shipping price {} resolved for sellerId: {}; using zero.", price, sellerId);
                result.getNotices().add("Seller " + sellerId + " has an invalid shipping rate for "
                        + destination(buyer) + "; no shipping charged.");
                price = BigDecimal.ZERO;
            } else if (!resolution.isFound()) {
                result.getNotices().add("Seller " + sellerId + " has no shipping rate configured for "
                        + destination(buyer) + ".");
            }

            total = total.add(price);
            result.getBreakdown().add(SellerShippingEstimate.builder()
                    .sellerId(sellerId)
                    .province(buyer.getProvince())
                    .city(buyer.getCity())
                    .price(price)
                    .itemCount(entry.getValue())
                    .source(resolution.getSource())
                    .level(resolution.getLevel())
                    .build());
        }

        result.setTotal(total);
        log.info("Estimated shipping for {} seller(s) to {}: total {}", result.getBreakdown().size(), destination(buyer), total);
        return result;
    }

    /**
     * Explains how a seller's tariff resolves for a destination, step by step.
     */
    public TariffResolution explainTariff(String sellerId, String province, String city) {
        List<ShippingRule> sellerRules = isUnknownSeller(sellerId)
                ? Collections.emptyList()
                : shippingRuleProvider.getRulesForSeller(sellerId);
        return tariffResolver.resolveDetailed(sellerId, sellerRules, platformRules(), province, city);
    }

    public List<ShippingRule> getActiveRules(String sellerId) {
        if (isUnknownSeller(sellerId)) {
            return Collections.emptyList();
        }
        return shippingRuleProvider.getRulesForSeller(sellerId).stream()
                .filter(rule -> rule != null && rule.isActive())
                .collect(Collectors.toList());
    }

    private Map<String, List<ShippingRule>> fetchRules(Set<String> sellerIds) {
        List<String> lookupIds = sellerIds.stream()
                .filter(sellerId -> !isUnknownSeller(sellerId))
                .collect(Collectors.toList());
        if (lookupIds.isEmpty()) {
            return Collections.emptyMap();
        }

        if (shippingProperties.getRuleStore().isBatchLookup()) {
            Map<String, List<ShippingRule>> fetched = shippingRuleProvider.getRulesForSellers(lookupIds);
            return fetched != null ? fetched : Collections.emptyMap();
        }
        return fetchRulesConcurrently(lookupIds);
    }

    /**
     * Fetches every seller's rules on the rule executor under one shared deadline.
     * Any failure cancels the lookups still in flight.
     */
    private Map<String, List<ShippingRule>> fetchRulesConcurrently(List<String> sellerIds) {
        Map<String, Future<List<ShippingRule>>> pending = new LinkedHashMap<>();
        long deadline = System.nanoTime() + shippingProperties.getRuleStore().getFetchTimeout().toNanos();
        Map<String, List<ShippingRule>> rulesBySeller = new HashMap<>();
        try {
            for (String sellerId : sellerIds) {
                Callable<List<ShippingRule>> lookup = () -> shippingRuleProvider.getRulesForSeller(sellerId);
                pending.put(sellerId, shippingRuleExecutor.submit(lookup));
            }
            for (Map.Entry<String, Future<List<ShippingRule>>> entry : pending.entrySet()) {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                List<ShippingRule> rules = entry.getValue().get(remaining, TimeUnit.NANOSECONDS);
                rulesBySeller.put(entry.getKey(), rules != null ? rules : Collections.emptyList());
            }
        } catch (TaskRejectedException e) {
            cancelAll(pending);
            log.error("Rule fetch pool saturated, rejected lookup for sellers: {}. Error: {}", sellerIds, e.getMessage());
            throw new ServiceCommunicationException("Too many concurrent shipping rule lookups.", e);
        } catch (InterruptedException e) {
            cancelAll(pending);
            Thread.currentThread().interrupt();
            log.warn("Shipping estimate interrupted while fetching rules for sellers: {}", sellerIds);
            throw new ShippingEstimateCancelledException("Shipping estimate cancelled while fetching seller rules.", e);
        } catch (TimeoutException e) {
            cancelAll(pending);
            log.error("Timed out after {} fetching shipping rules for sellers: {}",
                    shippingProperties.getRuleStore().getFetchTimeout(), sellerIds);
            throw new ServiceCommunicationException("Timed out retrieving shipping rules.", e);
        } catch (ExecutionException e) {
            cancelAll(pending);
            throw asServiceCommunicationException(e.getCause());
        }
        return rulesBySeller;
    }

    private static void cancelAll(Map<String, Future<List<ShippingRule>>> pending) {
        pending.values().forEach(future -> future.cancel(true));
    }

    private static ServiceCommunicationException asServiceCommunicationException(Throwable cause) {
        Throwable actual = cause instanceof CompletionException && cause.getCause() != null ? cause.getCause() : cause;
        if (actual instanceof ServiceCommunicationException) {
            return (ServiceCommunicationException) actual;
        }
        log.error("Unexpected error fetching shipping rules: {}", actual.getMessage(), actual);
        return new ServiceCommunicationException("Failed to retrieve shipping rules.", actual);
    }

    private List<ShippingRule> platformRules() {
        ShippingProperties.PlatformFallback fallback = shippingProperties.getPlatformFallback();
        return fallback.isEnabled() ? fallback.getRules() : Collections.emptyList();
    }

    private static boolean isUnknownSeller(String sellerId) {
        return sellerId == null || sellerId.isBlank();
    }

    private static String destination(BuyerLocation buyer) {
        String city = buyer.getCity();
        return city == null || city.isBlank() ? buyer.getProvince() : buyer.getProvince() + " / " + city;
    }
}
