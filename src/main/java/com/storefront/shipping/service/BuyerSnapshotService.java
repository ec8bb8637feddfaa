package com.storefront.shipping.service;

import com.storefront.shipping.client.BuyerProfileServiceClient;
import com.storefront.shipping.client.CartSnapshotServiceClient;
import com.storefront.shipping.exception.ServiceCommunicationException;
import com.storefront.shipping.model.BuyerLocation;
import com.storefront.shipping.model.CartLineItem;
import feign.FeignException;
import feign.codec.DecodeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Loads what an estimate needs about a buyer: the registered location and the
 * current cart snapshot.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BuyerSnapshotService {

    private final BuyerProfileServiceClient buyerProfileServiceClient;
    private final CartSnapshotServiceClient cartSnapshotServiceClient;

    /**
     * @return the buyer's location, or {@link BuyerLocation#unknown()} when the profile does not exist
     * @throws ServiceCommunicationException if the profile service cannot be reached
     */
    public BuyerLocation loadLocation(String buyerId) {
        try {
            BuyerLocation location = buyerProfileServiceClient.getBuyerLocation(buyerId);
            if (location == null) {
                log.warn("Buyer profile service returned no location for buyerId: {}", buyerId);
                return BuyerLocation.unknown();
            }
            return location;
        } catch (FeignException.NotFound e) {
            log.warn("Buyer profile not found for buyerId: {}", buyerId);
            return BuyerLocation.unknown();
        } catch (FeignException e) {
            log.error("Failed to get buyer location from Buyer Profile Service for buyerId: {}. Error: {}", buyerId, e.getMessage());
            throw new ServiceCommunicationException("Failed to retrieve buyer location.", e);
        }
    }

    /**
     * Reads the buyer's cart. An unreadable or unavailable cart is treated as empty so
     * that checkout is never blocked by the estimate. Lines with a non-positive quantity
     * are dropped.
     */
    public List<CartLineItem> loadCart(String buyerId) {
        try {
            List<CartLineItem> items = cartSnapshotServiceClient.getCartItems(buyerId);
            if (items == null) {
                log.debug("Cart service returned no body for buyerId: {}", buyerId);
                return Collections.emptyList();
            }
            List<CartLineItem> lines = items.stream()
                    .filter(Objects::nonNull)
                    .filter(item -> {
                        if (item.getQuantity() <= 0) {
                            log.warn("Dropping cart line for productId: {} with quantity {} (buyerId: {})",
                                    item.getProductId(), item.getQuantity(), buyerId);
                            return false;
                        }
                        return true;
                    })
                    .collect(Collectors.toList());
            long totalQuantity = lines.stream().mapToLong(CartLineItem::getQuantity).sum();
            if (totalQuantity > Integer.MAX_VALUE) {
                log.warn("Cart snapshot for buyerId: {} has an implausible total quantity {}, treating it as empty.",
                        buyerId, totalQuantity);
                return Collections.emptyList();
            }
            return lines;
        } catch (DecodeException e) {
            log.warn("Cart snapshot for buyerId: {} is malformed, treating it as empty. Error: {}", buyerId, e.getMessage());
            return Collections.emptyList();
        } catch (FeignException e) {
            log.warn("Cart service unavailable for buyerId: {}, treating cart as empty. Error: {}", buyerId, e.getMessage());
            return Collections.emptyList();
        }
    }
}
