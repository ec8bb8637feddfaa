package com.storefront.shipping.controller;

import com.storefront.shipping.exception.ServiceCommunicationException;
import com.storefront.shipping.model.ShippingRule;
import com.storefront.shipping.model.TariffResolution;
import com.storefront.shipping.service.ShippingEstimateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Support endpoints for answering "why was this seller charged X?".
 */
@RestController
@RequestMapping("/api/internal/shipping/sellers/{sellerId}")
@PreAuthorize("hasAuthority('shipping.admin')")
@RequiredArgsConstructor
@Slf4j
public class ShippingRuleDiagnosticsController {

    private final ShippingEstimateService shippingEstimateService;

    @GetMapping("/resolution")
    public ResponseEntity<TariffResolution> explainTariff(
            @PathVariable String sellerId,
            @RequestParam String province,
            @RequestParam(required = false) String city) {

        log.info("Received request to explain tariff for sellerId: {}, province: {}, city: {}", sellerId, province, city);

        try {
            return ResponseEntity.ok(shippingEstimateService.explainTariff(sellerId, province, city));
        } catch (ServiceCommunicationException e) {
            log.error("Service communication error while explaining tariff for sellerId {}: {}", sellerId, e.getMessage(), e);
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Dependent service unavailable.", e);
        }
    }

    @GetMapping("/rules")
    public ResponseEntity<List<ShippingRule>> getActiveRules(@PathVariable String sellerId) {

        log.info("Received request to list active shipping rules for sellerId: {}", sellerId);

        try {
            return ResponseEntity.ok(shippingEstimateService.getActiveRules(sellerId));
        } catch (ServiceCommunicationException e) {
            log.error("Service communication error while listing rules for sellerId {}: {}", sellerId, e.getMessage(), e);
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Dependent service unavailable.", e);
        }
    }
}
