package com.storefront.shipping.controller;

import com.storefront.shipping.dto.request.ShippingEstimateRequest;
import com.storefront.shipping.dto.response.ShippingEstimateResponse;
import com.storefront.shipping.exception.ServiceCommunicationException;
import com.storefront.shipping.exception.ShippingEstimateCancelledException;
import com.storefront.shipping.mapper.ShippingEstimateMapper;
import com.storefront.shipping.model.ShippingEstimateResult;
import com.storefront.shipping.service.ShippingEstimateService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/public/shipping/estimate")
@Slf4j
public class ShippingEstimateController {

    private final ShippingEstimateService shippingEstimateService;
    private final ShippingEstimateMapper shippingEstimateMapper;

    public ShippingEstimateController(ShippingEstimateService shippingEstimateService,
                                      ShippingEstimateMapper shippingEstimateMapper) {
        this.shippingEstimateService = shippingEstimateService;
        this.shippingEstimateMapper = shippingEstimateMapper;
    }

    /**
     * Estimates shipping for the logged-in buyer's saved cart, delivered to the
     * location registered in their profile.
     *
     * @param userId The ID of the logged-in buyer (from X-User-ID header).
     * @return Total shipping plus one entry per seller in the cart.
     */
    @GetMapping
    public ResponseEntity<ShippingEstimateResponse> estimateForBuyer(
            @RequestHeader(value = "X-User-ID", required = false) String userId) {

        log.info("Received request to estimate shipping for userId: {}", userId);

        if (userId == null || userId.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "User ID is required to estimate shipping.");
        }

        try {
            ShippingEstimateResult result = shippingEstimateService.estimateForBuyer(userId);
            return ResponseEntity.ok(shippingEstimateMapper.toResponse(result));
        } catch (ServiceCommunicationException e) {
            log.error("Service communication error during shipping estimate for userId {}: {}", userId, e.getMessage(), e);
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Dependent service unavailable.", e);
        } catch (ShippingEstimateCancelledException e) {
            log.warn("Shipping estimate cancelled for userId {}: {}", userId, e.getMessage());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Shipping estimate was cancelled.", e);
        }
    }

    /**
     * Estimates shipping for the cart lines and destination given in the body.
     *
     * @param request Destination province/city and the cart lines.
     * @return Total shipping plus one entry per seller in the request.
     */
    @PostMapping
    public ResponseEntity<ShippingEstimateResponse> estimate(@Valid @RequestBody ShippingEstimateRequest request) {

        log.info("Received request to estimate shipping to province: {}, city: {} for {} line(s)",
                request.getProvince(), request.getCity(), request.getItems().size());

        try {
            ShippingEstimateResult result = shippingEstimateService.estimate(
                    shippingEstimateMapper.toCartLineItems(request),
                    shippingEstimateMapper.toBuyerLocation(request));
            return ResponseEntity.ok(shippingEstimateMapper.toResponse(result));
        } catch (ServiceCommunicationException e) {
            log.error("Service communication error during shipping estimate: {}", e.getMessage(), e);
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Dependent service unavailable.", e);
        } catch (ShippingEstimateCancelledException e) {
            log.warn("Shipping estimate cancelled: {}", e.getMessage());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Shipping estimate was cancelled.", e);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid cart for shipping estimate: {}", e.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }
}
