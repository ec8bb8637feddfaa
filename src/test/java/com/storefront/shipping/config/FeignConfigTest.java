package com.storefront.shipping.config;

import feign.FeignException;
import feign.Request;
import feign.Response;
import feign.RetryableException;
import feign.codec.ErrorDecoder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class FeignConfigTest {

    private final ErrorDecoder errorDecoder = new FeignConfig().feignErrorDecoder();

    private static Response response(int status) {
        Request request = Request.create(Request.HttpMethod.GET, "http://rules/api/internal/shipping-rules/sellers/seller-1",
                Collections.emptyMap(), null, StandardCharsets.UTF_8, null);
        return Response.builder()
                .status(status)
                .reason("status " + status)
                .request(request)
                .headers(Collections.emptyMap())
                .body(new byte[0])
                .build();
    }

    @ParameterizedTest
    @ValueSource(ints = {429, 500, 502, 503, 504})
    void transientStatusesAreRetryable(int status) {
        Exception decoded = errorDecoder.decode("ShippingRuleServiceClient#getRulesForSeller(String)", response(status));

        assertThat(decoded).isInstanceOf(RetryableException.class);
        assertThat(((RetryableException) decoded).status()).isEqualTo(status);
    }

    @Test
    void notFoundKeepsDefaultDecoding() {
        Exception decoded = errorDecoder.decode("ShippingRuleServiceClient#getRulesForSeller(String)", response(404));

        assertThat(decoded).isInstanceOf(FeignException.NotFound.class);
    }

    @Test
    void clientErrorsAreNotRetried() {
        Exception decoded = errorDecoder.decode("BuyerProfileServiceClient#getBuyerLocation(String)", response(400));

        assertThat(decoded).isInstanceOf(FeignException.BadRequest.class)
                .isNotInstanceOf(RetryableException.class);
    }

    @Test
    void isTransient() {
        assertThat(FeignConfig.isTransient(503)).isTrue();
        assertThat(FeignConfig.isTransient(404)).isFalse();
        assertThat(FeignConfig.isTransient(501)).isFalse();
    }
}
