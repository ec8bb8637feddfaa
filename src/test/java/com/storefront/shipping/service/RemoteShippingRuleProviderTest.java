package com.storefront.shipping.service;

import com.storefront.shipping.client.ShippingRuleServiceClient;
import com.storefront.shipping.exception.ServiceCommunicationException;
import com.storefront.shipping.model.ShippingRule;
import feign.FeignException;
import feign.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class RemoteShippingRuleProviderTest {

    @Mock
    private ShippingRuleServiceClient shippingRuleServiceClient;

    private RemoteShippingRuleProvider provider;

    private final Request request = Request.create(Request.HttpMethod.GET, "http://rules/api/internal/shipping-rules",
            Collections.emptyMap(), null, StandardCharsets.UTF_8, null);

    @BeforeEach
    void setUp() {
        provider = new RemoteShippingRuleProvider(shippingRuleServiceClient);
    }

    private static ShippingRule rule(String sellerId) {
        return ShippingRule.builder().sellerId(sellerId).province("Pichincha").price(BigDecimal.ONE).build();
    }

    @Test
    void getRulesForSeller_ReturnsStoreRules() {
        given(shippingRuleServiceClient.getRulesForSeller("seller-1")).willReturn(List.of(rule("seller-1")));

        assertThat(provider.getRulesForSeller("seller-1")).hasSize(1);
    }

    @Test
    void getRulesForSeller_NullBodyIsEmpty() {
        given(shippingRuleServiceClient.getRulesForSeller("seller-1")).willReturn(null);

        assertThat(provider.getRulesForSeller("seller-1")).isEmpty();
    }

    @Test
    void getRulesForSeller_UnknownSellerIsEmpty() {
        given(shippingRuleServiceClient.getRulesForSeller("seller-1"))
                .willThrow(new FeignException.NotFound("not found", request, null, Collections.emptyMap()));

        assertThat(provider.getRulesForSeller("seller-1")).isEmpty();
    }

    @Test
    void getRulesForSeller_StoreFailureIsServiceCommunicationException() {
        given(shippingRuleServiceClient.getRulesForSeller("seller-1"))
                .willThrow(new FeignException.ServiceUnavailable("down", request, null, Collections.emptyMap()));

        assertThatThrownBy(() -> provider.getRulesForSeller("seller-1"))
                .isInstanceOf(ServiceCommunicationException.class)
                .hasCauseInstanceOf(FeignException.class);
    }

    @Test
    void getRulesForSellers_FillsMissingSellersWithEmptyLists() {
        given(shippingRuleServiceClient.getRulesForSellers(List.of("seller-1", "seller-2")))
                .willReturn(Map.of("seller-1", List.of(rule("seller-1"))));

        Map<String, List<ShippingRule>> rules = provider.getRulesForSellers(List.of("seller-1", "seller-2"));

        assertThat(rules).containsOnlyKeys("seller-1", "seller-2");
        assertThat(rules.get("seller-1")).hasSize(1);
        assertThat(rules.get("seller-2")).isEmpty();
    }

    @Test
    void getRulesForSellers_StoreFailureIsServiceCommunicationException() {
        given(shippingRuleServiceClient.getRulesForSellers(List.of("seller-1")))
                .willThrow(new FeignException.InternalServerError("boom", request, null, Collections.emptyMap()));

        assertThatThrownBy(() -> provider.getRulesForSellers(List.of("seller-1")))
                .isInstanceOf(ServiceCommunicationException.class);
    }
}
