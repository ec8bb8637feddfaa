package com.storefront.shipping.controller;

import com.storefront.shipping.exception.ServiceCommunicationException;
import com.storefront.shipping.model.ShippingRule;
import com.storefront.shipping.model.TariffLevel;
import com.storefront.shipping.model.TariffResolution;
import com.storefront.shipping.model.TariffSource;
import com.storefront.shipping.service.ShippingEstimateService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ShippingRuleDiagnosticsControllerTest {

    @Mock
    private ShippingEstimateService shippingEstimateService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ShippingRuleDiagnosticsController(shippingEstimateService)).build();
    }

    @Test
    void requiresShippingAdminAuthority() {
        PreAuthorize preAuthorize = ShippingRuleDiagnosticsController.class.getAnnotation(PreAuthorize.class);

        assertThat(preAuthorize).isNotNull();
        assertThat(preAuthorize.value()).isEqualTo("hasAuthority('shipping.admin')");
    }

    @Test
    void explainTariff_ReturnsResolution() throws Exception {
        ShippingRule applied = ShippingRule.builder()
                .sellerId("seller-1").province("Pichincha").city("Quito").price(new BigDecimal("5.00")).build();
        TariffResolution resolution = TariffResolution.builder()
                .sellerId("seller-1").province("Pichincha").city("Quito")
                .normalizedProvince("pichincha").normalizedCity("quito")
                .found(true).price(new BigDecimal("5.00"))
                .source(TariffSource.SELLER).level(TariffLevel.CITY)
                .appliedRule(applied)
                .sellerRuleCount(2)
                .build();
        resolution.addStep("Matched seller city rule: 5.00");
        given(shippingEstimateService.explainTariff("seller-1", "Pichincha", "Quito")).willReturn(resolution);

        mockMvc.perform(get("/api/internal/shipping/sellers/seller-1/resolution")
                        .param("province", "Pichincha")
                        .param("city", "Quito"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.found").value(true))
                .andExpect(jsonPath("$.source").value("SELLER"))
                .andExpect(jsonPath("$.level").value("CITY"))
                .andExpect(jsonPath("$.appliedRule.city").value("Quito"))
                .andExpect(jsonPath("$.steps[0]").value("Matched seller city rule: 5.00"));
    }

    @Test
    void explainTariff_ProvinceIsRequired() throws Exception {
        mockMvc.perform(get("/api/internal/shipping/sellers/seller-1/resolution"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getActiveRules_ListsRules() throws Exception {
        given(shippingEstimateService.getActiveRules("seller-1")).willReturn(List.of(
                ShippingRule.builder().sellerId("seller-1").province("Pichincha").price(new BigDecimal("7.00")).build()));

        mockMvc.perform(get("/api/internal/shipping/sellers/seller-1/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].province").value("Pichincha"))
                .andExpect(jsonPath("$[0].active").value(true));
    }

    @Test
    void getActiveRules_RuleStoreDownIsUnavailable() throws Exception {
        given(shippingEstimateService.getActiveRules("seller-1"))
                .willThrow(new ServiceCommunicationException("Failed to retrieve shipping rules for seller seller-1."));

        mockMvc.perform(get("/api/internal/shipping/sellers/seller-1/rules"))
                .andExpect(status().isServiceUnavailable());
    }
}
