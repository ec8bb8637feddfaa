package com.storefront.shipping.config;

import com.storefront.shipping.model.ShippingRule;
import com.storefront.shipping.service.ShippingRuleProvider;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class ShippingEngineConfigTest {

    private final ShippingEngineConfig config = new ShippingEngineConfig();

    @Test
    void executorUsesConfiguredPoolSettings() {
        ShippingProperties properties = new ShippingProperties();
        properties.getRuleStore().getExecutor().setCorePoolSize(8);
        properties.getRuleStore().getExecutor().setMaxPoolSize(2);
        properties.getRuleStore().getExecutor().setThreadNamePrefix("rules-test-");

        ThreadPoolTaskExecutor executor = config.shippingRuleExecutor(properties);

        assertThat(executor.getCorePoolSize()).isEqualTo(8);
        // max never drops below core
        assertThat(executor.getMaxPoolSize()).isEqualTo(8);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("rules-test-");
    }

    @Test
    void inMemoryProviderServesConfiguredRules() {
        ShippingProperties properties = new ShippingProperties();
        properties.getRuleStore().getRules().add(ShippingRule.builder()
                .sellerId("seller-1").province("Pichincha").price(new BigDecimal("7.00")).build());

        ShippingRuleProvider provider = config.inMemoryShippingRuleProvider(properties);

        assertThat(provider.getRulesForSeller("seller-1")).hasSize(1);
        assertThat(provider.getRulesForSeller("seller-2")).isEmpty();
    }
}
