package com.storefront.shipping.config;

import com.storefront.shipping.service.InMemoryShippingRuleProvider;
import com.storefront.shipping.service.ShippingRuleProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@Slf4j
public class ShippingEngineConfig {

    /**
     * Pool used to fetch several sellers' rules concurrently within one estimate.
     * Kept separate from the common pool so slow rule-store calls cannot starve it.
     */
    @Bean(name = "shippingRuleExecutor")
    public ThreadPoolTaskExecutor shippingRuleExecutor(ShippingProperties shippingProperties) {
        ShippingProperties.Executor settings = shippingProperties.getRuleStore().getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(settings.getCorePoolSize(), settings.getMaxPoolSize()));
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix(settings.getThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    @ConditionalOnProperty(name = "shipping.rule-store.mode", havingValue = "in-memory")
    public ShippingRuleProvider inMemoryShippingRuleProvider(ShippingProperties shippingProperties) {
        log.info("Serving {} shipping rules from configuration (in-memory rule store).",
                shippingProperties.getRuleStore().getRules().size());
        return new InMemoryShippingRuleProvider(shippingProperties.getRuleStore().getRules());
    }
}
