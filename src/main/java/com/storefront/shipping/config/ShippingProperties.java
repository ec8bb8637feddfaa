package com.storefront.shipping.config;

import com.storefront.shipping.model.ShippingRule;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings under the {@code shipping} prefix.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "shipping")
public class ShippingProperties {

    @Valid
    private RuleStore ruleStore = new RuleStore();

    @Valid
    private PlatformFallback platformFallback = new PlatformFallback();

    @Valid
    private Messages messages = new Messages();

    @Data
    public static class RuleStore {

        /** Where seller rules come from: the rule store service, or {@link #rules} below. */
        @NotNull
        private Mode mode = Mode.REMOTE;

        /** Fetch all sellers of a cart with one bulk call instead of one call per seller. */
        private boolean batchLookup = false;

        /** Upper bound for fetching every seller's rules of one estimate. */
        @NotNull
        private Duration fetchTimeout = Duration.ofSeconds(5);

        @Valid
        private Executor executor = new Executor();

        /** Seed rules for {@code mode: in-memory}. */
        private List<ShippingRule> rules = new ArrayList<>();
    }

    public enum Mode {
        REMOTE,
        IN_MEMORY
    }

    @Data
    public static class Executor {
        @Min(1)
        private int corePoolSize = 4;
        @Min(1)
        private int maxPoolSize = 16;
        @Min(0)
        private int queueCapacity = 200;
        @NotBlank
        private String threadNamePrefix = "shipping-rules-";
    }

    /**
     * Platform-wide default rules, tried after a seller's own rules fail to match.
     */
    @Data
    public static class PlatformFallback {
        private boolean enabled = false;
        private List<ShippingRule> rules = new ArrayList<>();
    }

    @Data
    public static class Messages {
        @NotBlank
        private String missingProvince = "The buyer has no province configured in their profile.";
    }
}
