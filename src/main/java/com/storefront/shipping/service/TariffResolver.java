package com.storefront.shipping.service;

import com.storefront.shipping.model.ShippingRule;
import com.storefront.shipping.model.TariffLevel;
import com.storefront.shipping.model.TariffResolution;
import com.storefront.shipping.model.TariffSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.storefront.shipping.service.LocationNormalizer.normalize;

/**
 * Picks the single shipping rule that applies to a destination.
 *
 * <p>Specificity order, first match wins:
 * <ol>
 *   <li>active rule for the buyer's province and city</li>
 *   <li>active province-wide rule (blank city) for the buyer's province</li>
 *   <li>nothing: the tariff is zero</li>
 * </ol>
 * Multiple matches at the same level are never summed; the first one in the
 * order the rule store returned them is used.
 */
@Component
@Slf4j
public class TariffResolver {

    /**
     * Resolves a seller's price for a destination. A missing rule, a blank province
     * or a rule without a price all resolve to zero.
     */
    public BigDecimal resolve(List<ShippingRule> rules, String province, String city) {
        String provinceKey = normalize(province);
        if (provinceKey.isEmpty()) {
            return BigDecimal.ZERO;
        }
        String cityKey = normalize(city);
        List<ShippingRule> candidates = activeRules(rules);

        return findCityRule(candidates, provinceKey, cityKey)
                .or(() -> findProvinceRule(candidates, provinceKey))
                .map(ShippingRule::getPrice)
                .orElse(BigDecimal.ZERO);
    }

    /**
     * Resolves a tariff and records how it was reached. The seller's own rules are
     * tried first; platform rules are only consulted when the seller has no match
     * and the list is non-empty.
     */
    public TariffResolution resolveDetailed(String sellerId,
                                            List<ShippingRule> sellerRules,
                                            List<ShippingRule> platformRules,
                                            String province,
                                            String city) {
        String provinceKey = normalize(province);
        String cityKey = normalize(city);
        List<ShippingRule> sellerCandidates = activeRules(sellerRules);
        List<ShippingRule> platformCandidates = activeRules(platformRules);

        TariffResolution resolution = TariffResolution.builder()
                .sellerId(sellerId)
                .province(province)
                .city(city)
                .normalizedProvince(provinceKey)
                .normalizedCity(cityKey)
                .sellerRuleCount(sellerCandidates.size())
                .platformRuleCount(platformCandidates.size())
                .build();

        if (provinceKey.isEmpty()) {
            resolution.addStep("Province is blank, no rule can apply");
            return resolution;
        }
        resolution.addStep("Normalized destination: province='" + provinceKey + "', city='" + cityKey + "'");
        resolution.addStep("Seller rules loaded: " + sellerCandidates.size() + " active");

        if (tryLevels(resolution, sellerCandidates, provinceKey, cityKey, TariffSource.SELLER)) {
            return resolution;
        }

        if (!platformCandidates.isEmpty()) {
            resolution.addStep("Falling back to platform rules: " + platformCandidates.size() + " active");
            if (tryLevels(resolution, platformCandidates, provinceKey, cityKey, TariffSource.PLATFORM)) {
                return resolution;
            }
        }

        resolution.addStep("No shipping rule configured, tariff is zero");
        log.debug("No shipping rule for sellerId: {} at province: {}, city: {}", sellerId, province, city);
        return resolution;
    }

    private boolean tryLevels(TariffResolution resolution,
                              List<ShippingRule> candidates,
                              String provinceKey,
                              String cityKey,
                              TariffSource source) {
        String label = source.name().toLowerCase(Locale.ROOT);

        Optional<ShippingRule> cityRule = findCityRule(candidates, provinceKey, cityKey);
        if (cityRule.isPresent()) {
            apply(resolution, cityRule.get(), source, TariffLevel.CITY);
            resolution.addStep("Matched " + label + " city rule: " + resolution.getPrice());
            return true;
        }
        resolution.addStep("No " + label + " city rule");

        Optional<ShippingRule> provinceRule = findProvinceRule(candidates, provinceKey);
        if (provinceRule.isPresent()) {
            apply(resolution, provinceRule.get(), source, TariffLevel.PROVINCE);
            resolution.addStep("Matched " + label + " province rule: " + resolution.getPrice());
            return true;
        }
        resolution.addStep("No " + label + " province rule");
        return false;
    }

    private void apply(TariffResolution resolution, ShippingRule rule, TariffSource source, TariffLevel level) {
        resolution.setFound(true);
        resolution.setAppliedRule(rule);
        resolution.setSource(source);
        resolution.setLevel(level);
        resolution.setPrice(rule.getPrice() != null ? rule.getPrice() : BigDecimal.ZERO);
    }

    private Optional<ShippingRule> findCityRule(List<ShippingRule> rules, String provinceKey, String cityKey) {
        if (cityKey.isEmpty()) {
            return Optional.empty();
        }
        List<ShippingRule> matches = rules.stream()
                .filter(rule -> normalize(rule.getProvince()).equals(provinceKey))
                .filter(rule -> !rule.isProvinceWide())
                .filter(rule -> normalize(rule.getCity()).equals(cityKey))
                .collect(Collectors.toList());
        if (matches.size() > 1) {
            // Data-quality issue on the seller side; keep the first one in store order.
            log.warn("Found {} active city rules for province: {}, city: {} (sellerId: {}). Using the first.",
                    matches.size(), provinceKey, cityKey, matches.get(0).getSellerId());
        }
        return matches.stream().findFirst();
    }

    private Optional<ShippingRule> findProvinceRule(List<ShippingRule> rules, String provinceKey) {
        return rules.stream()
                .filter(rule -> normalize(rule.getProvince()).equals(provinceKey))
                .filter(ShippingRule::isProvinceWide)
                .findFirst();
    }

    private static List<ShippingRule> activeRules(List<ShippingRule> rules) {
        if (rules == null) {
            return Collections.emptyList();
        }
        return rules.stream()
                .filter(Objects::nonNull)
                .filter(ShippingRule::isActive)
                .collect(Collectors.toList());
    }
}
