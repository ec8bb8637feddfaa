package com.storefront.shipping.model;

/**
 * Which rule set supplied a resolved tariff.
 */
public enum TariffSource {
    SELLER,
    PLATFORM,
    NONE
}
