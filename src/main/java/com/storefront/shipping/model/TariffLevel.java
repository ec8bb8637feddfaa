package com.storefront.shipping.model;

public enum TariffLevel {
    CITY,
    PROVINCE,
    NONE
}
