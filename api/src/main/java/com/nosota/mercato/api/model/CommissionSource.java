package com.nosota.mercato.api.model;

/**
 * Override tier that supplied the commission rate.
 * Resolution order is CATEGORY, then SELLER, then GLOBAL.
 */
public enum CommissionSource {
    GLOBAL,
    SELLER,
    CATEGORY
}
