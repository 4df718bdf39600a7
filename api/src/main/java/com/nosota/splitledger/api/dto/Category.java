package com.nosota.splitledger.api.dto;

/**
 * Display metadata used to decorate category spending.
 */
public record Category(
        String id,
        String name,
        String color,
        String icon
) {
}
