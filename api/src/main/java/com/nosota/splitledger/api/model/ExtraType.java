package com.nosota.splitledger.api.model;

public enum ExtraType {
    PERCENT,
    ABSOLUTE
}
