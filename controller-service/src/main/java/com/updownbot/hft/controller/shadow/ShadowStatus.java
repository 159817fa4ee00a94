package com.updownbot.hft.controller.shadow;

public enum ShadowStatus {
    PENDING,
    RESOLVED
}
