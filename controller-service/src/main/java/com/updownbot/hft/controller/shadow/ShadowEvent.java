package com.updownbot.hft.controller.shadow;

/**
 * Lifecycle event recorded in the shadow log.
 */
public enum ShadowEvent {
    CREATED,
    /** Outcome not available yet; the proposal stays pending. */
    DEFERRED,
    RESOLVED
}
