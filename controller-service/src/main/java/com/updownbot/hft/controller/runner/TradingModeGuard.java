package com.updownbot.hft.controller.runner;

import com.updownbot.hft.config.HftProperties;
import jakarta.annotation.PostConstruct;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class TradingModeGuard {

    private final @NonNull HftProperties properties;

    @PostConstruct
    void check() {
        if (properties.mode() != HftProperties.TradingMode.SHADOW) {
            throw new IllegalStateException("hft.mode=" + properties.mode()
                    + " is not supported; order placement is disabled and only SHADOW runs");
        }
        log.info("trading mode SHADOW: no orders will be placed");
    }
}
