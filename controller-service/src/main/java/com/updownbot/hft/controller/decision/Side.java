package com.updownbot.hft.controller.decision;

public enum Side {
    UP,
    DOWN
}
