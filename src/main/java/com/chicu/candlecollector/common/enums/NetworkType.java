package com.chicu.candlecollector.common.enums;

/**
 * Окружение биржи: боевое или песочница (testnet / demo / simulated trading).
 */
public enum NetworkType {
    MAINNET,
    TESTNET
}
