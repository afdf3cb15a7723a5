package com.chicu.candlecollector.engine;

public enum TriggerResult {
    ACCEPTED,
    REJECTED_ALREADY_RUNNING
}
