package com.chicu.candlecollector.engine;

public enum JobState {
    IDLE,
    RUNNING
}
