package com.chicu.candlecollector.collector;

public enum UnitStatus {
    SUCCESS,
    /** история записана не до конца: истёк бюджет прогона */
    PARTIAL,
    FAILED,
    /** не запускалась: бюджет прогона, неподдерживаемый таймфрейм */
    SKIPPED
}
