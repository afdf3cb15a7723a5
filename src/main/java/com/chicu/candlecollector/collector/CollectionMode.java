package com.chicu.candlecollector.collector;

public enum CollectionMode {
    /** последние свечи каждой серии */
    CURRENT,
    /** история от стартовой даты до "сейчас" */
    HISTORICAL
}
