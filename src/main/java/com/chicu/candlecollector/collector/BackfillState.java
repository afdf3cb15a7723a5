package com.chicu.candlecollector.collector;

/**
 * Состояния исторической догрузки одной серии.
 *
 * START → FETCHING → STORING → FETCHING … → DONE | FAILED | SUSPENDED
 */
public enum BackfillState {
    START,
    FETCHING,
    STORING,
    /** догнали "сейчас" или биржа отдала короткую/пустую страницу */
    DONE,
    /** ошибка биржи или БД; курсор остался на последней записанной странице */
    FAILED,
    /** бюджет прогона истёк между страницами */
    SUSPENDED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == SUSPENDED;
    }
}
