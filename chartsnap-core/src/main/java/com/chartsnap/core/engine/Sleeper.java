package com.chartsnap.core.engine;

/**
 * Blocking settle delay. Lets asynchronous rendering catch up before a capture or teardown.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = millis -> {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    };

    void sleep(long millis) throws InterruptedException;
}
