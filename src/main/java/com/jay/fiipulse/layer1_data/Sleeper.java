package com.jay.fiipulse.layer1_data;

/**
 * Pause between requests (politeness delay, retry back-off, session warm-up).
 * Injected so that tests can run without real waits.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    Sleeper NONE = millis -> { };

    void sleep(long millis) throws InterruptedException;
}
