package org.example.coursearchiver.retry;

/**
 * Suspension point for pacing, backoff and polling waits. Tests replace it to run without real
 * delays.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
