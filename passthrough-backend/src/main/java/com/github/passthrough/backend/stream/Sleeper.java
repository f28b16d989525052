package com.github.passthrough.backend.stream;

import java.time.Duration;

/**
 * Pauses the current thread between polls of the debrid provider.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
