package com.keystone.core.resilience;

import java.time.Duration;

/**
 * Blocking pause used between retries and canary samples. Swappable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());
}
