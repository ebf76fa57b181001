package com.github.anirbanmu.wisp.util;

import java.time.Duration;

// blocking wait used by the rest transport; swapped out in tests
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
