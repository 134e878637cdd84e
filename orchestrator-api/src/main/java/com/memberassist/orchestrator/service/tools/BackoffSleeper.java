package com.memberassist.orchestrator.service.tools;

import java.time.Duration;

@FunctionalInterface
public interface BackoffSleeper {

    BackoffSleeper THREAD = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}
