package com.spatialflow.scheduling;

import java.time.Duration;

/**
 * One-shot delayed execution. The engine arms debounce and schedule timers
 * only through this, so tests can drive time by hand.
 */
public interface TimerService {

    ScheduledTask schedule(Runnable task, Duration delay);
}
