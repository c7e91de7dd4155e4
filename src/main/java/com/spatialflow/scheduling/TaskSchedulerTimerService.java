package com.spatialflow.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link TimerService} on top of the single-threaded automation TaskScheduler.
 * A task that throws is logged here so the scheduler thread keeps running.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaskSchedulerTimerService implements TimerService {

    private final TaskScheduler automationTaskScheduler;
    private final Clock clock;

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = automationTaskScheduler.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Timer task failed: {}", e.getMessage(), e);
            }
        }, clock.instant().plus(delay));
        return () -> future.cancel(false);
    }
}
