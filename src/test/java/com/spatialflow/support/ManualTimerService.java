package com.spatialflow.support;

import com.spatialflow.scheduling.ScheduledTask;
import com.spatialflow.scheduling.TimerService;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Timer service driven by hand. Time only moves on {@link #advance}, which
 * runs every due task in deadline order, including tasks scheduled by
 * tasks that ran during the same advance.
 */
public class ManualTimerService implements TimerService {

    private final List<Entry> pending = new ArrayList<>();
    private Instant now;
    private long sequence;

    public ManualTimerService(Instant start) {
        this.now = start;
    }

    public ManualTimerService() {
        this(Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Override
    public synchronized ScheduledTask schedule(Runnable task, Duration delay) {
        Entry entry = new Entry(now.plus(delay), sequence++, task);
        pending.add(entry);
        return () -> {
            synchronized (ManualTimerService.this) {
                pending.remove(entry);
            }
        };
    }

    public void advance(Duration duration) {
        Instant target;
        synchronized (this) {
            target = now.plus(duration);
        }
        while (true) {
            Entry next;
            synchronized (this) {
                Optional<Entry> due = pending.stream()
                        .filter(e -> !e.deadline.isAfter(target))
                        .min(Comparator.comparing((Entry e) -> e.deadline).thenComparingLong(e -> e.order));
                if (due.isEmpty()) {
                    now = target;
                    return;
                }
                next = due.get();
                pending.remove(next);
                now = next.deadline;
            }
            next.task.run();
        }
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized Instant now() {
        return now;
    }

    /**
     * A clock that reads this service's current time.
     */
    public Clock clock() {
        return new Clock() {
            @Override
            public ZoneId getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                return now();
            }
        };
    }

    private static final class Entry {
        private final Instant deadline;
        private final long order;
        private final Runnable task;

        private Entry(Instant deadline, long order, Runnable task) {
            this.deadline = deadline;
            this.order = order;
            this.task = task;
        }
    }
}
