package io.tryjob4j.config;

import io.tryjob4j.TryScheduler;
import org.springframework.context.SmartLifecycle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bridges try scheduler start/stop with the Spring container lifecycle.
 */
public class TrySchedulerLifecycle implements SmartLifecycle {
    private final List<TryScheduler> schedulers;
    private volatile boolean running = false;

    public TrySchedulerLifecycle(List<TryScheduler> schedulers) {
        this.schedulers = List.copyOf(schedulers);
    }

    @Override
    public void start() {
        for (TryScheduler s : schedulers) {
            s.start();
        }
        running = true;
    }

    @Override
    public void stop() {
        List<TryScheduler> reversed = new ArrayList<>(schedulers);
        Collections.reverse(reversed);
        for (TryScheduler s : reversed) {
            s.stop();
        }
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    public List<TryScheduler> getSchedulers() {
        return schedulers;
    }
}
