package fr.lapetina.gateway.provider.infrastructure.scheduling;

import fr.lapetina.gateway.provider.domain.exception.ProviderException;
import fr.lapetina.gateway.provider.engine.ReloadCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Triggers a full reload at a fixed delay.
 *
 * A failed reload is logged and left to the next tick; the previous index
 * keeps serving in between.
 */
public final class PeriodicReloadScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PeriodicReloadScheduler.class);

    private final ReloadCoordinator reloadCoordinator;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    public PeriodicReloadScheduler(ReloadCoordinator reloadCoordinator, Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Reload interval must be positive: " + interval);
        }
        this.reloadCoordinator = reloadCoordinator;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "periodic-reload");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::reloadOnce, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Periodic reload enabled every {}ms", millis);
    }

    void reloadOnce() {
        try {
            reloadCoordinator.reload();
        } catch (ProviderException e) {
            log.warn("Periodic reload failed, retrying in {}ms: {}", interval.toMillis(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error during periodic reload", e);
        }
    }

    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
