package de.bsommerfeld.feedupdate.api;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Singleton;
import de.bsommerfeld.feedupdate.core.config.UpdaterConfig;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs background checks on a fixed schedule: once after the configured
 * initial delay, then every {@code check-interval-minutes}. An interval of
 * 0 disables scheduled checks.
 *
 * <p>
 * Ticks that fall into a still running cycle are dropped by the updater's
 * own single-flight guard.
 */
@Singleton
public class UpdateScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(UpdateScheduler.class);

    private final FeedUpdater updater;
    private final long initialDelaySeconds;
    private final long intervalSeconds;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("feedupdate-scheduler-%d").setDaemon(true).build());

    private boolean started;

    @Inject
    public UpdateScheduler(FeedUpdater updater, UpdaterConfig config) {
        this(updater, config.getInitialDelaySeconds(), TimeUnit.MINUTES.toSeconds(config.getCheckIntervalMinutes()));
    }

    UpdateScheduler(FeedUpdater updater, long initialDelaySeconds, long intervalSeconds) {
        this.updater = updater;
        this.initialDelaySeconds = initialDelaySeconds;
        this.intervalSeconds = intervalSeconds;
    }

    /**
     * Starts the schedule. Calling it again has no effect.
     *
     * @return {@code true} if periodic checks are now scheduled
     */
    public synchronized boolean start() {
        if (started)
            return true;
        if (intervalSeconds <= 0) {
            LOG.info("Scheduled update checks are disabled");
            return false;
        }
        started = true;
        LOG.info("Checking for updates every {} minutes", TimeUnit.SECONDS.toMinutes(intervalSeconds));
        scheduler.scheduleAtFixedRate(this::tick, initialDelaySeconds, intervalSeconds, TimeUnit.SECONDS);
        return true;
    }

    private void tick() {
        try {
            updater.checkInBackground();
        } catch (RuntimeException e) {
            // an escaping exception would cancel all future runs
            LOG.error("Scheduled update check failed to start", e);
        }
    }

    @Override
    public synchronized void close() {
        scheduler.shutdownNow();
    }
}
