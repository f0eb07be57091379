package de.bsommerfeld.feedupdate.api;

import de.bsommerfeld.feedupdate.core.config.UpdaterConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UpdateSchedulerTest {

    @Mock
    private FeedUpdater updater;

    @Test
    void start_shouldRunChecksPeriodically() {
        when(updater.checkInBackground()).thenReturn(CompletableFuture.completedFuture(CheckState.IDLE));

        try (var scheduler = new UpdateScheduler(updater, 0, 1)) {
            assertTrue(scheduler.start());
            verify(updater, timeout(3500).atLeast(2)).checkInBackground();
        }
    }

    @Test
    void start_shouldKeepSchedulingAfterFailingTick() {
        when(updater.checkInBackground()).thenThrow(new IllegalStateException("executor gone"));

        try (var scheduler = new UpdateScheduler(updater, 0, 1)) {
            scheduler.start();
            verify(updater, timeout(3500).atLeast(2)).checkInBackground();
        }
    }

    @Test
    void start_shouldDoNothingWhenIntervalIsZero() throws InterruptedException {
        var config = new UpdaterConfig();
        config.setCheckIntervalMinutes(0);
        config.setInitialDelaySeconds(0);

        try (var scheduler = new UpdateScheduler(updater, config)) {
            assertFalse(scheduler.start());
            Thread.sleep(200);
        }
        verifyNoInteractions(updater);
    }

    @Test
    void start_shouldBeIdempotent() {
        try (var scheduler = new UpdateScheduler(updater, 3600, 3600)) {
            assertTrue(scheduler.start());
            assertTrue(scheduler.start());
        }
        verifyNoInteractions(updater);
    }
}
