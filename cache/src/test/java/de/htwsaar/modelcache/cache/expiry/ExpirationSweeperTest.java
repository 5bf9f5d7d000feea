package de.htwsaar.modelcache.cache.expiry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import de.htwsaar.modelcache.cache.EntryMetadata;
import de.htwsaar.modelcache.cache.MutableClock;
import de.htwsaar.modelcache.cache.error.StorageBackendException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExpirationSweeperTest {

    private static final Duration MAX_AGE = Duration.ofMillis(100);

    private static EntryMetadata meta(String id, long created) {
        return new EntryMetadata(id, 1, created, created, "", "00");
    }

    @Test
    void expiryIsStrictlyGreaterThanMaxAge() {
        assertFalse(ExpiryRule.isExpired(0, 99, MAX_AGE));
        assertFalse(ExpiryRule.isExpired(0, 100, MAX_AGE));
        assertTrue(ExpiryRule.isExpired(0, 101, MAX_AGE));
    }

    @Test
    void runOnceExpiresOnlyEntriesOlderThanMaxAge() {
        MutableClock clock = MutableClock.atEpochMillis(1_000);
        ExpirationSweeper.Target target = mock(ExpirationSweeper.Target.class);
        when(target.maxAge()).thenReturn(MAX_AGE);
        when(target.listEntries()).thenReturn(List.of(meta("old", 800), meta("fresh", 950)));
        when(target.expire(eq("old"), anyLong())).thenReturn(true);

        SweepResult result = new ExpirationSweeper(target, clock, Duration.ofHours(1)).runOnce();

        assertEquals(new SweepResult(2, 1, 0), result);
        verify(target).expire("old", 1_000);
        verify(target, never()).expire(eq("fresh"), anyLong());
        verify(target).reconcile();
    }

    @Test
    void alreadyRemovedEntryIsNotCountedAndNotAnError() {
        MutableClock clock = MutableClock.atEpochMillis(1_000);
        ExpirationSweeper.Target target = mock(ExpirationSweeper.Target.class);
        when(target.maxAge()).thenReturn(MAX_AGE);
        when(target.listEntries()).thenReturn(List.of(meta("gone", 0)));
        when(target.expire(eq("gone"), anyLong())).thenReturn(false);

        SweepResult result = new ExpirationSweeper(target, clock, Duration.ofHours(1)).runOnce();

        assertEquals(new SweepResult(1, 0, 0), result);
    }

    @Test
    void perEntryFailuresAreSkippedAndSuppressReconcile() {
        MutableClock clock = MutableClock.atEpochMillis(1_000);
        ExpirationSweeper.Target target = mock(ExpirationSweeper.Target.class);
        when(target.maxAge()).thenReturn(MAX_AGE);
        when(target.listEntries()).thenReturn(List.of(meta("broken", 0), meta("ok", 0)));
        when(target.expire(eq("broken"), anyLong())).thenThrow(new StorageBackendException("disk error"));
        when(target.expire(eq("ok"), anyLong())).thenReturn(true);

        SweepResult result = new ExpirationSweeper(target, clock, Duration.ofHours(1)).runOnce();

        assertEquals(new SweepResult(2, 1, 1), result);
        verify(target, never()).reconcile();
    }

    @Test
    void listingFailurePropagatesFromManualRun() {
        ExpirationSweeper.Target target = mock(ExpirationSweeper.Target.class);
        when(target.maxAge()).thenReturn(MAX_AGE);
        when(target.listEntries()).thenThrow(new StorageBackendException("offline"));

        ExpirationSweeper sweeper = new ExpirationSweeper(target, MutableClock.atEpochMillis(0), Duration.ofHours(1));

        assertThrows(StorageBackendException.class, sweeper::runOnce);
    }

    @Test
    void scheduledRunsSurviveFailuresAndStopOnClose() {
        ExpirationSweeper.Target target = mock(ExpirationSweeper.Target.class);
        when(target.maxAge()).thenReturn(MAX_AGE);
        when(target.listEntries())
                .thenThrow(new StorageBackendException("first run fails"))
                .thenReturn(List.of());

        ExpirationSweeper sweeper = new ExpirationSweeper(target, MutableClock.atEpochMillis(0), Duration.ofMillis(20));
        try {
            sweeper.start();
            assertTrue(sweeper.isRunning());
            // der zweite Lauf erreicht reconcile nur, wenn der Zeitplan den ersten Fehler überlebt hat
            verify(target, timeout(2_000).atLeastOnce()).reconcile();
        } finally {
            sweeper.close();
        }
        assertFalse(sweeper.isRunning());
    }

    @Test
    void rejectsNonPositiveInterval() {
        ExpirationSweeper.Target target = mock(ExpirationSweeper.Target.class);
        assertThrows(IllegalArgumentException.class,
                () -> new ExpirationSweeper(target, MutableClock.atEpochMillis(0), Duration.ZERO));
    }
}
