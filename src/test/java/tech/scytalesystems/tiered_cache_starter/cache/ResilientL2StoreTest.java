package tech.scytalesystems.tiered_cache_starter.cache;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.scytalesystems.tiered_cache_starter.exception.CacheSerializationException;
import tech.scytalesystems.tiered_cache_starter.exception.StoreUnavailableException;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1625h
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ResilientL2Store Tests")
class ResilientL2StoreTest {

    @Mock
    private L2Store delegate;

    private ResilientL2Store store;

    private ResilientL2Store create(int maxRetries, Duration timeout) {
        store = new ResilientL2Store(delegate, maxRetries, Duration.ofMillis(1), timeout, 2);
        return store;
    }

    @AfterEach
    void tearDown() {
        if (store != null) store.close();
    }

    @Test
    @DisplayName("Should pass results through")
    void testDelegates() {
        when(delegate.get("k")).thenReturn(Optional.of("v"));
        when(delegate.keysWithTag("t")).thenReturn(Set.of("k"));

        create(2, Duration.ofSeconds(1));

        assertEquals(Optional.of("v"), store.get("k"));
        assertEquals(Set.of("k"), store.keysWithTag("t"));
    }

    @Test
    @DisplayName("Should retry transient failures")
    void testRetriesThenSucceeds() {
        when(delegate.get("k"))
                .thenThrow(new StoreUnavailableException("blip"))
                .thenReturn(Optional.of("v"));

        create(2, Duration.ofSeconds(1));

        assertEquals(Optional.of("v"), store.get("k"));
        verify(delegate, times(2)).get("k");
    }

    @Test
    @DisplayName("Should give up after max retries")
    void testExhaustsRetries() {
        doThrow(new StoreUnavailableException("down")).when(delegate).delete("k");

        create(2, Duration.ofSeconds(1));

        assertThrows(StoreUnavailableException.class, () -> store.delete("k"));
        verify(delegate, times(3)).delete("k");
    }

    @Test
    @DisplayName("Should not retry serialization failures")
    void testSerializationNotRetried() {
        when(delegate.get("k")).thenThrow(new CacheSerializationException("bad", new RuntimeException()));

        create(2, Duration.ofSeconds(1));

        assertThrows(CacheSerializationException.class, () -> store.get("k"));
        verify(delegate, times(1)).get("k");
    }

    @Test
    @DisplayName("Should fail an attempt that overruns the timeout")
    void testTimeout() {
        when(delegate.get("slow")).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return Optional.of("late");
        });

        create(0, Duration.ofMillis(50));

        long start = System.nanoTime();
        StoreUnavailableException e = assertThrows(StoreUnavailableException.class, () -> store.get("slow"));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertTrue(e.getMessage().contains("timed out"));
        assertTrue(elapsedMs < 1_500, "call should return at the timeout, took " + elapsedMs + "ms");
    }

    @Test
    @DisplayName("Should wrap unexpected exceptions")
    void testUnexpectedException() {
        when(delegate.keysWithTag("t")).thenThrow(new IllegalStateException("boom"));

        create(2, Duration.ofSeconds(1));

        assertThrows(StoreUnavailableException.class, () -> store.keysWithTag("t"));
        verify(delegate, times(1)).keysWithTag("t");
    }
}
