package tech.scytalesystems.tiered_cache_starter.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1750h
 */
@DisplayName("TieredCacheProperties Tests")
class TieredCachePropertiesTest {
    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @Test
    @DisplayName("Should have correct default values")
    void testDefaults() {
        TieredCacheProperties props = new TieredCacheProperties();

        assertTrue(props.isEnabled());

        assertEquals(1000, props.getL1().getMaxSize());
        assertEquals(300, props.getL1().getDefaultTtlSeconds());
        assertEquals(60, props.getL1().getSweepIntervalSeconds());

        assertEquals(1800, props.getL2().getDefaultTtlSeconds());
        assertEquals("cache:", props.getL2().getKeyPrefix());
        assertEquals(2, props.getL2().getMaxRetries());
        assertEquals(100, props.getL2().getRetryDelayMs());
        assertEquals(500, props.getL2().getTimeoutMs());
        assertEquals(16, props.getL2().getPoolSize());

        assertEquals(60, props.getMetrics().getCollectIntervalSeconds());
        assertEquals(1440, props.getMetrics().getWindowSize());
        assertEquals(0.70, props.getMetrics().getL1HitRateThreshold());
        assertEquals(100, props.getMetrics().getResponseTimeThresholdMs());

        assertEquals(10, props.getWarmup().getBatchSize());
        assertEquals(10, props.getWarmup().getParallelism());

        assertTrue(props.getSync().isEnabled());
        assertEquals("", props.getSync().getChannelPrefix());
        assertEquals("tiered-cache-invalidation", props.getSync().getChannel());
        assertFalse(props.getSync().isCompressMessages());
    }

    @Test
    @DisplayName("Should allow setting all properties")
    void testSetters() {
        TieredCacheProperties props = new TieredCacheProperties();

        props.setEnabled(false);
        props.getL1().setMaxSize(50);
        props.getL1().setDefaultTtlSeconds(30);
        props.getL2().setKeyPrefix("app:");
        props.getL2().setTimeoutMs(250);
        props.getMetrics().setL1HitRateThreshold(0.9);
        props.getWarmup().setBatchSize(25);
        props.getSync().setChannelPrefix("prod:");
        props.getSync().setChannel("custom-channel");
        props.getSync().setCompressMessages(true);

        assertFalse(props.isEnabled());
        assertEquals(50, props.getL1().getMaxSize());
        assertEquals(30, props.getL1().getDefaultTtlSeconds());
        assertEquals("app:", props.getL2().getKeyPrefix());
        assertEquals(250, props.getL2().getTimeoutMs());
        assertEquals(0.9, props.getMetrics().getL1HitRateThreshold());
        assertEquals(25, props.getWarmup().getBatchSize());
        assertEquals("prod:", props.getSync().getChannelPrefix());
        assertEquals("custom-channel", props.getSync().getChannel());
        assertTrue(props.getSync().isCompressMessages());
    }

    @Test
    @DisplayName("Should accept the defaults")
    void testDefaultsAreValid() {
        assertTrue(validator.validate(new TieredCacheProperties()).isEmpty());
    }

    @Test
    @DisplayName("Should reject out-of-range values in nested groups")
    void testValidation() {
        TieredCacheProperties props = new TieredCacheProperties();
        props.getL1().setMaxSize(0);
        props.getMetrics().setL1HitRateThreshold(1.5);
        props.getSync().setChannel(" ");

        Set<ConstraintViolation<TieredCacheProperties>> violations = validator.validate(props);

        assertEquals(3, violations.size());
        assertTrue(violations.stream().anyMatch(v -> v.getPropertyPath().toString().equals("l1.maxSize")));
        assertTrue(violations.stream().anyMatch(v -> v.getPropertyPath().toString().equals("metrics.l1HitRateThreshold")));
        assertTrue(violations.stream().anyMatch(v -> v.getPropertyPath().toString().equals("sync.channel")));
    }
}
