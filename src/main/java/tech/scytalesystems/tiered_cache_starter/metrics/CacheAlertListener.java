package tech.scytalesystems.tiered_cache_starter.metrics;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1120h
 * <p>Receives threshold alerts. Declare an implementation as a Spring bean to have it
 * registered automatically.
 * <p>Called on the metrics thread; a listener that throws is logged and skipped.
 */
@FunctionalInterface
public interface CacheAlertListener {
    void onAlert(CacheAlert alert);
}
