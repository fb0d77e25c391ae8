package tech.scytalesystems.tiered_cache_starter.invalidation;

import java.util.List;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1310h
 * <p>Single hook an external event source calls when domain data changes,
 * e.g. "product 42 updated" → {@code handle(List.of("product:42", "product-list"))}.
 * <p>The cache does not subscribe to any bus itself; queue consumers, event listeners or plain
 * service code wire themselves to this interface.
 */
@FunctionalInterface
public interface InvalidationHandler {
    InvalidationResult handle(List<String> tags);
}
