package tech.scytalesystems.tiered_cache_starter.warmup;

import java.util.List;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1345h
 * <p>What a warmup run did with each key.
 *
 * @param loaded  keys whose loader ran and whose value was cached
 * @param skipped keys already cached, loader not called
 * @param failed  keys whose loader threw or returned null
 */
public record WarmupReport(List<String> loaded, List<String> skipped, List<String> failed) {
    public WarmupReport {
        loaded = List.copyOf(loaded);
        skipped = List.copyOf(skipped);
        failed = List.copyOf(failed);
    }

    public int total() {
        return loaded.size() + skipped.size() + failed.size();
    }
}
