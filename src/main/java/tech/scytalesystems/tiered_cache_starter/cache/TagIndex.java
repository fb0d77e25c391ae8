package tech.scytalesystems.tiered_cache_starter.cache;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 0930h
 * <p>Secondary index tag → keys for the L1 tier.
 * <p>Not thread-safe. {@link L1Store} only touches it while holding its own lock, in the same
 * critical section as the entry mutation, so index and entries never diverge inside L1.
 */
public class TagIndex {
    private final Map<String, Set<String>> keysByTag = new HashMap<>();

    public void add(String key, Set<String> tags) {
        for (String tag : tags) {
            keysByTag.computeIfAbsent(tag, t -> new LinkedHashSet<>()).add(key);
        }
    }

    public void remove(String key, Set<String> tags) {
        for (String tag : tags) {
            Set<String> keys = keysByTag.get(tag);
            if (keys == null) continue;

            keys.remove(key);
            if (keys.isEmpty()) keysByTag.remove(tag);
        }
    }

    /**
     * @return a copy of the keys currently indexed under {@code tag}, empty if none
     */
    public Set<String> keysWithTag(String tag) {
        Set<String> keys = keysByTag.get(tag);

        return keys == null ? Set.of() : Set.copyOf(keys);
    }

    public int tagCount() {
        return keysByTag.size();
    }

    public void clear() {
        keysByTag.clear();
    }
}
