package tech.scytalesystems.tiered_cache_starter.sync;

import java.util.Collection;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1230h
 * <p>Tells other application instances to drop keys from their own L1.
 * <p>L2 is shared, so the instance performing a delete already fixed it; what every other
 * instance still holds is a stale L1 copy.
 */
public interface RemoteInvalidationPublisher {
    RemoteInvalidationPublisher NO_OP = new RemoteInvalidationPublisher() {
        @Override
        public void publishEviction(Collection<String> keys) {
        }

        @Override
        public void publishClear() {
        }
    };

    void publishEviction(Collection<String> keys);

    void publishClear();
}
