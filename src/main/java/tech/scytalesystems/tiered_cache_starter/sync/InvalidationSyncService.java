package tech.scytalesystems.tiered_cache_starter.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.adapter.MessageListenerAdapter;
import tech.scytalesystems.tiered_cache_starter.cache.L1Store;
import tech.scytalesystems.tiered_cache_starter.cache.TieredCacheCoordinator;
import tech.scytalesystems.tiered_cache_starter.config.TieredCacheProperties;
import tech.scytalesystems.tiered_cache_starter.dto.InvalidationAction;
import tech.scytalesystems.tiered_cache_starter.dto.InvalidationMessage;
import tech.scytalesystems.tiered_cache_starter.util.CompressionUtil;
import tech.scytalesystems.tiered_cache_starter.util.JsonUtil;

import java.util.Collection;
import java.util.UUID;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1420h
 * Publishes and receives L1 invalidation messages via Redis Pub/Sub.
 *
 * <p>Each application instance has its own L1 in front of the shared L2. When an instance deletes a key
 * (directly, or through a tag invalidation) it fixes L2 itself and then publishes the key; every other
 * instance drops the key from its L1 only.
 *
 * <p>Loop prevention: every message carries the sender's instance id, and a receiver ignores its own.
 * Remote processing only touches L1 and never publishes.
 *
 * <p>Pub/Sub is fire-and-forget: an instance that is disconnected when a message goes out keeps its stale
 * L1 copy until the entry's L1 TTL runs out.
 */
public class InvalidationSyncService implements RemoteInvalidationPublisher {
    private static final Logger log = LoggerFactory.getLogger(InvalidationSyncService.class);

    private final StringRedisTemplate redisTemplate;
    private final TieredCacheCoordinator coordinator;
    private final TieredCacheProperties.Sync props;
    private final String channelName;
    private final String instanceId;

    public InvalidationSyncService(StringRedisTemplate redisTemplate,
                                   TieredCacheCoordinator coordinator,
                                   RedisMessageListenerContainer container,
                                   TieredCacheProperties.Sync props) {
        this.redisTemplate = redisTemplate;
        this.coordinator = coordinator;
        this.props = props;
        this.instanceId = UUID.randomUUID().toString();
        this.channelName = buildChannelName(props);

        MessageListenerAdapter adapter = new MessageListenerAdapter(this, "onMessage");
        container.addMessageListener(adapter, new ChannelTopic(channelName));

        log.info("InvalidationSyncService initialized - instanceId: {}, channel: {}, compression: {}",
                instanceId, channelName, props.isCompressMessages());
    }

    /**
     * "prod:" + "tiered-cache-invalidation" → "prod:tiered-cache-invalidation"
     */
    private static String buildChannelName(TieredCacheProperties.Sync props) {
        String prefix = props.getChannelPrefix();
        String channel = props.getChannel();

        if (prefix != null && !prefix.isBlank()) return prefix + channel;

        return channel;
    }

    @Override
    public void publishEviction(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) return;

        publish(InvalidationMessage.evict(keys));
    }

    @Override
    public void publishClear() {
        publish(InvalidationMessage.clear());
    }

    /**
     * Stamps the message with this instance's id and sends it. Failures are logged and swallowed:
     * the local invalidation has already happened and must not be reported as failed.
     */
    public void publish(InvalidationMessage msg) {
        try {
            msg.setInstanceId(instanceId);

            String json = JsonUtil.toJson(msg);
            if (json == null) return;

            if (props.isCompressMessages()) json = CompressionUtil.compress(json);

            redisTemplate.convertAndSend(channelName, json);

            log.debug("Published invalidation: action={}, keyCount={}, compressed={}",
                    msg.getAction(), msg.getKeys().size(), props.isCompressMessages());
        } catch (Exception e) {
            log.warn("Failed to publish invalidation: action={}, keyCount={}, error={}",
                    msg.getAction(), msg.getKeys().size(), e.getMessage(), e);
        }
    }

    /**
     * Invoked by {@link MessageListenerAdapter} for every message on the channel.
     *
     * @param message JSON payload, Base64 GZIP when compression is on
     * @param pattern channel name, unused
     */
    @SuppressWarnings("unused")
    public void onMessage(String message, String pattern) {
        try {
            String payload = props.isCompressMessages() ? CompressionUtil.decompress(message) : message;

            InvalidationMessage msg = JsonUtil.fromJson(payload, InvalidationMessage.class);
            if (msg == null || msg.getAction() == null) {
                log.warn("Dropping unreadable invalidation message on channel {}", channelName);
                return;
            }

            if (instanceId.equals(msg.getInstanceId())) {
                log.trace("Ignoring self-published message: instanceId={}", instanceId);
                return;
            }

            processMessage(msg);
        } catch (Exception e) {
            log.error("Error processing invalidation message: {}", e.getMessage(), e);
        }
    }

    /**
     * L1 only: the sender already updated the shared L2.
     */
    private void processMessage(InvalidationMessage msg) {
        if (msg.getAction() == InvalidationAction.CLEAR) {
            coordinator.clearLocal();
            log.debug("Cleared L1 on remote request from {}", shortId(msg.getInstanceId()));
            return;
        }

        L1Store l1 = coordinator.getL1Store();
        int evicted = 0;
        for (String key : msg.getKeys()) {
            if (l1.delete(key)) evicted++;
        }

        log.debug("Processed remote eviction: keyCount={}, evicted={}, fromInstance={}",
                msg.getKeys().size(), evicted, shortId(msg.getInstanceId()));
    }

    private static String shortId(String id) {
        return id == null ? "unknown" : id.substring(0, Math.min(8, id.length())) + "...";
    }

    public String getInstanceId() {
        return instanceId;
    }

    public String getChannelName() {
        return channelName;
    }
}
