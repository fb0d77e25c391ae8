package tech.scytalesystems.tiered_cache_starter.dto;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1402h
 * <p>Invalidation message sent via Redis Pub/Sub.
 * <p>Carries the keys other instances must drop from their L1, and the id of the sender so it can
 * recognise its own messages.
 */
@SuppressWarnings("unused")
public class InvalidationMessage {
    private List<String> keys;
    private InvalidationAction action;
    private String instanceId;

    // CONSTRUCTORS
    public InvalidationMessage() {
        this.keys = new ArrayList<>();
    }

    public InvalidationMessage(List<String> keys, InvalidationAction action, String instanceId) {
        this.keys = keys != null ? keys : new ArrayList<>();
        this.action = action;
        this.instanceId = instanceId;
    }

    public static InvalidationMessage evict(Collection<String> keys) {
        return builder().keys(new ArrayList<>(keys)).action(InvalidationAction.EVICT).build();
    }

    public static InvalidationMessage clear() {
        return builder().action(InvalidationAction.CLEAR).build();
    }

    // ========== BUILDER ==========

    public static InvalidationMessageBuilder builder() {
        return new InvalidationMessageBuilder();
    }

    public static class InvalidationMessageBuilder {
        private List<String> keys;
        private InvalidationAction action;
        private String instanceId;

        InvalidationMessageBuilder() {
            this.keys = new ArrayList<>();
        }

        public InvalidationMessageBuilder keys(List<String> keys) {
            this.keys = keys != null ? new ArrayList<>(keys) : new ArrayList<>();
            return this;
        }

        public InvalidationMessageBuilder keys(String... keys) {
            this.keys = keys != null ? new ArrayList<>(Arrays.asList(keys)) : new ArrayList<>();
            return this;
        }

        public InvalidationMessageBuilder addKey(String key) {
            this.keys.add(key);
            return this;
        }

        public InvalidationMessageBuilder action(InvalidationAction action) {
            this.action = action;
            return this;
        }

        public InvalidationMessageBuilder instanceId(String instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        public InvalidationMessage build() {
            return new InvalidationMessage(keys, action, instanceId);
        }
    }

    // GETTERS
    public List<String> getKeys() {
        return this.keys;
    }

    public InvalidationAction getAction() {
        return this.action;
    }

    public String getInstanceId() {
        return this.instanceId;
    }

    // SETTERS
    public void setKeys(List<String> keys) {
        this.keys = keys;
    }

    public void setAction(InvalidationAction action) {
        this.action = action;
    }

    public void setInstanceId(String instanceId) {
        this.instanceId = instanceId;
    }

    @Override
    public String toString() {
        return "InvalidationMessage{" +
                "keys=" + keys +
                ", action=" + action +
                ", instanceId='" + (instanceId != null ? instanceId.substring(0, Math.min(8, instanceId.length())) + "..." : "null") + '\'' +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        InvalidationMessage that = (InvalidationMessage) o;

        return Objects.equals(keys, that.keys)
                && action == that.action
                && Objects.equals(instanceId, that.instanceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keys, action, instanceId);
    }
}
