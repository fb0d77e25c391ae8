package tech.scytalesystems.tiered_cache_starter.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.scytalesystems.tiered_cache_starter.config.JacksonConfig;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1412h
 * <p>
 * JSON helpers for invalidation messages. Failures are logged and reported as null so a bad
 * message never breaks the listener thread.
 */
public final class JsonUtil {
    private static final Logger log = LoggerFactory.getLogger(JsonUtil.class);
    private static final ObjectMapper MAPPER = new JacksonConfig().objectMapper();

    private JsonUtil() {
    }

    /**
     * @return the JSON string, or null if serialization fails
     */
    public static String toJson(Object o) {
        try {
            return MAPPER.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize object to JSON: {}", o, e);

            return null;
        }
    }

    /**
     * @return the deserialized object, or null if the input is null or not valid JSON for {@code clazz}
     */
    public static <T> T fromJson(String json, Class<T> clazz) {
        if (json == null) return null;

        try {
            return MAPPER.readValue(json, clazz);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize JSON to {}: {}", clazz.getSimpleName(), json, e);

            return null;
        }
    }
}
