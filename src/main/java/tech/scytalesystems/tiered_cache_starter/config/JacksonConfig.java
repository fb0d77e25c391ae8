package tech.scytalesystems.tiered_cache_starter.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1410h
 * <p>Builds the {@link ObjectMapper} shared by the pub/sub messages, the L2 value serializer and
 * typed reads. Dates are written as ISO strings and unknown properties are ignored so that
 * instances on different versions can still read each other's messages.
 */
public class JacksonConfig {
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        return mapper;
    }
}
