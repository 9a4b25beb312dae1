package net.findmyaisle.support.cache;

import net.findmyaisle.exception.CacheOperationException;
import net.findmyaisle.util.CompressionUtils;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Converts cache values to gzip-compressed JSON and back.
 */
@Component
public class JsonPayloadCodec {

    private final ObjectMapper objectMapper;

    public JsonPayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(String key, Object value) {
        try {
            return CompressionUtils.gzipUtf8(objectMapper.writeValueAsString(value));
        } catch (JacksonException | IOException ex) {
            throw new CacheOperationException(key, "encode", ex);
        }
    }

    public <T> T decode(String key, byte[] payload, Class<T> type) {
        try {
            String json = CompressionUtils.decodeUtf8ExpectingGzip(payload);
            if (json == null) {
                throw new CacheOperationException(key, "decode", new IOException("empty payload"));
            }
            return objectMapper.readValue(json, type);
        } catch (JacksonException | IOException ex) {
            throw new CacheOperationException(key, "decode", ex);
        }
    }
}
