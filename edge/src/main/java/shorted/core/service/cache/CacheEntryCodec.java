package shorted.core.service.cache;

import java.time.Instant;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import shorted.core.model.cache.CacheEntry;

/**
 * JSON envelope of a stored cache entry.
 *
 * <p>Stored form: {@code {"key":..,"payload":"<json>","freshUntil":<epochMillis>,"staleUntil":<epochMillis>}}.
 * Anything that does not parse as such an envelope reads as absent.
 */
final class CacheEntryCodec {

    private static final Logger LOG = Logger.getLogger(CacheEntryCodec.class);

    private final ObjectMapper objectMapper;

    CacheEntryCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    String encode(CacheEntry entry) {
        final var envelope = objectMapper.createObjectNode();
        envelope.put("key", entry.key());
        envelope.put("payload", entry.payload());
        envelope.put("freshUntil", entry.freshUntil().toEpochMilli());
        envelope.put("staleUntil", entry.staleUntil().toEpochMilli());
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode cache entry " + entry.key(), e);
        }
    }

    Optional<CacheEntry> decode(String key, String stored) {
        try {
            final var node = objectMapper.readTree(stored);
            final var payload = node.get("payload");
            final var freshUntil = node.get("freshUntil");
            final var staleUntil = node.get("staleUntil");
            if (payload == null || !payload.isTextual() || freshUntil == null || staleUntil == null) {
                LOG.debugf("Ignoring malformed cache entry for %s", key);
                return Optional.empty();
            }
            return Optional.of(new CacheEntry(
                    key,
                    payload.asText(),
                    Instant.ofEpochMilli(freshUntil.asLong()),
                    Instant.ofEpochMilli(staleUntil.asLong())));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.debugf("Ignoring unreadable cache entry for %s: %s", key, e.getMessage());
            return Optional.empty();
        }
    }
}
