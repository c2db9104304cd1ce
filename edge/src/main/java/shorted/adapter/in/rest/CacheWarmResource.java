package shorted.adapter.in.rest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import shorted.adapter.in.dto.WarmCacheResponse;
import shorted.adapter.in.problem.EdgeProblem;
import shorted.core.config.CacheConfig;
import shorted.core.port.in.CacheWarming;

/**
 * Warms the homepage and about-page cache entries.
 *
 * <p>Meant to be hit by an external scheduler. When {@code shorted.cache.warm.secret}
 * is set, the caller must pass it as the {@code secret} query parameter.
 */
@Path("/api/homepage/warm-cache")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class CacheWarmResource {

    private static final Logger LOG = Logger.getLogger(CacheWarmResource.class);

    private final CacheWarming cacheWarming;
    private final CacheConfig cacheConfig;

    @Inject
    public CacheWarmResource(CacheWarming cacheWarming, CacheConfig cacheConfig) {
        this.cacheWarming = cacheWarming;
        this.cacheConfig = cacheConfig;
    }

    @GET
    public Uni<WarmCacheResponse> warmOnGet(@QueryParam("secret") String secret) {
        return warm(secret);
    }

    @POST
    public Uni<WarmCacheResponse> warmOnPost(@QueryParam("secret") String secret) {
        return warm(secret);
    }

    private Uni<WarmCacheResponse> warm(String secret) {
        if (!authorized(secret)) {
            LOG.warn("Rejected cache warm request with missing or wrong secret");
            throw EdgeProblem.unauthorized("A valid secret is required to warm the cache");
        }
        return cacheWarming.warmDefaults().map(WarmCacheResponse::fromModel);
    }

    private boolean authorized(String supplied) {
        final var expected = cacheConfig.warm().secret();
        if (expected.isEmpty()) {
            return true;
        }
        if (supplied == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.get().getBytes(StandardCharsets.UTF_8), supplied.getBytes(StandardCharsets.UTF_8));
    }
}
