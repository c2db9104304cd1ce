package shorted.core.service.cache;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import shorted.core.config.CacheConfig;
import shorted.core.model.cache.CachePolicy;

/**
 * Named freshness policies, resolved once from configuration.
 */
@ApplicationScoped
public class CachePolicies {

    public static final String HOMEPAGE = "homepage";
    public static final String ABOUT = "about";
    public static final String TOOLTIP = "tooltip";
    public static final String SEARCH = "search";

    static final CachePolicy DEFAULT = CachePolicy.of(Duration.ofMinutes(5), 10, Duration.ofSeconds(10));

    private final Map<String, CachePolicy> policies;

    @Inject
    public CachePolicies(CacheConfig config) {
        this(toPolicies(config.policies()));
    }

    CachePolicies(Map<String, CachePolicy> policies) {
        this.policies = Map.copyOf(policies);
    }

    /**
     * Look up a policy by name.
     *
     * @param name the policy name
     * @return the policy, or the default policy for unknown names
     */
    public CachePolicy named(String name) {
        return policies.getOrDefault(name, DEFAULT);
    }

    public CachePolicy homepage() {
        return named(HOMEPAGE);
    }

    public CachePolicy about() {
        return named(ABOUT);
    }

    public CachePolicy tooltip() {
        return named(TOOLTIP);
    }

    public CachePolicy search() {
        return named(SEARCH);
    }

    private static Map<String, CachePolicy> toPolicies(Map<String, CacheConfig.PolicyConfig> configured) {
        final var result = new HashMap<String, CachePolicy>();
        configured.forEach((name, policy) -> result.put(
                name, CachePolicy.of(policy.ttlFresh(), policy.staleMultiplier(), policy.producerTimeout())));
        return result;
    }
}
