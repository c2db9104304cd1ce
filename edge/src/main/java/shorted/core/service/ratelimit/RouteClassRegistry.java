package shorted.core.service.ratelimit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import shorted.core.config.RateLimitingConfig;
import shorted.core.model.ratelimit.RouteClass;

/**
 * Maps request paths to route classes.
 *
 * <p>Built once from configuration. Invalid route classes (non-positive limits or
 * window) fail startup. When several configured prefixes match a path, the
 * longest one wins.
 */
@ApplicationScoped
public class RouteClassRegistry {

    private static final Logger LOG = Logger.getLogger(RouteClassRegistry.class);

    private final List<PathBinding> bindings;

    @Inject
    public RouteClassRegistry(RateLimitingConfig config) {
        final var paths = new ArrayList<PathBinding>();
        config.routes().forEach((name, route) -> {
            final var routeClass = new RouteClass(
                    name, route.anonymousLimit(), route.authenticatedLimit(), route.windowSeconds());
            for (final var prefix : route.paths()) {
                paths.add(new PathBinding(normalize(prefix), routeClass));
            }
            LOG.infov(
                    "Route class {0}: anonymous={1}, authenticated={2} per {3}s on {4}",
                    name,
                    route.anonymousLimit(),
                    route.authenticatedLimit(),
                    route.windowSeconds(),
                    route.paths());
        });
        paths.sort(Comparator.comparingInt((PathBinding b) -> b.prefix().length()).reversed());
        this.bindings = List.copyOf(paths);
    }

    /**
     * Find the route class protecting a path.
     *
     * @param path the request path
     * @return the route class, or empty if the path is not rate limited
     */
    public Optional<RouteClass> forPath(String path) {
        if (path == null) {
            return Optional.empty();
        }
        final var normalized = normalize(path);
        for (final var binding : bindings) {
            if (binding.matches(normalized)) {
                return Optional.of(binding.routeClass());
            }
        }
        return Optional.empty();
    }

    private static String normalize(String path) {
        var result = path.startsWith("/") ? path : "/" + path;
        while (result.length() > 1 && result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private record PathBinding(String prefix, RouteClass routeClass) {

        boolean matches(String path) {
            if ("/".equals(prefix)) {
                return true;
            }
            return path.equals(prefix) || path.startsWith(prefix + "/");
        }
    }
}
