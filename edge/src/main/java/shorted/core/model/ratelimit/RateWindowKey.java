package shorted.core.model.ratelimit;

import shorted.core.model.identity.Identity;

/**
 * Store key of a single rate window counter.
 *
 * <p>Format: {@code ratelimit:{routeClass}:{identitySegment}:{bucket}}. The store
 * adapter adds the deployment-wide key prefix.
 *
 * @param routeClass the route class name
 * @param identity the caller
 * @param bucket the window index, {@code floor(nowSeconds / windowSeconds)}
 */
public record RateWindowKey(String routeClass, Identity identity, long bucket) {

    private static final String PREFIX = "ratelimit";

    /**
     * Compute the window index containing the given instant.
     *
     * @param epochMillis the instant in epoch milliseconds
     * @param windowSeconds the window length
     * @return the bucket index
     */
    public static long bucketOf(long epochMillis, long windowSeconds) {
        return Math.floorDiv(epochMillis, windowSeconds * 1000L);
    }

    public RateWindowKey previous() {
        return new RateWindowKey(routeClass, identity, bucket - 1);
    }

    public String toKey() {
        return PREFIX + ":" + routeClass + ":" + identity.toKeySegment() + ":" + bucket;
    }

    @Override
    public String toString() {
        return toKey();
    }
}
