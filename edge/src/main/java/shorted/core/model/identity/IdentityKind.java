package shorted.core.model.identity;

/**
 * How a caller was attributed for rate limiting.
 */
public enum IdentityKind {
    /** No verified session; attributed by network address. */
    ANONYMOUS("ip"),

    /** Verified session; attributed by user id. */
    AUTHENTICATED("user");

    private final String segmentPrefix;

    IdentityKind(String segmentPrefix) {
        this.segmentPrefix = segmentPrefix;
    }

    /**
     * Prefix used when this kind of identity appears in a store key.
     *
     * @return "ip" or "user"
     */
    public String segmentPrefix() {
        return segmentPrefix;
    }
}
