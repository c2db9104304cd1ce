package shorted.core.model.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import shorted.core.model.identity.Identity;

@DisplayName("RouteClass")
class RouteClassTest {

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("rejects a non-positive anonymous limit")
        void rejectsZeroAnonymousLimit() {
            assertThrows(IllegalArgumentException.class, () -> new RouteClass("api", 0, 500, 60));
        }

        @Test
        @DisplayName("rejects a non-positive authenticated limit")
        void rejectsNegativeAuthenticatedLimit() {
            assertThrows(IllegalArgumentException.class, () -> new RouteClass("api", 50, -1, 60));
        }

        @Test
        @DisplayName("rejects a non-positive window")
        void rejectsZeroWindow() {
            assertThrows(IllegalArgumentException.class, () -> new RouteClass("api", 50, 500, 0));
        }

        @Test
        @DisplayName("rejects a blank name")
        void rejectsBlankName() {
            assertThrows(IllegalArgumentException.class, () -> new RouteClass(" ", 50, 500, 60));
        }
    }

    @Test
    @DisplayName("picks the limit that matches the caller's kind")
    void limitForIdentity() {
        var routeClass = new RouteClass("api", 50, 500, 60);

        assertEquals(50, routeClass.limitFor(Identity.anonymous("1.2.3.4")));
        assertEquals(500, routeClass.limitFor(Identity.authenticated("user-1")));
    }
}
