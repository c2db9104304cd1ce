package shorted.core.service.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import shorted.core.model.identity.Identity;
import shorted.core.model.identity.InboundRequest;
import shorted.core.model.ratelimit.RateLimitDecision;
import shorted.core.model.ratelimit.RouteClass;
import shorted.core.port.out.RateLimiter;
import shorted.core.service.identity.IdentityClassifier;

@DisplayName("AdmissionService")
class AdmissionServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private IdentityClassifier classifier;
    private RateLimiter limiter;
    private AdmissionService service;

    @BeforeEach
    void setUp() {
        classifier = mock(IdentityClassifier.class);
        limiter = mock(RateLimiter.class);
        when(limiter.isEnabled()).thenReturn(true);
        var registry = new RouteClassRegistry(
                RouteClassRegistryTest.config(Map.of("api", RouteClassRegistryTest.route(2, 4, 60, "/api/shorts"))));
        service = new AdmissionService(registry, classifier, limiter);
    }

    @Test
    @DisplayName("paths without a route class are not counted")
    void unprotectedPath() {
        var result = service.admit(InboundRequest.direct("10.0.0.1"), "/api/homepage/warm-cache")
                .await()
                .atMost(TIMEOUT);

        assertTrue(result.isEmpty());
        verifyNoInteractions(classifier);
    }

    @Test
    @DisplayName("a disabled limiter admits everything without classification")
    void disabledLimiter() {
        when(limiter.isEnabled()).thenReturn(false);

        var result = service.admit(InboundRequest.direct("10.0.0.1"), "/api/shorts/top")
                .await()
                .atMost(TIMEOUT);

        assertTrue(result.isEmpty());
        verifyNoInteractions(classifier);
    }

    @Test
    @DisplayName("classifies the caller and checks the matching route class")
    void checksLimit() {
        var caller = Identity.anonymous("10.0.0.1");
        var decision = RateLimitDecision.rejected(2, Instant.parse("2026-03-02T09:01:00Z"), 30, false);
        when(classifier.classify(any())).thenReturn(Uni.createFrom().item(caller));
        when(limiter.check(any(), any())).thenReturn(Uni.createFrom().item(decision));

        var admission = service.admit(InboundRequest.direct("10.0.0.1"), "/api/shorts/top")
                .await()
                .atMost(TIMEOUT)
                .orElseThrow();

        assertFalse(admission.allowed());
        assertEquals("api", admission.routeClass().name());
        assertEquals(caller, admission.identity());
        verify(limiter).check(caller, new RouteClass("api", 2, 4, 60));
    }
}
