package shorted.core.service.identity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import shorted.core.config.IdentityConfig;
import shorted.core.model.identity.InboundRequest;
import shorted.core.port.out.SessionVerifier;

@DisplayName("IdentityClassifier")
class IdentityClassifierTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private SessionVerifier verifier;
    private IdentityClassifier classifier;

    @BeforeEach
    void setUp() {
        verifier = mock(SessionVerifier.class);
        var session = mock(IdentityConfig.SessionConfig.class);
        when(session.timeout()).thenReturn(Duration.ofMillis(200));
        var config = mock(IdentityConfig.class);
        when(config.session()).thenReturn(session);
        var resolver = new ClientAddressResolver(new TrustedProxyValidator(TrustedProxyValidatorTest.proxies(false)));
        classifier = new IdentityClassifier(verifier, resolver, config);
    }

    @Test
    @DisplayName("a verified session yields the user id")
    void authenticated() {
        when(verifier.verify("good")).thenReturn(Uni.createFrom().item(Optional.of("user-42")));

        var identity = classifier.classify(InboundRequest.direct("10.0.0.1").withSessionToken("good"))
                .await()
                .atMost(TIMEOUT);

        assertTrue(identity.isAuthenticated());
        assertEquals("user-42", identity.key());
    }

    @Test
    @DisplayName("no session token means anonymous without calling the verifier")
    void noToken() {
        var identity = classifier.classify(InboundRequest.direct("10.0.0.1").withForwardedFor("203.0.113.4"))
                .await()
                .atMost(TIMEOUT);

        assertFalse(identity.isAuthenticated());
        assertEquals("203.0.113.4", identity.key());
        verifyNoInteractions(verifier);
    }

    @Test
    @DisplayName("an invalid session falls back to the client address")
    void invalidSession() {
        when(verifier.verify("bad")).thenReturn(Uni.createFrom().item(Optional.empty()));

        var identity = classifier.classify(InboundRequest.direct("10.0.0.1").withSessionToken("bad"))
                .await()
                .atMost(TIMEOUT);

        assertFalse(identity.isAuthenticated());
        assertEquals("10.0.0.1", identity.key());
    }

    @Test
    @DisplayName("verifier errors are recovered as anonymous")
    void verifierError() {
        when(verifier.verify(anyString())).thenReturn(Uni.createFrom().failure(new IllegalStateException("boom")));

        var identity = classifier.classify(InboundRequest.direct(null).withSessionToken("x"))
                .await()
                .atMost(TIMEOUT);

        assertEquals("ip:unknown", identity.toKeySegment());
    }

    @Test
    @DisplayName("a verifier that hangs is cut off by the timeout")
    void verifierTimeout() {
        when(verifier.verify(anyString())).thenReturn(Uni.createFrom().nothing());

        var identity = classifier.classify(InboundRequest.direct("10.0.0.1").withSessionToken("slow"))
                .await()
                .atMost(TIMEOUT);

        assertFalse(identity.isAuthenticated());
        verify(verifier).verify("slow");
    }
}
