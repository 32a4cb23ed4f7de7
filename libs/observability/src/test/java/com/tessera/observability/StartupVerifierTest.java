package com.tessera.observability;

import com.tessera.observability.testing.StubDependencyCheck;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StartupVerifier")
class StartupVerifierTest {

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("should reject non-positive timeout")
        void shouldRejectBadTimeout() {
            assertThatThrownBy(() -> new StartupVerifier(0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should reject blank names and null checks")
        void shouldRejectBadRegistrations() {
            var verifier = new StartupVerifier();

            assertThatThrownBy(() -> verifier.require(" ", StubDependencyCheck.up("x")))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> verifier.optional("x", null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Verification")
    class Verification {

        @Test
        @DisplayName("passes when every required dependency is available")
        void passesWhenAvailable() {
            var secrets = StubDependencyCheck.up("secret-store");
            var verifier = new StartupVerifier().require("secret-store", secrets);

            List<DependencyStatus> results = verifier.verify();

            assertThat(results).singleElement().extracting(DependencyStatus::available).isEqualTo(true);
            assertThat(secrets.probeCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("fails fast when a required dependency is unavailable")
        void failsWhenRequiredUnavailable() {
            var verifier = new StartupVerifier()
                    .require("secret-store", StubDependencyCheck.down("secret-store", "connection refused"));

            assertThatThrownBy(verifier::verify)
                    .isInstanceOf(StartupVerificationException.class)
                    .hasMessageContaining("secret-store")
                    .hasMessageContaining("connection refused");
        }

        @Test
        @DisplayName("only warns when an optional dependency is unavailable")
        void toleratesOptionalFailure() {
            var verifier = new StartupVerifier()
                    .optional("relationship-store", StubDependencyCheck.down("relationship-store", "no route"));

            assertThatCode(verifier::verify).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("treats a throwing probe as unavailable")
        void throwingProbeIsUnavailable() {
            var verifier = new StartupVerifier().require("identity-provider", () -> {
                throw new IllegalStateException("dns failure");
            });

            assertThatThrownBy(verifier::verify)
                    .isInstanceOfSatisfying(StartupVerificationException.class, e ->
                            assertThat(e.failures()).singleElement()
                                    .extracting(DependencyStatus::detail).asString().contains("dns failure"));
        }

        @Test
        @DisplayName("treats a probe that never answers as unavailable after the timeout")
        void timesOut() {
            var verifier = new StartupVerifier(50).require("secret-store", CompletableFuture::new);

            assertThatThrownBy(verifier::verify).isInstanceOf(StartupVerificationException.class);
        }
    }
}
