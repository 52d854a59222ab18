package com.clientspaces.resilience;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("UpstreamErrorClassifier")
class UpstreamErrorClassifierTest {

    private final UpstreamErrorClassifier classifier = new UpstreamErrorClassifier();

    @Nested
    @DisplayName("HTTP status")
    class HttpStatus {

        @ParameterizedTest(name = "status {0} is transient")
        @ValueSource(ints = {408, 429, 500, 502, 503, 504, 505, 507, 599})
        void transientStatuses(int status) {
            assertThat(classifier.classify(new ExternalApiException(status, null)))
                    .isEqualTo(ErrorKind.TRANSIENT);
        }

        @ParameterizedTest(name = "status {0} is permanent")
        @ValueSource(ints = {400, 403, 404, 409, 422})
        void permanentStatuses(int status) {
            assertThat(classifier.classify(new ExternalApiException(status, "badRequest")))
                    .isEqualTo(ErrorKind.PERMANENT);
        }

        @Test
        @DisplayName("501 is not retried and not a client error")
        void notImplementedIsUnknown() {
            assertThat(classifier.classify(new ExternalApiException(501, null)))
                    .isEqualTo(ErrorKind.UNKNOWN);
        }

        @Test
        @DisplayName("3xx is unknown")
        void redirectIsUnknown() {
            assertThat(classifier.classify(new ExternalApiException(302, null)))
                    .isEqualTo(ErrorKind.UNKNOWN);
        }
    }

    @Nested
    @DisplayName("401 sub-codes")
    class Unauthorized {

        @ParameterizedTest(name = "\"{0}\" is transient")
        @ValueSource(strings = {"InvalidAuthenticationToken", "expired_token", "TokenExpired", "invalid-token"})
        void refreshableTokenIsTransient(String subCode) {
            assertThat(classifier.classify(new ExternalApiException(401, subCode)))
                    .isEqualTo(ErrorKind.TRANSIENT);
        }

        @Test
        @DisplayName("401 without token sub-code is permanent")
        void plainUnauthorizedIsPermanent() {
            assertThat(classifier.classify(new ExternalApiException(401, null)))
                    .isEqualTo(ErrorKind.PERMANENT);
            assertThat(classifier.classify(new ExternalApiException(401, "accessDenied")))
                    .isEqualTo(ErrorKind.PERMANENT);
        }
    }

    @Nested
    @DisplayName("upstream codes without status")
    class UpstreamCodes {

        @ParameterizedTest(name = "\"{0}\" is transient")
        @ValueSource(strings = {"serviceNotAvailable", "throttledRequest", "activityLimitReached", "timeout",
                "generalException", "TokenUnavailable"})
        void transientCodes(String code) {
            assertThat(classifier.classify(ExternalApiException.ofCode(code))).isEqualTo(ErrorKind.TRANSIENT);
        }

        @Test
        @DisplayName("unrecognised code is unknown")
        void unrecognisedCode() {
            assertThat(classifier.classify(ExternalApiException.ofCode("itemNotFound")))
                    .isEqualTo(ErrorKind.UNKNOWN);
            assertThat(classifier.classify(ExternalApiException.ofCode(null))).isEqualTo(ErrorKind.UNKNOWN);
        }
    }

    @Nested
    @DisplayName("transport failures")
    class Transport {

        @Test
        @DisplayName("connection and DNS failures are transient")
        void connectionFailures() {
            assertThat(classifier.classify(new ConnectException("refused"))).isEqualTo(ErrorKind.TRANSIENT);
            assertThat(classifier.classify(new SocketException("Connection reset"))).isEqualTo(ErrorKind.TRANSIENT);
            assertThat(classifier.classify(new UnknownHostException("graph"))).isEqualTo(ErrorKind.TRANSIENT);
        }

        @Test
        @DisplayName("timeouts are transient")
        void timeouts() {
            assertThat(classifier.classify(new SocketTimeoutException())).isEqualTo(ErrorKind.TRANSIENT);
            assertThat(classifier.classify(new HttpConnectTimeoutException("slow"))).isEqualTo(ErrorKind.TRANSIENT);
            assertThat(classifier.classify(new TimeoutException())).isEqualTo(ErrorKind.TRANSIENT);
        }

        @Test
        @DisplayName("wrapped failures are classified by their cause")
        void unwrapsWrappers() {
            assertThat(classifier.classify(new CompletionException(new ExternalApiException(503, null))))
                    .isEqualTo(ErrorKind.TRANSIENT);
            assertThat(classifier.classify(new ExecutionException(new ExternalApiException(404, null))))
                    .isEqualTo(ErrorKind.PERMANENT);
            assertThat(classifier.classify(new UncheckedIOException(new SocketTimeoutException())))
                    .isEqualTo(ErrorKind.TRANSIENT);
        }
    }

    @Nested
    @DisplayName("unrecognised errors")
    class Unrecognised {

        @Test
        @DisplayName("arbitrary exceptions are unknown")
        void arbitraryException() {
            assertThat(classifier.classify(new IllegalStateException("boom"))).isEqualTo(ErrorKind.UNKNOWN);
            assertThat(classifier.classify(new IOException("disk"))).isEqualTo(ErrorKind.UNKNOWN);
        }

        @Test
        @DisplayName("null is unknown")
        void nullError() {
            assertThat(classifier.classify(null)).isEqualTo(ErrorKind.UNKNOWN);
        }

        @Test
        @DisplayName("unknown is never retryable")
        void unknownNotRetryable() {
            assertThat(ErrorKind.UNKNOWN.isRetryable()).isFalse();
            assertThat(ErrorKind.PERMANENT.isRetryable()).isFalse();
            assertThat(ErrorKind.TRANSIENT.isRetryable()).isTrue();
        }
    }
}
