package org.carball.router.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RouterExceptionTest {

    @Test
    void shouldPrefixMessageWithKind() {
        RouterException error = new RouterException(ErrorKind.BACKEND_TIMEOUT, "SPARK did not finish within 100 ms");

        assertThat(error.getKind()).isEqualTo(ErrorKind.BACKEND_TIMEOUT);
        assertThat(error.getMessage()).isEqualTo("[BACKEND_TIMEOUT] SPARK did not finish within 100 ms");
    }

    @Test
    void shouldKeepCause() {
        BackendExecutionException cause = new BackendExecutionException("connection refused");

        RouterException error = new RouterException(ErrorKind.BACKEND_EXECUTION_FAILED, "failed", cause);

        assertThat(error).hasCause(cause);
    }

    @Test
    void shouldSeparateDegradationsFromFailures() {
        assertThat(ErrorKind.PARTIAL_CATALOG.isFatal()).isFalse();
        assertThat(ErrorKind.PRUNING_AMBIGUOUS.isFatal()).isFalse();
        assertThat(ErrorKind.CACHE_CORRUPTION.isFatal()).isFalse();
        assertThat(ErrorKind.CATALOG_UNAVAILABLE.isFatal()).isTrue();
        assertThat(ErrorKind.QUERY_CANCELLED.isFatal()).isTrue();
    }
}
