package com.phillippitts.speakstream.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RpcStatusTest {

    @Test
    void mapsHttpStatusCodes() {
        assertThat(RpcStatus.fromHttpStatus(400)).isEqualTo(RpcStatus.INVALID_ARGUMENT);
        assertThat(RpcStatus.fromHttpStatus(401)).isEqualTo(RpcStatus.UNAUTHENTICATED);
        assertThat(RpcStatus.fromHttpStatus(403)).isEqualTo(RpcStatus.PERMISSION_DENIED);
        assertThat(RpcStatus.fromHttpStatus(404)).isEqualTo(RpcStatus.NOT_FOUND);
        assertThat(RpcStatus.fromHttpStatus(504)).isEqualTo(RpcStatus.DEADLINE_EXCEEDED);
        assertThat(RpcStatus.fromHttpStatus(503)).isEqualTo(RpcStatus.UNAVAILABLE);
        assertThat(RpcStatus.fromHttpStatus(499)).isEqualTo(RpcStatus.CANCELLED);
    }

    @Test
    void unmappedCodesFallBack() {
        assertThat(RpcStatus.fromHttpStatus(500)).isEqualTo(RpcStatus.INTERNAL);
        assertThat(RpcStatus.fromHttpStatus(502)).isEqualTo(RpcStatus.INTERNAL);
        assertThat(RpcStatus.fromHttpStatus(418)).isEqualTo(RpcStatus.UNKNOWN);
    }

    @Test
    void parsesNamesCaseInsensitively() {
        assertThat(RpcStatus.fromName("unauthenticated")).isEqualTo(RpcStatus.UNAUTHENTICATED);
        assertThat(RpcStatus.fromName(" UNAVAILABLE ")).isEqualTo(RpcStatus.UNAVAILABLE);
        assertThat(RpcStatus.fromName("resource_exhausted")).isNull();
        assertThat(RpcStatus.fromName("")).isNull();
        assertThat(RpcStatus.fromName(null)).isNull();
    }
}
