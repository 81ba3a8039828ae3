package com.speclineage.infra.lifecycle;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationTokenTest {

    @Test
    void keepsFirstReason() {
        CancellationToken token = CancellationToken.create();
        assertThat(token.isCancelled()).isFalse();

        token.cancel("shutdown hook");
        token.cancel("second");

        assertThat(token.isCancelled()).isTrue();
        assertThat(token.reason()).isEqualTo("shutdown hook");
    }
}
