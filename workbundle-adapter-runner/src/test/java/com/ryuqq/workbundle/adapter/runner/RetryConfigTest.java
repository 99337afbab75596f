package com.ryuqq.workbundle.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RetryConfig 테스트.
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
class RetryConfigTest {

    @Test
    void 기본값() {
        RetryConfig config = new RetryConfig();

        assertThat(config.maxAttempts()).isEqualTo(5);
        assertThat(config.baseDelayMs()).isEqualTo(1000);
        assertThat(config.maxDelayMs()).isEqualTo(60000);
        assertThat(config.jitterFactor()).isEqualTo(0.1);
    }

    @Test
    void withX_해당_값만_변경() {
        RetryConfig config = new RetryConfig()
            .withMaxAttempts(2)
            .withBaseDelayMs(50)
            .withMaxDelayMs(500)
            .withJitterFactor(0.0);

        assertThat(config).isEqualTo(new RetryConfig(2, 50, 500, 0.0));
    }

    @Test
    void 유효하지_않은_값이면_IllegalArgumentException() {
        assertThatThrownBy(() -> new RetryConfig(0, 1000, 60000, 0.1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxAttempts");
        assertThatThrownBy(() -> new RetryConfig(3, -1, 60000, 0.1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("baseDelayMs");
        assertThatThrownBy(() -> new RetryConfig(3, 1000, 999, 0.1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxDelayMs");
        assertThatThrownBy(() -> new RetryConfig(3, 1000, 60000, -0.1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("jitterFactor");
    }
}
