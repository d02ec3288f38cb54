package com.indicationscout.evidence.infrastructure.http;

import com.indicationscout.evidence.infrastructure.config.HttpClientConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestConfigTest {

    @Test
    void shouldGrowDelayExponentiallyUpToCap() {
        RequestConfig config = RequestConfig.defaults();

        assertThat(config.delayBeforeRetry(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.delayBeforeRetry(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(config.delayBeforeRetry(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(config.delayBeforeRetry(5)).isEqualTo(Duration.ofSeconds(16));
        assertThat(config.delayBeforeRetry(6)).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.delayBeforeRetry(20)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void shouldCountFirstAttemptInMaxAttempts() {
        assertThat(RequestConfig.defaults().maxAttempts()).isEqualTo(4);
    }

    @Test
    void shouldClassifyRetryableStatuses() {
        RequestConfig config = RequestConfig.defaults();

        assertThat(config.isRetryable(429)).isTrue();
        assertThat(config.isRetryable(503)).isTrue();
        assertThat(config.isRetryable(400)).isFalse();
        assertThat(config.isRetryable(404)).isFalse();
    }

    @Test
    void shouldSpreadBurstOverRefreshPeriod() {
        // 10 permits at 5 per second refresh every two seconds
        assertThat(RequestConfig.defaults().rateLimitRefreshPeriod()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void shouldRejectInconsistentDelays() {
        assertThatThrownBy(() -> new RequestConfig(Duration.ofSeconds(1), 3, Duration.ofSeconds(5),
                Duration.ofSeconds(1), 2.0, Set.of(503), 5, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RequestConfig(Duration.ofSeconds(1), -1, Duration.ofSeconds(1),
                Duration.ofSeconds(2), 2.0, Set.of(503), 5, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldBuildFromBoundProperties() {
        HttpClientConfig properties = new HttpClientConfig();
        properties.setMaxRetries(5);
        properties.setBaseDelayMillis(200);
        properties.setMaxDelayMillis(1000);
        properties.setRetryableStatusCodes(Set.of(503));

        RequestConfig config = RequestConfig.from(properties);

        assertThat(config.maxAttempts()).isEqualTo(6);
        assertThat(config.baseDelay()).isEqualTo(Duration.ofMillis(200));
        assertThat(config.delayBeforeRetry(4)).isEqualTo(Duration.ofMillis(1000));
        assertThat(config.isRetryable(429)).isFalse();
        assertThat(config.timeout()).isEqualTo(Duration.ofSeconds(30));
    }
}
