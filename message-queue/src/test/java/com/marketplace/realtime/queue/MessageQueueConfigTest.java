package com.marketplace.realtime.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class MessageQueueConfigTest {

    @Test
    void defaults() {
        MessageQueueConfig config = MessageQueueConfig.defaults();

        assertThat(config.getMaxQueueSize()).isEqualTo(10_000);
        assertThat(config.getBatchSize()).isEqualTo(50);
        assertThat(config.getBatchTimeout()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.getProcessingDelay()).isEqualTo(Duration.ofMillis(100));
        assertThat(config.getRetryAttempts()).isEqualTo(3);
        assertThat(config.getRetryDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.isEnablePriority()).isTrue();
        assertThat(config.isEnableBatching()).isTrue();
        assertThat(config.getStatisticsWindowSize()).isEqualTo(1000);
    }

    @Test
    void readsOverridesFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("realtime.queue.maxQueueSize", "25");
        properties.setProperty("realtime.queue.retryDelayMs", " 250 ");
        properties.setProperty("realtime.queue.enablePriority", "false");
        properties.setProperty("unrelated.key", "ignored");

        MessageQueueConfig config = MessageQueueConfig.fromProperties(properties);

        assertThat(config.getMaxQueueSize()).isEqualTo(25);
        assertThat(config.getRetryDelay()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.isEnablePriority()).isFalse();
        assertThat(config.getBatchSize()).isEqualTo(50);
    }

    @Test
    void rejectsUnparsableProperty() {
        Properties properties = new Properties();
        properties.setProperty("realtime.queue.batchSize", "many");

        assertThatThrownBy(() -> MessageQueueConfig.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("realtime.queue.batchSize");
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> MessageQueueConfig.builder().maxQueueSize(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MessageQueueConfig.builder().retryAttempts(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MessageQueueConfig.builder().processingDelay(Duration.ofMillis(-5)).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
