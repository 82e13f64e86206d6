package intake.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntakePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(IntakeProperties.class);
            assertEquals("intake-workers", props.getConsumerGroup());
            assertTrue(props.getWorker().isEnabled());
            assertEquals(4, props.getWorker().getCount());
            assertEquals(10, props.getWorker().getBatchSize());
            assertEquals(Duration.ofSeconds(2), props.getWorker().getBlockTimeout());
            assertEquals(Duration.ofSeconds(5), props.getWorker().getDrainTimeout());
            assertEquals(3, props.getQueue().getMaxRetries());
            assertEquals(Duration.ofMinutes(5), props.getQueue().getClaimTimeout());
            assertEquals(Duration.ofSeconds(30), props.getQueue().getReaperInterval());
            assertEquals(200, props.getRetry().getBaseDelayMs());
            assertEquals(60000, props.getRetry().getMaxDelayMs());
            assertEquals(Duration.ofSeconds(5), props.getEnrichment().getSubServiceTimeout());
            assertNull(props.getEnrichment().getOverallTimeout());
            assertTrue(props.getEnrichment().isRetrySubServices());
            assertEquals("./media", props.getMedia().getRoot());
            assertEquals(Duration.ofSeconds(30), props.getMedia().getFetchTimeout());
            assertFalse(props.getPurge().isEnabled());
            assertEquals(Duration.ofDays(7), props.getPurge().getRetention());
            assertEquals(500, props.getPurge().getBatchSize());
            assertEquals(3600, props.getPurge().getIntervalSeconds());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("intake", props.getMetrics().getNamePrefix());
            assertTrue(props.getSpam().getRules().isEmpty());
            assertEquals(0.85, props.getSpam().getThreshold());
            assertTrue(props.getRouting().getRules().isEmpty());
            assertEquals("messages_general", props.getRouting().getDefaultPartition());
            assertFalse(props.getSchema().isInitialize());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "intake.consumer-group=enrichment",
                "intake.worker.count=8",
                "intake.worker.batch-size=25",
                "intake.worker.block-timeout=500ms",
                "intake.queue.max-retries=5",
                "intake.queue.claim-timeout=2m",
                "intake.retry.base-delay-ms=500",
                "intake.enrichment.sub-service-timeout=3s",
                "intake.enrichment.overall-timeout=10s",
                "intake.media.root=/var/lib/intake/media",
                "intake.purge.enabled=true",
                "intake.purge.retention=3d",
                "intake.metrics.name-prefix=osint.intake",
                "intake.routing.topic-partitions.naval=messages_naval",
                "intake.schema.initialize=true"
        ).run(ctx -> {
            var props = ctx.getBean(IntakeProperties.class);
            assertEquals("enrichment", props.getConsumerGroup());
            assertEquals(8, props.getWorker().getCount());
            assertEquals(25, props.getWorker().getBatchSize());
            assertEquals(Duration.ofMillis(500), props.getWorker().getBlockTimeout());
            assertEquals(5, props.getQueue().getMaxRetries());
            assertEquals(Duration.ofMinutes(2), props.getQueue().getClaimTimeout());
            assertEquals(500, props.getRetry().getBaseDelayMs());
            assertEquals(Duration.ofSeconds(3), props.getEnrichment().getSubServiceTimeout());
            assertEquals(Duration.ofSeconds(10), props.getEnrichment().getOverallTimeout());
            assertEquals("/var/lib/intake/media", props.getMedia().getRoot());
            assertTrue(props.getPurge().isEnabled());
            assertEquals(Duration.ofDays(3), props.getPurge().getRetention());
            assertEquals("osint.intake", props.getMetrics().getNamePrefix());
            assertEquals("messages_naval", props.getRouting().getTopicPartitions().get("naval"));
            assertTrue(props.getSchema().isInitialize());
        });
    }

    @Configuration
    @EnableConfigurationProperties(IntakeProperties.class)
    static class PropsConfig {
    }
}
