package intake.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import intake.micrometer.MicrometerMetricsExporter;
import intake.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code intake.metrics.enabled} is true
 * (default).
 *
 * <p>Runs before {@link IntakeAutoConfiguration} so the exporter is available to the
 * pipeline.
 */
@AutoConfiguration(before = IntakeAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "intake.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(IntakeProperties.class)
public class IntakeMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter intakeMetricsExporter(MeterRegistry meterRegistry, IntakeProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
