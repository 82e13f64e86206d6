package intake.spring.boot;

import intake.IntakePipeline;
import intake.dead.DeadLetterManager;
import intake.jdbc.DataSourceConnectionProvider;
import intake.jdbc.JdbcSchema;
import intake.jdbc.dead.JdbcDeadLetterStore;
import intake.jdbc.message.AbstractJdbcMessageStore;
import intake.jdbc.message.JdbcMessageStores;
import intake.jdbc.queue.AbstractJdbcQueueStore;
import intake.jdbc.queue.JdbcQueueStores;
import intake.media.FileSystemMediaStore;
import intake.media.HttpMediaFetcher;
import intake.queue.ExponentialBackoffRetryPolicy;
import intake.queue.MessageQueue;
import intake.registry.RuleRegistry;
import intake.route.RoutingTable;
import intake.spam.SpamRuleSet;
import intake.spi.ConnectionProvider;
import intake.spi.DeadLetterStore;
import intake.spi.MediaFetcher;
import intake.spi.MediaStore;
import intake.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

/**
 * Auto-configuration for the intake pipeline.
 *
 * <p>Detects the H2 or PostgreSQL stores from the {@link DataSource} URL and wires an
 * {@link IntakePipeline} from {@link IntakeProperties}. Every component bean backs off
 * when the application defines its own.
 *
 * @see IntakeProperties
 * @see IntakeMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(IntakePipeline.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(IntakeProperties.class)
public class IntakeAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcQueueStore intakeQueueStore(DataSource dataSource) {
    return JdbcQueueStores.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcMessageStore intakeMessageStore(DataSource dataSource) {
    return JdbcMessageStores.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(DeadLetterStore.class)
  public JdbcDeadLetterStore intakeDeadLetterStore() {
    return new JdbcDeadLetterStore();
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider intakeConnectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(name = "intakeSpamRules")
  public RuleRegistry<SpamRuleSet> intakeSpamRules(IntakeProperties props) {
    return new RuleRegistry<>("spam", IntakeRules.spamRules(props.getSpam()));
  }

  @Bean
  @ConditionalOnMissingBean(name = "intakeRoutingRules")
  public RuleRegistry<RoutingTable> intakeRoutingRules(IntakeProperties props) {
    return new RuleRegistry<>("routing", IntakeRules.routingTable(props.getRouting()));
  }

  @Bean
  @ConditionalOnMissingBean(MediaStore.class)
  public FileSystemMediaStore intakeMediaStore(IntakeProperties props) {
    return new FileSystemMediaStore(Path.of(props.getMedia().getRoot()));
  }

  @Bean
  @ConditionalOnMissingBean(MediaFetcher.class)
  public HttpMediaFetcher intakeMediaFetcher(IntakeProperties props) {
    return new HttpMediaFetcher(props.getMedia().getFetchTimeout(), props.getMedia().getMaxBytes());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public IntakePipeline intakePipeline(IntakeProperties props,
      DataSource dataSource,
      ConnectionProvider connectionProvider,
      AbstractJdbcQueueStore queueStore,
      AbstractJdbcMessageStore messageStore,
      DeadLetterStore deadLetterStore,
      MediaStore mediaStore,
      MediaFetcher mediaFetcher,
      RuleRegistry<SpamRuleSet> intakeSpamRules,
      RuleRegistry<RoutingTable> intakeRoutingRules,
      ObjectProvider<MetricsExporter> metricsProvider) {

    if (props.getSchema().isInitialize()) {
      installSchema(dataSource, queueStore.name());
    }
    IntakeProperties.Enrichment enrichment = props.getEnrichment();
    Duration overall = enrichment.getOverallTimeout() != null ? enrichment.getOverallTimeout()
        : enrichment.getSubServiceTimeout().multipliedBy(3);

    var builder = IntakePipeline.builder()
        .connectionProvider(connectionProvider)
        .queueStore(queueStore)
        .messageStore(messageStore)
        .deadLetterStore(deadLetterStore)
        .mediaStore(mediaStore)
        .mediaFetcher(mediaFetcher)
        .spamRules(intakeSpamRules)
        .routingRules(intakeRoutingRules)
        .retryPolicy(new ExponentialBackoffRetryPolicy(
            Duration.ofMillis(props.getRetry().getBaseDelayMs()),
            Duration.ofMillis(props.getRetry().getMaxDelayMs())))
        .consumerGroup(props.getConsumerGroup())
        .startWorkers(props.getWorker().isEnabled())
        .workerCount(props.getWorker().getCount())
        .batchSize(props.getWorker().getBatchSize())
        .blockTimeout(props.getWorker().getBlockTimeout())
        .drainTimeout(props.getWorker().getDrainTimeout())
        .workerIdPrefix(props.getWorker().getIdPrefix())
        .maxRetries(props.getQueue().getMaxRetries())
        .claimTimeout(props.getQueue().getClaimTimeout())
        .reaperInterval(props.getQueue().getReaperInterval())
        .subServiceTimeout(enrichment.getSubServiceTimeout())
        .overallEnrichmentTimeout(overall)
        .retrySubServices(enrichment.isRetrySubServices());
    if (props.getPurge().isEnabled()) {
      builder.purgeRetention(props.getPurge().getRetention())
          .purgeBatchSize(props.getPurge().getBatchSize())
          .purgeInterval(Duration.ofSeconds(props.getPurge().getIntervalSeconds()));
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public MessageQueue intakeMessageQueue(IntakePipeline intakePipeline) {
    return intakePipeline.queue();
  }

  @Bean
  @ConditionalOnMissingBean
  public DeadLetterManager intakeDeadLetterManager(IntakePipeline intakePipeline) {
    return intakePipeline.deadLetters();
  }

  private static void installSchema(DataSource dataSource, String dialect) {
    try (Connection conn = dataSource.getConnection()) {
      JdbcSchema.install(conn, dialect);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to obtain a connection for schema installation", e);
    }
  }
}
