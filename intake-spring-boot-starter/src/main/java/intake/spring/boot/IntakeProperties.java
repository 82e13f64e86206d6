package intake.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the intake pipeline.
 *
 * @see IntakeAutoConfiguration
 */
@ConfigurationProperties(prefix = "intake")
public class IntakeProperties {

  /**
   * Consumer group the worker pool reads from.
   */
  private String consumerGroup = "intake-workers";

  private final Worker worker = new Worker();
  private final Queue queue = new Queue();
  private final Retry retry = new Retry();
  private final Enrichment enrichment = new Enrichment();
  private final Media media = new Media();
  private final Purge purge = new Purge();
  private final Metrics metrics = new Metrics();
  private final Spam spam = new Spam();
  private final Routing routing = new Routing();
  private final Schema schema = new Schema();

  public String getConsumerGroup() {
    return consumerGroup;
  }

  public void setConsumerGroup(String consumerGroup) {
    this.consumerGroup = consumerGroup;
  }

  public Worker getWorker() {
    return worker;
  }

  public Queue getQueue() {
    return queue;
  }

  public Retry getRetry() {
    return retry;
  }

  public Enrichment getEnrichment() {
    return enrichment;
  }

  public Media getMedia() {
    return media;
  }

  public Purge getPurge() {
    return purge;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public Spam getSpam() {
    return spam;
  }

  public Routing getRouting() {
    return routing;
  }

  public Schema getSchema() {
    return schema;
  }

  public static class Worker {
    /**
     * Start the worker pool. Disable on nodes that only enqueue.
     */
    private boolean enabled = true;
    private int count = 4;
    private int batchSize = 10;
    private Duration blockTimeout = Duration.ofSeconds(2);
    private Duration drainTimeout = Duration.ofSeconds(5);
    private String idPrefix;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getCount() {
      return count;
    }

    public void setCount(int count) {
      this.count = count;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public Duration getBlockTimeout() {
      return blockTimeout;
    }

    public void setBlockTimeout(Duration blockTimeout) {
      this.blockTimeout = blockTimeout;
    }

    public Duration getDrainTimeout() {
      return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
    }

    public String getIdPrefix() {
      return idPrefix;
    }

    public void setIdPrefix(String idPrefix) {
      this.idPrefix = idPrefix;
    }
  }

  public static class Queue {
    private int maxRetries = 3;
    private Duration claimTimeout = Duration.ofMinutes(5);
    private Duration reaperInterval = Duration.ofSeconds(30);

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public Duration getClaimTimeout() {
      return claimTimeout;
    }

    public void setClaimTimeout(Duration claimTimeout) {
      this.claimTimeout = claimTimeout;
    }

    public Duration getReaperInterval() {
      return reaperInterval;
    }

    public void setReaperInterval(Duration reaperInterval) {
      this.reaperInterval = reaperInterval;
    }
  }

  public static class Retry {
    private long baseDelayMs = 200;
    private long maxDelayMs = 60_000;

    public long getBaseDelayMs() {
      return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
    }

    public long getMaxDelayMs() {
      return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
    }
  }

  public static class Enrichment {
    private Duration subServiceTimeout = Duration.ofSeconds(5);
    /**
     * Bound on the whole fan-out. Defaults to three sub-service timeouts.
     */
    private Duration overallTimeout;
    private boolean retrySubServices = true;

    public Duration getSubServiceTimeout() {
      return subServiceTimeout;
    }

    public void setSubServiceTimeout(Duration subServiceTimeout) {
      this.subServiceTimeout = subServiceTimeout;
    }

    public Duration getOverallTimeout() {
      return overallTimeout;
    }

    public void setOverallTimeout(Duration overallTimeout) {
      this.overallTimeout = overallTimeout;
    }

    public boolean isRetrySubServices() {
      return retrySubServices;
    }

    public void setRetrySubServices(boolean retrySubServices) {
      this.retrySubServices = retrySubServices;
    }
  }

  public static class Media {
    private String root = "./media";
    private Duration fetchTimeout = Duration.ofSeconds(30);
    private long maxBytes = 50L * 1024 * 1024;

    public String getRoot() {
      return root;
    }

    public void setRoot(String root) {
      this.root = root;
    }

    public Duration getFetchTimeout() {
      return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
      this.fetchTimeout = fetchTimeout;
    }

    public long getMaxBytes() {
      return maxBytes;
    }

    public void setMaxBytes(long maxBytes) {
      this.maxBytes = maxBytes;
    }
  }

  public static class Purge {
    private boolean enabled = false;
    private Duration retention = Duration.ofDays(7);
    private int batchSize = 500;
    private long intervalSeconds = 3600;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getRetention() {
      return retention;
    }

    public void setRetention(Duration retention) {
      this.retention = retention;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public long getIntervalSeconds() {
      return intervalSeconds;
    }

    public void setIntervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "intake";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }

  public static class Spam {
    /**
     * Replaces the built-in rules when non-empty.
     */
    private List<SpamRuleConfig> rules = new ArrayList<>();
    private double threshold = 0.85;

    public List<SpamRuleConfig> getRules() {
      return rules;
    }

    public void setRules(List<SpamRuleConfig> rules) {
      this.rules = rules;
    }

    public double getThreshold() {
      return threshold;
    }

    public void setThreshold(double threshold) {
      this.threshold = threshold;
    }
  }

  public static class SpamRuleConfig {
    private String id;
    private String pattern;
    private double weight = 1.0;
    /**
     * Match against this metadata value instead of the message text.
     */
    private String metadataKey;

    public String getId() {
      return id;
    }

    public void setId(String id) {
      this.id = id;
    }

    public String getPattern() {
      return pattern;
    }

    public void setPattern(String pattern) {
      this.pattern = pattern;
    }

    public double getWeight() {
      return weight;
    }

    public void setWeight(double weight) {
      this.weight = weight;
    }

    public String getMetadataKey() {
      return metadataKey;
    }

    public void setMetadataKey(String metadataKey) {
      this.metadataKey = metadataKey;
    }
  }

  public static class Routing {
    /**
     * Replaces the built-in trigger rules when non-empty.
     */
    private List<TriggerRuleConfig> rules = new ArrayList<>();
    /**
     * Replaces the built-in topic fallback table when non-empty. Order is priority.
     */
    private Map<String, String> topicPartitions = new LinkedHashMap<>();
    private String defaultPartition = "messages_general";

    public List<TriggerRuleConfig> getRules() {
      return rules;
    }

    public void setRules(List<TriggerRuleConfig> rules) {
      this.rules = rules;
    }

    public Map<String, String> getTopicPartitions() {
      return topicPartitions;
    }

    public void setTopicPartitions(Map<String, String> topicPartitions) {
      this.topicPartitions = topicPartitions;
    }

    public String getDefaultPartition() {
      return defaultPartition;
    }

    public void setDefaultPartition(String defaultPartition) {
      this.defaultPartition = defaultPartition;
    }
  }

  public static class TriggerRuleConfig {
    private int priority;
    private String targetPartition;
    private List<String> triggers = new ArrayList<>();

    public int getPriority() {
      return priority;
    }

    public void setPriority(int priority) {
      this.priority = priority;
    }

    public String getTargetPartition() {
      return targetPartition;
    }

    public void setTargetPartition(String targetPartition) {
      this.targetPartition = targetPartition;
    }

    public List<String> getTriggers() {
      return triggers;
    }

    public void setTriggers(List<String> triggers) {
      this.triggers = triggers;
    }
  }

  public static class Schema {
    /**
     * Create the intake tables on startup if they do not exist.
     */
    private boolean initialize = false;

    public boolean isInitialize() {
      return initialize;
    }

    public void setInitialize(boolean initialize) {
      this.initialize = initialize;
    }
  }
}
