package intake.spring.boot;

import intake.IntakePipeline;
import intake.MessageEnvelope;
import intake.dead.DeadLetterManager;
import intake.jdbc.DataSourceConnectionProvider;
import intake.jdbc.dead.JdbcDeadLetterStore;
import intake.jdbc.message.AbstractJdbcMessageStore;
import intake.jdbc.message.H2MessageStore;
import intake.jdbc.queue.AbstractJdbcQueueStore;
import intake.jdbc.queue.H2QueueStore;
import intake.media.ContentHash;
import intake.media.FileSystemMediaStore;
import intake.queue.MessageQueue;
import intake.registry.RuleRegistry;
import intake.route.RoutingTable;
import intake.spam.SpamRuleSet;
import intake.spi.ConnectionProvider;
import intake.spi.MediaStore;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class IntakeAutoConfigurationTest {

  @TempDir
  Path mediaRoot;

  private ApplicationContextRunner runner() {
    return new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            DataSourceAutoConfiguration.class,
            IntakeAutoConfiguration.class))
        .withPropertyValues(
            "spring.datasource.url=jdbc:h2:mem:intake_auto_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
            "spring.datasource.driver-class-name=org.h2.Driver",
            "intake.schema.initialize=true",
            "intake.media.root=" + mediaRoot,
            "intake.worker.count=1",
            "intake.worker.block-timeout=100ms",
            "intake.worker.drain-timeout=1s");
  }

  @Test
  void createsAllBeans() {
    runner().run(ctx -> {
      assertTrue(ctx.containsBean("intakeQueueStore"));
      assertTrue(ctx.containsBean("intakeMessageStore"));
      assertTrue(ctx.containsBean("intakeDeadLetterStore"));
      assertTrue(ctx.containsBean("intakeConnectionProvider"));
      assertTrue(ctx.containsBean("intakeSpamRules"));
      assertTrue(ctx.containsBean("intakeRoutingRules"));
      assertTrue(ctx.containsBean("intakePipeline"));

      assertInstanceOf(H2QueueStore.class, ctx.getBean(AbstractJdbcQueueStore.class));
      assertInstanceOf(H2MessageStore.class, ctx.getBean(AbstractJdbcMessageStore.class));
      assertInstanceOf(JdbcDeadLetterStore.class, ctx.getBean(JdbcDeadLetterStore.class));
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(FileSystemMediaStore.class, ctx.getBean(MediaStore.class));
      assertNotNull(ctx.getBean(IntakePipeline.class).workerPool());
      assertSame(ctx.getBean(IntakePipeline.class).queue(), ctx.getBean(MessageQueue.class));
      assertNotNull(ctx.getBean(DeadLetterManager.class));
    });
  }

  @Test
  void installsSchemaAndRegistersConsumerGroup() {
    runner().withPropertyValues("intake.consumer-group=enrichment").run(ctx -> {
      DataSource dataSource = ctx.getBean(DataSource.class);
      try (Connection conn = dataSource.getConnection();
           Statement st = conn.createStatement();
           ResultSet rs = st.executeQuery("SELECT group_name FROM intake_group")) {
        assertTrue(rs.next());
        assertEquals("enrichment", rs.getString(1));
      }
    });
  }

  @Test
  void processesEnqueuedMessage() {
    runner().run(ctx -> {
      MessageQueue queue = ctx.getBean(MessageQueue.class);
      queue.enqueue(MessageEnvelope.builder("channel-a", 1)
          .text("HIMARS strike reported near Bakhmut")
          .build());

      AbstractJdbcMessageStore store = ctx.getBean(AbstractJdbcMessageStore.class);
      DataSource dataSource = ctx.getBean(DataSource.class);
      long deadline = System.currentTimeMillis() + 10_000;
      int stored = 0;
      while (stored == 0 && System.currentTimeMillis() < deadline) {
        try (Connection conn = dataSource.getConnection()) {
          stored = store.count(conn);
        }
        if (stored == 0) {
          Thread.sleep(50);
        }
      }
      assertEquals(1, stored);
    });
  }

  @Test
  void workersCanBeDisabled() {
    runner().withPropertyValues("intake.worker.enabled=false").run(ctx -> {
      assertNull(ctx.getBean(IntakePipeline.class).workerPool());
      assertNotNull(ctx.getBean(MessageQueue.class));
    });
  }

  @Test
  @SuppressWarnings("unchecked")
  void bindsRulesFromProperties() {
    runner()
        .withPropertyValues(
            "intake.spam.threshold=0.7",
            "intake.spam.rules[0].id=casino",
            "intake.spam.rules[0].pattern=casino|jackpot",
            "intake.spam.rules[0].weight=0.8",
            "intake.routing.rules[0].priority=1",
            "intake.routing.rules[0].target-partition=messages_naval",
            "intake.routing.rules[0].triggers[0]=frigate",
            "intake.routing.rules[0].triggers[1]=corvette",
            "intake.routing.default-partition=messages_other")
        .run(ctx -> {
          var spamRules = (RuleRegistry<SpamRuleSet>) ctx.getBean("intakeSpamRules");
          SpamRuleSet spam = spamRules.current().rules();
          assertEquals(0.7, spam.threshold());
          assertEquals(1, spam.rules().size());
          assertEquals("casino", spam.rules().get(0).id());

          var routingRules = (RuleRegistry<RoutingTable>) ctx.getBean("intakeRoutingRules");
          RoutingTable table = routingRules.current().rules();
          assertEquals(1, table.rules().size());
          assertEquals("messages_naval", table.rules().get(0).targetPartition());
          assertEquals("messages_other", table.defaultPartition());
          assertEquals(RoutingTable.defaults().topicPartitions(), table.topicPartitions());
        });
  }

  @Test
  void invalidSpamRuleFailsStartup() {
    runner()
        .withPropertyValues("intake.spam.rules[0].id=broken", "intake.spam.rules[0].weight=0.5")
        .run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void backsOffWhenCustomMediaStorePresent() {
    runner().withUserConfiguration(CustomMediaStoreConfig.class).run(ctx -> {
      assertFalse(ctx.containsBean("intakeMediaStore"));
      assertSame(CustomMediaStoreConfig.STORE, ctx.getBean(MediaStore.class));
    });
  }

  @Test
  void noPipelineWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(IntakeAutoConfiguration.class))
        .run(ctx -> {
          assertFalse(ctx.containsBean("intakePipeline"));
          assertEquals(0, ctx.getBeanNamesForType(IntakePipeline.class).length);
        });
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }

  @Configuration
  static class CustomMediaStoreConfig {
    static final MediaStore STORE = new MediaStore() {
      @Override
      public String put(byte[] content) {
        return ContentHash.sha256(content);
      }

      @Override
      public boolean exists(String contentHash) {
        return false;
      }
    };

    @Bean
    MediaStore customMediaStore() {
      return STORE;
    }
  }
}
