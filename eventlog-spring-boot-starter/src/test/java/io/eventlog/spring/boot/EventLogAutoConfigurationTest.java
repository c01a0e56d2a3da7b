package io.eventlog.spring.boot;

import io.eventlog.AggregateState;
import io.eventlog.StoreEvent;
import io.eventlog.codec.JsonEventCodec;
import io.eventlog.jdbc.DataSourceConnectionProvider;
import io.eventlog.jdbc.JdbcEventStore;
import io.eventlog.jdbc.JdbcEventStoreFactory;
import io.eventlog.jdbc.dialect.H2Dialect;
import io.eventlog.jdbc.dialect.PostgresDialect;
import io.eventlog.jdbc.spi.Dialect;
import io.eventlog.micrometer.MicrometerMetricsExporter;
import io.eventlog.spi.ConnectionProvider;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventLogAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          JacksonAutoConfiguration.class,
          EventLogMicrometerAutoConfiguration.class,
          EventLogAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:eventlog_auto_test;DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver");

  record Noted(String text) {
  }

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("connectionProvider"));
      assertTrue(ctx.containsBean("eventLogDialect"));
      assertTrue(ctx.containsBean("jdbcEventStoreFactory"));

      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(H2Dialect.class, ctx.getBean(Dialect.class));
      assertTrue(ctx.getBean(JdbcEventStoreFactory.class).runMigrations());
    });
  }

  @Test
  void factoryBuildsWorkingStores() {
    runner.run(ctx -> {
      var factory = ctx.getBean(JdbcEventStoreFactory.class);
      JdbcEventStore<Noted> store = factory
          .builder("note", JsonEventCodec.of(factory.objectMapper(), Noted.class))
          .build();

      AggregateState<Void> state = AggregateState.create(null);
      store.persist(state, List.of(new Noted("first"), new Noted("second")));

      List<StoreEvent<Noted>> events = store.byAggregateId(state.id());
      assertEquals(2, events.size());
      assertEquals(new Noted("first"), events.get(0).payload());
      assertEquals(2, events.get(1).sequenceNumber());
      assertTrue(factory.migrations().isEnsured("note"));
    });
  }

  @Test
  void explicitDialectOverridesDetection() {
    runner.withPropertyValues("eventlog.dialect=postgresql").run(ctx -> {
      assertInstanceOf(PostgresDialect.class, ctx.getBean(Dialect.class));
    });
  }

  @Test
  void runMigrationsCanBeDisabled() {
    runner.withPropertyValues("eventlog.run-migrations=false").run(ctx -> {
      var factory = ctx.getBean(JdbcEventStoreFactory.class);
      assertFalse(factory.runMigrations());

      factory.builder("skipped", JsonEventCodec.of(Noted.class)).build();
      assertFalse(factory.migrations().isEnsured("skipped"));
    });
  }

  @Test
  void usesMicrometerExporterWhenRegistryPresent() {
    runner.withUserConfiguration(MeterRegistryConfig.class).run(ctx -> {
      var factory = ctx.getBean(JdbcEventStoreFactory.class);
      assertInstanceOf(MicrometerMetricsExporter.class, factory.metrics());
    });
  }

  @Test
  void backsOffWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(EventLogAutoConfiguration.class))
        .run(ctx -> assertFalse(ctx.containsBean("jdbcEventStoreFactory")));
  }

  @Configuration
  static class MeterRegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }
}
