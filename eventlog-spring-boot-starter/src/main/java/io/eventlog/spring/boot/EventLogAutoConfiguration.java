package io.eventlog.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.eventlog.codec.JsonEventCodec;
import io.eventlog.jdbc.DataSourceConnectionProvider;
import io.eventlog.jdbc.JdbcEventStore;
import io.eventlog.jdbc.JdbcEventStoreFactory;
import io.eventlog.jdbc.dialect.Dialects;
import io.eventlog.jdbc.spi.Dialect;
import io.eventlog.spi.ConnectionProvider;
import io.eventlog.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the event store.
 *
 * <p>Wires a {@link JdbcEventStoreFactory} from a {@link DataSource} and
 * {@link EventLogProperties}. Applications build one store per aggregate from the factory.
 *
 * @see EventLogProperties
 * @see EventLogMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, JacksonAutoConfiguration.class})
@ConditionalOnClass(JdbcEventStore.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(EventLogProperties.class)
public class EventLogAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public Dialect eventLogDialect(DataSource dataSource, EventLogProperties props) {
    String name = props.getDialect();
    if (name != null && !name.isBlank()) {
      return Dialects.get(name);
    }
    return Dialects.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public JdbcEventStoreFactory jdbcEventStoreFactory(EventLogProperties props,
      ConnectionProvider connectionProvider,
      Dialect dialect,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<ObjectMapper> objectMapperProvider) {
    return new JdbcEventStoreFactory(
        connectionProvider,
        dialect,
        metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP),
        objectMapperProvider.getIfAvailable(JsonEventCodec::defaultMapper),
        props.isRunMigrations());
  }
}
