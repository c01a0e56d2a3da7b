package io.eventlog.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the event store.
 *
 * @see EventLogAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventlog")
public class EventLogProperties {

  /**
   * Whether stores create their event tables when built.
   */
  private boolean runMigrations = true;

  /**
   * Dialect name (h2, postgresql, mysql). Detected from the DataSource when unset.
   */
  private String dialect;

  private final Metrics metrics = new Metrics();

  public boolean isRunMigrations() {
    return runMigrations;
  }

  public void setRunMigrations(boolean runMigrations) {
    this.runMigrations = runMigrations;
  }

  public String getDialect() {
    return dialect;
  }

  public void setDialect(String dialect) {
    this.dialect = dialect;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Metrics {
    /**
     * Whether Micrometer metrics are exported.
     */
    private boolean enabled = true;

    /**
     * Prefix for all meter names.
     */
    private String namePrefix = "eventlog";

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
}
