package org.digitalresearch.calmlake;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import org.digitalresearch.calmlake.controller.ProxyController;

/**
 * Options for a CalmLake. Options are immutable. A value that was never set
 * falls back to the default, and merging lets the values of the caller win
 * over the ones they are merged into:
 * <pre>
 *   CalmLakeOptions options = CalmLakeOptions.load()
 *       .merge(CalmLakeOptions.builder().maxBufferSize(1024).build());
 * </pre>
 * Defaults live in reference.conf under {@code calmlake}, and can be
 * overridden in application.conf or with system properties, the usual
 * Typesafe Config way.
 *
 * @author calm-lake developers
 */
public final class CalmLakeOptions {

  // Constants.

  public static final String ROOT = "calmlake";
  public static final String MAX_BUFFER_SIZE_PATH = "max-buffer-size";
  public static final String MAX_CONSECUTIVE_FAILURES_PATH = "controller.max-consecutive-failures";

  public static final int DEFAULT_MAX_BUFFER_SIZE = 65536;
  public static final int DEFAULT_MAX_CONSECUTIVE_FAILURES =
      ProxyController.DEFAULT_MAX_CONSECUTIVE_FAILURES;

  private static final CalmLakeOptions DEFAULTS =
      new CalmLakeOptions(DEFAULT_MAX_BUFFER_SIZE, DEFAULT_MAX_CONSECUTIVE_FAILURES);

  // Instance fields.

  // Null means not set.
  private final Integer maxBufferSize;
  private final Integer maxConsecutiveFailures;

  // Implementation.

  private CalmLakeOptions(Integer maxBufferSize, Integer maxConsecutiveFailures) {
    this.maxBufferSize = maxBufferSize;
    this.maxConsecutiveFailures = maxConsecutiveFailures;
  }

  public static CalmLakeOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Load options with the standard Typesafe Config resolution order.
   */
  public static CalmLakeOptions load() {
    return fromConfig(ConfigFactory.load());
  }

  /**
   * Read the values under {@code calmlake} of the specified config. Paths
   * that are missing stay unset.
   *
   * @param config The config to read.
   * @return The options found.
   * @throws IllegalArgumentException If a value is not a positive number.
   */
  public static CalmLakeOptions fromConfig(Config config) {
    Builder builder = builder();
    if (!config.hasPath(ROOT)) return builder.build();
    Config lake = config.getConfig(ROOT);
    try {
      if (lake.hasPath(MAX_BUFFER_SIZE_PATH)) {
        builder.maxBufferSize(lake.getInt(MAX_BUFFER_SIZE_PATH));
      }
      if (lake.hasPath(MAX_CONSECUTIVE_FAILURES_PATH)) {
        builder.maxConsecutiveFailures(lake.getInt(MAX_CONSECUTIVE_FAILURES_PATH));
      }
    } catch (ConfigException.WrongType wt) {
      throw new IllegalArgumentException("Invalid calmlake configuration", wt);
    }
    return builder.build();
  }

  /**
   * Combine these options with overrides. Values set in the overrides win.
   *
   * @param overrides The options of the caller, may be null.
   * @return The merged options.
   */
  public CalmLakeOptions merge(CalmLakeOptions overrides) {
    if (overrides == null) return this;
    return new CalmLakeOptions(
        overrides.maxBufferSize != null ? overrides.maxBufferSize : maxBufferSize,
        overrides.maxConsecutiveFailures != null ? overrides.maxConsecutiveFailures : maxConsecutiveFailures);
  }

  public int getMaxBufferSize() {
    return maxBufferSize != null ? maxBufferSize : DEFAULT_MAX_BUFFER_SIZE;
  }

  public int getMaxConsecutiveFailures() {
    return maxConsecutiveFailures != null ? maxConsecutiveFailures : DEFAULT_MAX_CONSECUTIVE_FAILURES;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CalmLakeOptions)) return false;
    CalmLakeOptions that = (CalmLakeOptions) o;
    return getMaxBufferSize() == that.getMaxBufferSize()
        && getMaxConsecutiveFailures() == that.getMaxConsecutiveFailures();
  }

  @Override
  public int hashCode() {
    return 31 * getMaxBufferSize() + getMaxConsecutiveFailures();
  }

  @Override
  public String toString() {
    return String.format("CalmLakeOptions{maxBufferSize=%d, maxConsecutiveFailures=%d}",
        getMaxBufferSize(), getMaxConsecutiveFailures());
  }

  // Inner classes.

  public static final class Builder {

    // Instance fields.

    private Integer maxBufferSize;
    private Integer maxConsecutiveFailures;

    // Implementation.

    private Builder() {
    }

    public Builder maxBufferSize(int maxBufferSize) {
      if (maxBufferSize <= 0) throw new IllegalArgumentException(
          "maxBufferSize must be positive: " + maxBufferSize);
      this.maxBufferSize = maxBufferSize;
      return this;
    }

    public Builder maxConsecutiveFailures(int maxConsecutiveFailures) {
      if (maxConsecutiveFailures < 0) throw new IllegalArgumentException(
          "maxConsecutiveFailures must not be negative: " + maxConsecutiveFailures);
      this.maxConsecutiveFailures = maxConsecutiveFailures;
      return this;
    }

    public CalmLakeOptions build() {
      return new CalmLakeOptions(maxBufferSize, maxConsecutiveFailures);
    }
  }
}
