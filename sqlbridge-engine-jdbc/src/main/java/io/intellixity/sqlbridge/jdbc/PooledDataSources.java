package io.intellixity.sqlbridge.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Process-wide HikariCP pools, created lazily on first use.\n
 *
 * Creation goes through {@link ConcurrentHashMap#computeIfAbsent}, so concurrent first callers for a key
 * get the same pool and only one pool is ever built per key.
 */
public final class PooledDataSources implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PooledDataSources.class);
  public static final String DEFAULT_KEY = "default";

  private final Function<String, HikariConfig> configs;
  private final Map<String, HikariDataSource> pools = new ConcurrentHashMap<>();

  public PooledDataSources(Function<String, HikariConfig> configs) {
    this.configs = Objects.requireNonNull(configs, "configs");
  }

  public DataSource get() { return get(DEFAULT_KEY); }

  public DataSource get(String key) {
    Objects.requireNonNull(key, "key");
    return pools.computeIfAbsent(key, k -> {
      HikariConfig hc = Objects.requireNonNull(configs.apply(k), "config for " + k);
      if (hc.getPoolName() == null) hc.setPoolName("sqlbridge-" + k);
      log.info("sqlbridge.pool_create key={} maxPoolSize={}", k, hc.getMaximumPoolSize());
      return new HikariDataSource(hc);
    });
  }

  public boolean isCreated(String key) { return pools.containsKey(key); }

  /** Retires idle connections now and in-use ones on return, so the next borrow opens a new session. */
  public void softEvict() {
    for (HikariDataSource ds : pools.values()) {
      HikariPoolMXBean mx = ds.getHikariPoolMXBean();
      if (mx != null) mx.softEvictConnections();
    }
  }

  @Override
  public void close() {
    for (HikariDataSource ds : pools.values()) ds.close();
    pools.clear();
  }
}
