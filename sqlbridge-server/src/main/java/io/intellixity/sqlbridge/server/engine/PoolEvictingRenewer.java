package io.intellixity.sqlbridge.server.engine;

import io.intellixity.sqlbridge.jdbc.PooledDataSources;
import io.intellixity.sqlbridge.jdbc.auth.SessionRenewer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/** Renews by retiring pooled connections; the driver logs in again on the next borrow. */
public final class PoolEvictingRenewer implements SessionRenewer {
  private static final Logger log = LoggerFactory.getLogger(PoolEvictingRenewer.class);

  private final PooledDataSources pools;
  private final Supplier<String> token;

  public PoolEvictingRenewer(PooledDataSources pools, Supplier<String> token) {
    this.pools = Objects.requireNonNull(pools, "pools");
    this.token = Objects.requireNonNull(token, "token");
  }

  @Override
  public void renew() {
    log.info("sqlbridge.session_evict pool={}", PooledDataSources.DEFAULT_KEY);
    pools.softEvict();
  }

  @Override
  public String token() {
    return token.get();
  }
}
