package io.intellixity.sqlbridge.server.config;

import com.zaxxer.hikari.HikariConfig;
import io.intellixity.sqlbridge.exec.StatementExecutor;
import io.intellixity.sqlbridge.jdbc.PooledDataSources;
import io.intellixity.sqlbridge.jdbc.auth.SessionRenewer;
import io.intellixity.sqlbridge.jdbc.auth.SessionRenewingExecutor;
import io.intellixity.sqlbridge.resources.SqlBridge;
import io.intellixity.sqlbridge.server.engine.PoolEvictingRenewer;
import io.intellixity.sqlbridge.server.engine.PooledStatementExecutor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(BackendProperties.class)
public class BridgeConfig {

  @Bean(destroyMethod = "close")
  public PooledDataSources pooledDataSources(BackendProperties props) {
    return new PooledDataSources(key -> hikariConfig(props));
  }

  @Bean
  public SessionRenewer sessionRenewer(PooledDataSources pools, BackendProperties props) {
    return new PoolEvictingRenewer(pools, props::getToken);
  }

  @Bean
  public StatementExecutor statementExecutor(PooledDataSources pools, SessionRenewer renewer) {
    return new SessionRenewingExecutor(new PooledStatementExecutor(pools), renewer);
  }

  @Bean
  public SqlBridge sqlBridge(StatementExecutor executor) {
    return new SqlBridge(executor);
  }

  static HikariConfig hikariConfig(BackendProperties props) {
    if (isBlank(props.getJdbcUrl())) throw new IllegalStateException("sqlbridge.backend.jdbc-url is not configured");
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(props.getJdbcUrl());
    if (!isBlank(props.getUsername())) hc.setUsername(props.getUsername());
    if (!isBlank(props.getPassword())) hc.setPassword(props.getPassword());
    hc.setMaximumPoolSize(props.getMaximumPoolSize());
    props.getDataSourceProperties().forEach(hc::addDataSourceProperty);
    if (!isBlank(props.getAuthenticator())) hc.addDataSourceProperty("authenticator", props.getAuthenticator());
    if (!isBlank(props.getToken())) hc.addDataSourceProperty("token", props.getToken());
    return hc;
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
