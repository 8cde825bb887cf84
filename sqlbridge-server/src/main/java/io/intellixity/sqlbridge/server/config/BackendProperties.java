package io.intellixity.sqlbridge.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "sqlbridge.backend")
public class BackendProperties {
  private String jdbcUrl;
  private String username;
  private String password;

  /** Session token forwarded to the driver; leave empty for password authentication. */
  private String token;
  private String authenticator;
  private int maximumPoolSize = 10;
  private final Map<String, String> dataSourceProperties = new LinkedHashMap<>();

  public String getJdbcUrl() { return jdbcUrl; }
  public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
  public String getUsername() { return username; }
  public void setUsername(String username) { this.username = username; }
  public String getPassword() { return password; }
  public void setPassword(String password) { this.password = password; }
  public String getToken() { return token; }
  public void setToken(String token) { this.token = token; }
  public String getAuthenticator() { return authenticator; }
  public void setAuthenticator(String authenticator) { this.authenticator = authenticator; }
  public int getMaximumPoolSize() { return maximumPoolSize; }
  public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  public Map<String, String> getDataSourceProperties() { return dataSourceProperties; }
}
