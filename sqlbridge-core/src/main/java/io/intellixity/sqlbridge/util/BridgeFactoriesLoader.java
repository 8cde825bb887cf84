package io.intellixity.sqlbridge.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * spring.factories-style loader for sqlbridge extension points.\n
 *
 * Reads every {@code META-INF/sqlbridge.factories} resource on the classpath.\n
 * Each resource is a Java Properties file of the form:\n
 *\n
 * <pre>\n
 * io.intellixity.sqlbridge.spi.translate.TranslatorProvider=com.acme.StageTranslators,com.acme.UserTranslators\n
 * </pre>\n
 *
 * Values may be comma-separated. Duplicate class names load once, first occurrence wins.\n
 */
public final class BridgeFactoriesLoader {
  public static final String RESOURCE = "META-INF/sqlbridge.factories";

  private BridgeFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = BridgeFactoriesLoader.class.getClassLoader();

    LinkedHashSet<String> implNames = new LinkedHashSet<>();
    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }

    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
      }
      String v = p.getProperty(spiType.getName());
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) implNames.add(name);
      }
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) out.add(newInstance(implName, spiType, cl));
    return out;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Unknown class " + implName + " for SPI " + spiType.getName(), e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}
