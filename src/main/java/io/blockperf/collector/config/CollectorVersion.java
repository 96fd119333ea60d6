package io.blockperf.collector.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the collector version reported as {@code bpVersion} in samples and as the metrics service version.
 *
 * @since 0.1.0
 */
public final class CollectorVersion {
  private static final Logger log = LoggerFactory.getLogger(CollectorVersion.class);
  private static final String POM_PROPERTIES = "/META-INF/maven/io.blockperf/blockperf-collector/pom.properties";
  private static final String DEVELOPMENT_VERSION = "0.1.0-dev";

  private static volatile String cached;

  private CollectorVersion() {}

  /**
   * Returns the manifest implementation version, else the Maven {@code pom.properties} version, else a development
   * placeholder.
   *
   * @return collector version
   */
  public static String current() {
    String version = cached;
    if (version == null) {
      version = detect();
      cached = version;
    }
    return version;
  }

  private static String detect() {
    Package pkg = CollectorVersion.class.getPackage();
    if (pkg != null) {
      String impl = pkg.getImplementationVersion();
      if (impl != null && !impl.isBlank()) {
        return impl;
      }
    }
    try (InputStream in = CollectorVersion.class.getResourceAsStream(POM_PROPERTIES)) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = props.getProperty("version");
        if (version != null && !version.isBlank()) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to read pom.properties for version detection", ex);
    }
    return DEVELOPMENT_VERSION;
  }
}
