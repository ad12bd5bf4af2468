package ai.pokercoach.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the solution store.
 * <p>
 * {@code store=file} keeps one JSON document per canonical key under {@code directory};
 * {@code store=memory} keeps entries for the life of the process only.
 */
@Component
@ConfigurationProperties(prefix = "cache")
public class CacheProperties {
  private String directory = "cache/solutions";
  private String store = "file";

  public String getDirectory() {
    return directory;
  }

  public void setDirectory(String directory) {
    this.directory = directory;
  }

  public String getStore() {
    return store;
  }

  public void setStore(String store) {
    this.store = store;
  }
}
