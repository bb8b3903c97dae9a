package dev.webfetch.strategy;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the file-backed {@link StrategyConfigStore}. */
@Configuration
@EnableConfigurationProperties(StrategyConfigProperties.class)
public class StrategyConfigConfig {

  private static final Logger log = LoggerFactory.getLogger(StrategyConfigConfig.class);

  @Bean
  public StrategyConfigStore strategyConfigStore(StrategyConfigProperties properties) {
    var store = new FilesystemStrategyConfigStore(Objects.requireNonNull(properties.path()));
    log.info("Strategy config file: {}", store.getConfigPath().toAbsolutePath());
    return store;
  }
}
