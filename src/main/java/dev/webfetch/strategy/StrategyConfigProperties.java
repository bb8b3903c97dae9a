package dev.webfetch.strategy;

import java.nio.file.Path;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Location of the learned strategy table, bound from {@code webfetch.strategy-config.*}.
 *
 * @param path file path; defaults to {@code ~/.webfetch/strategy-config.md}
 */
@ConfigurationProperties(prefix = "webfetch.strategy-config")
public record StrategyConfigProperties(@Nullable Path path) {

  public StrategyConfigProperties {
    path =
        path == null
            ? Path.of(System.getProperty("user.home"), ".webfetch", "strategy-config.md")
            : path;
  }
}
