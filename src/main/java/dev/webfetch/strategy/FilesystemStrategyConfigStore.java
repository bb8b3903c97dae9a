package dev.webfetch.strategy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Strategy config kept as a markdown table in a local file, so it can be read and edited by hand.
 *
 * <pre>
 * | prefix | strategy | notes | created_at |
 * | ------ | -------- | ----- | ---------- |
 * | yelp.com/biz/ | proxy | Auto-discovered via universal fallback | 2026-01-01T00:00:00Z |
 * </pre>
 *
 * <p>Rows with an unknown strategy are skipped. Writes go through a temp file and an atomic move.
 * Upserts are serialized within the process so concurrent learners do not lose each other's
 * entries; two upserts for the same prefix are last-write-wins.
 */
public class FilesystemStrategyConfigStore implements StrategyConfigStore {

  private static final Logger log = LoggerFactory.getLogger(FilesystemStrategyConfigStore.class);

  private static final Pattern UNESCAPED_PIPE = Pattern.compile("(?<!\\\\)\\|");

  private static final String HEADER =
      """
      # Scraping Strategy Configuration

      Which scraping strategy to try first for each URL prefix (native, managed, proxy).
      The longest matching prefix wins.

      | prefix | strategy | notes | created_at |
      | ------ | -------- | ----- | ---------- |""";

  private final Path configPath;
  private final ReentrantLock writeLock = new ReentrantLock();

  public FilesystemStrategyConfigStore(Path configPath) {
    this.configPath = configPath;
  }

  public Path getConfigPath() {
    return configPath;
  }

  @Override
  public List<StrategyConfigEntry> loadConfig() {
    String content;
    try {
      content = Files.readString(configPath, StandardCharsets.UTF_8);
    } catch (NoSuchFileException e) {
      return List.of();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read strategy config " + configPath, e);
    }
    return parseMarkdownTable(content);
  }

  @Override
  public void saveConfig(List<StrategyConfigEntry> entries) {
    writeLock.lock();
    try {
      write(entries);
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public void upsertEntry(StrategyConfigEntry entry) {
    writeLock.lock();
    try {
      List<StrategyConfigEntry> config = new ArrayList<>(loadConfig());
      boolean replaced = false;
      for (int i = 0; i < config.size(); i++) {
        if (config.get(i).prefix().equals(entry.prefix())) {
          config.set(i, entry);
          replaced = true;
          break;
        }
      }
      if (!replaced) {
        config.add(entry);
      }
      write(config);
      log.info(
          "{} strategy config entry {} -> {}",
          replaced ? "Updated" : "Added",
          entry.prefix(),
          entry.strategy());
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public Optional<StrategyName> getStrategyForUrl(String url) {
    return PrefixMatcher.longestMatch(loadConfig(), url).map(StrategyConfigEntry::strategy);
  }

  private void write(List<StrategyConfigEntry> entries) {
    List<StrategyConfigEntry> sorted = new ArrayList<>(entries);
    sorted.sort(Comparator.comparingInt((StrategyConfigEntry e) -> e.prefix().length()).reversed());

    StringBuilder sb = new StringBuilder(HEADER).append('\n');
    for (StrategyConfigEntry entry : sorted) {
      sb.append("| ")
          .append(escape(entry.prefix()))
          .append(" | ")
          .append(entry.strategy().wireName())
          .append(" | ")
          .append(escape(entry.notes()))
          .append(" | ")
          .append(entry.createdAt())
          .append(" |\n");
    }

    try {
      Path parent = configPath.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path temp = configPath.resolveSibling(configPath.getFileName() + ".tmp");
      Files.writeString(temp, sb.toString(), StandardCharsets.UTF_8);
      try {
        Files.move(
            temp, configPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, configPath, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write strategy config " + configPath, e);
    }
  }

  List<StrategyConfigEntry> parseMarkdownTable(String content) {
    List<StrategyConfigEntry> entries = new ArrayList<>();
    boolean headerFound = false;

    for (String line : content.split("\n")) {
      String trimmed = line.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      boolean tableRow = trimmed.startsWith("|") && trimmed.endsWith("|");
      if (!tableRow) {
        if (headerFound) {
          break; // end of table
        }
        continue;
      }
      if (!headerFound) {
        String lower = trimmed.toLowerCase(Locale.ROOT);
        headerFound = lower.contains("prefix") && lower.contains("strategy");
        continue;
      }
      if (trimmed.replace("|", "").replace("-", "").replace(":", "").isBlank()) {
        continue; // separator row
      }
      parseRow(trimmed).ifPresent(entries::add);
    }
    return entries;
  }

  private Optional<StrategyConfigEntry> parseRow(String row) {
    String[] cells = UNESCAPED_PIPE.split(row.substring(1, row.length() - 1), -1);
    if (cells.length < 2) {
      return Optional.empty();
    }
    String prefix = unescape(cells[0].trim());
    String strategyCell = cells[1].trim();
    Optional<StrategyName> strategy = StrategyName.parse(strategyCell);
    if (prefix.isEmpty() || strategy.isEmpty()) {
      log.warn("Skipping strategy config row with unknown strategy '{}': {}", strategyCell, row);
      return Optional.empty();
    }
    String notes = cells.length > 2 ? unescape(cells[2].trim()) : "";
    Instant createdAt = cells.length > 3 ? parseInstant(cells[3].trim()) : Instant.EPOCH;
    return Optional.of(new StrategyConfigEntry(prefix, strategy.get(), notes, createdAt));
  }

  private static Instant parseInstant(String value) {
    if (value.isEmpty()) {
      return Instant.EPOCH;
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      log.warn("Ignoring unparseable created_at '{}' in strategy config", value);
      return Instant.EPOCH;
    }
  }

  private static String escape(String value) {
    return value.replace("\n", " ").replace("|", "\\|");
  }

  private static String unescape(String value) {
    return value.replace("\\|", "|");
  }
}
