package org.carball.slowq.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.slowq.model.digest.DigestStatement;
import org.carball.slowq.model.digest.SlowLogEntry;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reads MySQL slow query log files and folds their entries into digest statistics.
 */
@Slf4j
public class SlowLogParser {

    private static final Pattern QUERY_TIME_PATTERN = Pattern.compile(
            "#\\s*Query_time:\\s*(\\S+)\\s+Lock_time:\\s*(\\S+)\\s+Rows_sent:\\s*(\\S+)\\s+Rows_examined:\\s*(\\S+)");

    private static final Pattern USE_PATTERN = Pattern.compile("^use\\s+`?([^`;\\s]+)`?;\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TIMESTAMP_PATTERN = Pattern.compile("^SET\\s+timestamp=(\\d+);\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SERVER_HEADER_PATTERN = Pattern.compile(
            "^(?:\\S+, Version: .*|Tcp port:.*|Time\\s+Id\\s+Command\\s+Argument.*)$");

    private static final DateTimeFormatter LEGACY_TIME = DateTimeFormatter.ofPattern("yyMMdd H:mm:ss");
    private static final double MS_PER_SECOND = 1000.0;

    private SlowLogParser() {
        // Utility class - prevent instantiation
    }

    public static List<SlowLogEntry> parse(Path slowLog) throws IOException {
        if (!Files.exists(slowLog)) {
            throw new IOException("Slow query log not found: " + slowLog);
        }
        try (Reader reader = Files.newBufferedReader(slowLog, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    /**
     * Parses slow log entries. Entries with malformed Query_time headers are logged and skipped.
     */
    public static List<SlowLogEntry> parse(Reader reader) throws IOException {
        List<SlowLogEntry> entries = new ArrayList<>();
        BufferedReader lines = reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);

        EntryBuilder current = null;
        LocalDateTime lastTime = null;
        String lastDatabase = null;
        String line;
        int lineNumber = 0;

        while ((line = lines.readLine()) != null) {
            lineNumber++;

            if (line.startsWith("# Time:")) {
                flush(current, entries);
                current = null;
                lastTime = parseTime(line.substring("# Time:".length()).trim(), lineNumber);
            } else if (line.startsWith("# User@Host:")) {
                flush(current, entries);
                current = new EntryBuilder(lastTime, lastDatabase);
                current.userHost = line.substring("# User@Host:".length()).trim();
            } else if (line.startsWith("# Query_time:")) {
                if (current == null || current.sql.length() > 0) {
                    flush(current, entries);
                    current = new EntryBuilder(lastTime, lastDatabase);
                }
                current.parseMetrics(line, lineNumber);
            } else if (line.startsWith("#")) {
                log.trace("Skipping slow log comment at line {}: {}", lineNumber, line);
            } else if (current == null) {
                if (!line.isBlank() && !SERVER_HEADER_PATTERN.matcher(line).matches()) {
                    log.debug("Ignoring text outside of an entry at line {}", lineNumber);
                }
            } else if (current.sql.length() == 0 && USE_PATTERN.matcher(line.trim()).matches()) {
                Matcher use = USE_PATTERN.matcher(line.trim());
                if (use.matches()) {
                    current.database = use.group(1);
                    lastDatabase = current.database;
                }
            } else if (current.sql.length() == 0 && TIMESTAMP_PATTERN.matcher(line.trim()).matches()) {
                Matcher timestamp = TIMESTAMP_PATTERN.matcher(line.trim());
                if (timestamp.matches() && current.time == null) {
                    current.time = LocalDateTime.ofInstant(
                            Instant.ofEpochSecond(Long.parseLong(timestamp.group(1))), ZoneOffset.UTC);
                }
            } else if (SERVER_HEADER_PATTERN.matcher(line).matches()) {
                // Server restart banner in the middle of the file
                flush(current, entries);
                current = null;
            } else {
                if (current.sql.length() > 0) {
                    current.sql.append('\n');
                }
                current.sql.append(line);
            }
        }
        flush(current, entries);

        log.info("Parsed {} slow log entries", entries.size());
        return entries;
    }

    /**
     * Groups entries by normalized statement and computes digest statistics, ordered by total latency.
     */
    public static List<DigestStatement> aggregate(List<SlowLogEntry> entries) {
        Map<String, List<SlowLogEntry>> byDigest = new LinkedHashMap<>();
        Map<String, String> normalizedText = new LinkedHashMap<>();

        for (SlowLogEntry entry : entries) {
            String normalized = StatementNormalizer.normalize(entry.sql());
            String digest = StatementNormalizer.digest(entry.sql());
            byDigest.computeIfAbsent(digest, k -> new ArrayList<>()).add(entry);
            normalizedText.putIfAbsent(digest, normalized);
        }

        List<DigestStatement> digests = new ArrayList<>();
        for (Map.Entry<String, List<SlowLogEntry>> group : byDigest.entrySet()) {
            digests.add(toDigest(group.getKey(), normalizedText.get(group.getKey()), group.getValue()));
        }

        digests.sort(Comparator.comparingDouble(DigestStatement::totalLatencyMs).reversed());
        log.debug("Aggregated {} slow log entries into {} digests", entries.size(), digests.size());
        return digests;
    }

    private static DigestStatement toDigest(String digest, String normalized, List<SlowLogEntry> group) {
        List<Double> latencies = group.stream()
                .map(e -> e.queryTimeSeconds() * MS_PER_SECOND)
                .sorted()
                .collect(Collectors.toList());

        double total = latencies.stream().mapToDouble(Double::doubleValue).sum();
        int rank = (int) Math.ceil(0.95 * latencies.size());

        LocalDateTime firstSeen = group.stream()
                .map(SlowLogEntry::time)
                .filter(t -> t != null)
                .min(Comparator.naturalOrder())
                .orElse(null);
        LocalDateTime lastSeen = group.stream()
                .map(SlowLogEntry::time)
                .filter(t -> t != null)
                .max(Comparator.naturalOrder())
                .orElse(null);

        String schema = group.stream()
                .map(SlowLogEntry::database)
                .filter(d -> d != null)
                .findFirst()
                .orElse(null);

        return DigestStatement.builder()
                .digest(digest)
                .schemaName(schema)
                .digestText(normalized)
                .querySampleText(group.get(0).sql())
                .execCount(group.size())
                .totalLatencyMs(total)
                .avgLatencyMs(total / group.size())
                .maxLatencyMs(latencies.get(latencies.size() - 1))
                .p95LatencyMs(latencies.get(Math.max(rank, 1) - 1))
                .lockLatencyMs(group.stream().mapToDouble(e -> e.lockTimeSeconds() * MS_PER_SECOND).sum())
                .rowsSent(group.stream().mapToLong(SlowLogEntry::rowsSent).sum())
                .rowsExamined(group.stream().mapToLong(SlowLogEntry::rowsExamined).sum())
                .firstSeen(firstSeen)
                .lastSeen(lastSeen)
                .build();
    }

    private static void flush(EntryBuilder current, List<SlowLogEntry> entries) {
        if (current == null) {
            return;
        }
        if (!current.valid) {
            log.warn("Skipping slow log entry with malformed header: {}", current.userHost);
            return;
        }
        if (!current.hasMetrics) {
            log.debug("Skipping slow log entry without Query_time header");
            return;
        }
        String sql = current.sql.toString().trim();
        if (sql.isEmpty()) {
            return;
        }
        if (sql.endsWith(";")) {
            sql = sql.substring(0, sql.length() - 1).trim();
        }
        entries.add(new SlowLogEntry(current.time, current.userHost, current.database,
                current.queryTime, current.lockTime, current.rowsSent, current.rowsExamined, sql));
    }

    private static LocalDateTime parseTime(String value, int lineNumber) {
        try {
            return OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value.replaceAll("\\s+", " "), LEGACY_TIME);
            } catch (DateTimeParseException legacy) {
                log.warn("Unparseable '# Time:' value at line {}: {}", lineNumber, value);
                return null;
            }
        }
    }

    private static final class EntryBuilder {
        private LocalDateTime time;
        private String userHost;
        private String database;
        private double queryTime;
        private double lockTime;
        private long rowsSent;
        private long rowsExamined;
        private boolean hasMetrics;
        private boolean valid = true;
        private final StringBuilder sql = new StringBuilder();

        private EntryBuilder(LocalDateTime time, String database) {
            this.time = time;
            this.database = database;
        }

        private void parseMetrics(String line, int lineNumber) {
            Matcher matcher = QUERY_TIME_PATTERN.matcher(line);
            if (!matcher.find()) {
                log.warn("Malformed Query_time header at line {}: {}", lineNumber, line);
                valid = false;
                return;
            }
            try {
                queryTime = Double.parseDouble(matcher.group(1));
                lockTime = Double.parseDouble(matcher.group(2));
                rowsSent = Long.parseLong(matcher.group(3));
                rowsExamined = Long.parseLong(matcher.group(4));
                hasMetrics = true;
            } catch (NumberFormatException e) {
                log.warn("Invalid number in Query_time header at line {}: {}", lineNumber, line);
                valid = false;
            }
        }
    }
}
