package org.carball.slowq.model.digest;

import java.time.LocalDateTime;

/**
 * One statement from a MySQL slow query log. Times are in seconds, as the log writes them.
 */
public record SlowLogEntry(
        LocalDateTime time,
        String userHost,
        String database,
        double queryTimeSeconds,
        double lockTimeSeconds,
        long rowsSent,
        long rowsExamined,
        String sql
) {}
