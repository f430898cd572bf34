package com.flagship.tip_ledger.common;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * Instant conversion for JdbcTemplate parameters and row mappers.
 * The PostgreSQL driver does not bind {@link Instant} directly.
 */
public final class JdbcTimestamps {

    private JdbcTimestamps() {
    }

    public static Timestamp of(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    public static Instant read(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }
}
