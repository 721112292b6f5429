package io.github.hotbrkm.autobulk.dispatcher.store;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Instant conversion for {@code TIMESTAMP WITH TIME ZONE} columns.
 * Values are truncated to microseconds, the column precision, so a stored instant reads back unchanged.
 */
final class JdbcTimestamps {

    private JdbcTimestamps() {
    }

    static OffsetDateTime toColumn(Instant instant) {
        if (instant == null) {
            return null;
        }
        return OffsetDateTime.ofInstant(instant.truncatedTo(ChronoUnit.MICROS), ZoneOffset.UTC);
    }

    static Instant read(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }
}
