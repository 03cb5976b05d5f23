package herald.engine.store;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Binds and reads {@code TIMESTAMP WITH TIME ZONE} columns as UTC offsets.
 * java.sql.Timestamp is avoided: it converts through the JVM default zone,
 * which repeats or skips an hour around DST changes.
 */
final class SqlInstants {

    private SqlInstants() {
    }

    static OffsetDateTime utc(Instant instant) {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }

    static void bind(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setObject(index, utc(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        }
    }

    static Instant read(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }
}
