package com.polishfootball.network.infrastructure.persistence;

import java.sql.Timestamp;
import java.time.Instant;

final class JdbcTimestamps {

    private JdbcTimestamps() {
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}
