package com.polishfootball.network.infrastructure.persistence;

import com.polishfootball.network.domain.model.Connection;
import com.polishfootball.network.domain.model.ConnectionStrength;
import com.polishfootball.network.domain.model.ConnectionType;
import com.polishfootball.network.domain.port.out.ConnectionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcConnectionRepository implements ConnectionRepository {

    private static final Logger logger = LoggerFactory.getLogger(JdbcConnectionRepository.class);

    private static final String SELECT_COLUMNS = """
            SELECT id, source_club_id, target_club_id, connection_type, strength, description,
                   reliability_score, is_verified, created_at, modified_at
            FROM connections
            """;

    private static final RowMapper<Connection> CONNECTION_ROW_MAPPER = (rs, rowNum) -> {
        BigDecimal reliability = rs.getBigDecimal("reliability_score");
        return new Connection(
                UUID.fromString(rs.getString("id")),
                UUID.fromString(rs.getString("source_club_id")),
                UUID.fromString(rs.getString("target_club_id")),
                ConnectionType.valueOf(rs.getString("connection_type")),
                ConnectionStrength.valueOf(rs.getString("strength")),
                rs.getString("description"),
                reliability == null ? null : reliability.doubleValue(),
                rs.getBoolean("is_verified"),
                rs.getTimestamp("created_at").toInstant(),
                JdbcTimestamps.toInstant(rs.getTimestamp("modified_at"))
        );
    };

    private final JdbcTemplate jdbcTemplate;

    public JdbcConnectionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Connection> findByClubId(UUID clubId) {
        String sql = SELECT_COLUMNS + """
            WHERE source_club_id = ?::uuid OR target_club_id = ?::uuid
            ORDER BY created_at, id
            """;

        try {
            return jdbcTemplate.query(sql, CONNECTION_ROW_MAPPER, clubId.toString(), clubId.toString());
        } catch (DataAccessException e) {
            logger.error("Database error while finding connections of club {}", clubId, e);
            throw e;
        }
    }

    @Override
    public Optional<Connection> findById(UUID id) {
        try {
            return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?::uuid", CONNECTION_ROW_MAPPER, id.toString())
                    .stream()
                    .findFirst();
        } catch (DataAccessException e) {
            logger.error("Database error while finding connection {}", id, e);
            throw e;
        }
    }

    @Override
    public List<Connection> findAll() {
        try {
            return jdbcTemplate.query(SELECT_COLUMNS + "ORDER BY created_at, id", CONNECTION_ROW_MAPPER);
        } catch (DataAccessException e) {
            logger.error("Database error while loading all connections", e);
            throw e;
        }
    }

    @Override
    public void save(Connection connection) {
        String sql = """
            INSERT INTO connections (
                id, source_club_id, target_club_id, connection_type, strength, description,
                reliability_score, is_verified, created_at, modified_at
            ) VALUES (?::uuid, ?::uuid, ?::uuid, ?, ?, ?, ?, ?, ?, ?)
            """;

        try {
            jdbcTemplate.update(sql,
                    connection.id().toString(),
                    connection.sourceClubId().toString(),
                    connection.targetClubId().toString(),
                    connection.type().name(),
                    connection.strength().name(),
                    connection.description(),
                    toDecimal(connection.reliabilityScore()),
                    connection.verified(),
                    Timestamp.from(connection.createdAt()),
                    JdbcTimestamps.toTimestamp(connection.modifiedAt()));
        } catch (DataAccessException e) {
            logger.error("Error saving connection {}", connection.id(), e);
            throw new RuntimeException("Failed to save connection " + connection.id(), e);
        }
    }

    @Override
    public boolean update(Connection connection) {
        String sql = """
            UPDATE connections
            SET source_club_id = ?::uuid, target_club_id = ?::uuid, connection_type = ?, strength = ?,
                description = ?, reliability_score = ?, is_verified = ?, modified_at = ?
            WHERE id = ?::uuid
            """;

        try {
            int updated = jdbcTemplate.update(sql,
                    connection.sourceClubId().toString(),
                    connection.targetClubId().toString(),
                    connection.type().name(),
                    connection.strength().name(),
                    connection.description(),
                    toDecimal(connection.reliabilityScore()),
                    connection.verified(),
                    JdbcTimestamps.toTimestamp(connection.modifiedAt()),
                    connection.id().toString());
            return updated > 0;
        } catch (DataAccessException e) {
            logger.error("Error updating connection {}", connection.id(), e);
            throw new RuntimeException("Failed to update connection " + connection.id(), e);
        }
    }

    @Override
    public boolean deleteById(UUID id) {
        try {
            return jdbcTemplate.update("DELETE FROM connections WHERE id = ?::uuid", id.toString()) > 0;
        } catch (DataAccessException e) {
            logger.error("Error deleting connection {}", id, e);
            throw new RuntimeException("Failed to delete connection " + id, e);
        }
    }

    private static BigDecimal toDecimal(Double value) {
        return value == null ? null : BigDecimal.valueOf(value);
    }
}
