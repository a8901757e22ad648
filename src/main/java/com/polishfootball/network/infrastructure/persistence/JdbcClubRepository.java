package com.polishfootball.network.infrastructure.persistence;

import com.polishfootball.network.domain.model.Club;
import com.polishfootball.network.domain.model.ClubSearchCriteria;
import com.polishfootball.network.domain.model.ClubSortField;
import com.polishfootball.network.domain.model.LeagueType;
import com.polishfootball.network.domain.model.RecordPage;
import com.polishfootball.network.domain.port.out.ClubRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL implementation of ClubRepository.
 * Read failures are logged and rethrown so callers never cache a partial result.
 */
@Repository
public class JdbcClubRepository implements ClubRepository {

    private static final Logger logger = LoggerFactory.getLogger(JdbcClubRepository.class);

    private static final String SELECT_COLUMNS = """
            SELECT id, name, short_name, league, country, city, logo_path, founded,
                   is_active, is_verified, is_featured, created_at, modified_at
            FROM clubs
            """;

    // whitelisted ORDER BY columns, never built from request text
    private static final Map<ClubSortField, String> SORT_COLUMNS = new EnumMap<>(Map.of(
            ClubSortField.NAME, "name",
            ClubSortField.SHORT_NAME, "short_name",
            ClubSortField.LEAGUE, "league",
            ClubSortField.FOUNDED_YEAR, "founded",
            ClubSortField.CITY, "city",
            ClubSortField.CREATED_AT, "created_at"
    ));

    private static final RowMapper<Club> CLUB_ROW_MAPPER = (rs, rowNum) -> new Club(
            UUID.fromString(rs.getString("id")),
            rs.getString("name"),
            rs.getString("short_name"),
            LeagueType.valueOf(rs.getString("league")),
            rs.getString("country"),
            rs.getString("city"),
            rs.getString("logo_path"),
            rs.getObject("founded", Integer.class),
            rs.getBoolean("is_active"),
            rs.getBoolean("is_verified"),
            rs.getBoolean("is_featured"),
            rs.getTimestamp("created_at").toInstant(),
            JdbcTimestamps.toInstant(rs.getTimestamp("modified_at"))
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcClubRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public RecordPage<Club> findPage(ClubSearchCriteria criteria) {
        List<String> conditions = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        if (criteria.searchTerm() != null) {
            String like = "%" + escapeLike(criteria.searchTerm()) + "%";
            conditions.add("(name ILIKE ? OR short_name ILIKE ? OR city ILIKE ?)");
            params.add(like);
            params.add(like);
            params.add(like);
        }
        if (criteria.league() != null) {
            conditions.add("league = ?");
            params.add(criteria.league().name());
        }
        if (criteria.city() != null) {
            conditions.add("LOWER(city) = LOWER(?)");
            params.add(criteria.city());
        }
        if (criteria.active() != null) {
            conditions.add("is_active = ?");
            params.add(criteria.active());
        }
        if (criteria.verified() != null) {
            conditions.add("is_verified = ?");
            params.add(criteria.verified());
        }
        if (criteria.featured() != null) {
            conditions.add("is_featured = ?");
            params.add(criteria.featured());
        }
        if (criteria.foundedYearFrom() != null) {
            conditions.add("founded >= ?");
            params.add(criteria.foundedYearFrom());
        }
        if (criteria.foundedYearTo() != null) {
            conditions.add("founded <= ?");
            params.add(criteria.foundedYearTo());
        }

        String where = conditions.isEmpty() ? "" : "WHERE " + String.join(" AND ", conditions) + "\n";
        String orderBy = "ORDER BY " + SORT_COLUMNS.get(criteria.sortField())
                + (criteria.descending() ? " DESC" : " ASC") + " NULLS LAST, id\n";

        try {
            Long total = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM clubs\n" + where, Long.class, params.toArray());
            if (total == null || total == 0) {
                return RecordPage.empty();
            }

            List<Object> pageParams = new ArrayList<>(params);
            pageParams.add(criteria.pageSize());
            pageParams.add(criteria.offset());

            List<Club> clubs = jdbcTemplate.query(SELECT_COLUMNS + where + orderBy + "LIMIT ? OFFSET ?",
                    CLUB_ROW_MAPPER, pageParams.toArray());

            logger.debug("Club search matched {} records, returning {}", total, clubs.size());
            return new RecordPage<>(clubs, total);

        } catch (DataAccessException e) {
            logger.error("Database error while searching clubs with {}", criteria, e);
            throw e;
        }
    }

    @Override
    public Optional<Club> findById(UUID id) {
        try {
            List<Club> clubs = jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?::uuid", CLUB_ROW_MAPPER, id.toString());
            return clubs.stream().findFirst();
        } catch (DataAccessException e) {
            logger.error("Database error while finding club {}", id, e);
            throw e;
        }
    }

    @Override
    public List<Club> findByIds(Collection<UUID> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }

        String placeholders = String.join(", ", Collections.nCopies(ids.size(), "?::uuid"));
        Object[] params = ids.stream().map(UUID::toString).toArray();

        try {
            return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id IN (" + placeholders + ")", CLUB_ROW_MAPPER, params);
        } catch (DataAccessException e) {
            logger.error("Database error while finding {} clubs by id", ids.size(), e);
            throw e;
        }
    }

    @Override
    public List<Club> findAll() {
        try {
            return jdbcTemplate.query(SELECT_COLUMNS + "ORDER BY name, id", CLUB_ROW_MAPPER);
        } catch (DataAccessException e) {
            logger.error("Database error while loading all clubs", e);
            throw e;
        }
    }

    @Override
    public void save(Club club) {
        String sql = """
            INSERT INTO clubs (
                id, name, short_name, league, country, city, logo_path, founded,
                is_active, is_verified, is_featured, created_at, modified_at
            ) VALUES (?::uuid, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        try {
            jdbcTemplate.update(sql,
                    club.id().toString(),
                    club.name(),
                    club.shortName(),
                    club.league().name(),
                    club.country(),
                    club.city(),
                    club.logoPath(),
                    club.founded(),
                    club.active(),
                    club.verified(),
                    club.featured(),
                    Timestamp.from(club.createdAt()),
                    JdbcTimestamps.toTimestamp(club.modifiedAt()));
        } catch (DataAccessException e) {
            logger.error("Error saving club {}", club.id(), e);
            throw new RuntimeException("Failed to save club " + club.id(), e);
        }
    }

    @Override
    public boolean update(Club club) {
        String sql = """
            UPDATE clubs
            SET name = ?, short_name = ?, league = ?, country = ?, city = ?, logo_path = ?, founded = ?,
                is_active = ?, is_verified = ?, is_featured = ?, modified_at = ?
            WHERE id = ?::uuid
            """;

        try {
            int updated = jdbcTemplate.update(sql,
                    club.name(),
                    club.shortName(),
                    club.league().name(),
                    club.country(),
                    club.city(),
                    club.logoPath(),
                    club.founded(),
                    club.active(),
                    club.verified(),
                    club.featured(),
                    JdbcTimestamps.toTimestamp(club.modifiedAt()),
                    club.id().toString());
            return updated > 0;
        } catch (DataAccessException e) {
            logger.error("Error updating club {}", club.id(), e);
            throw new RuntimeException("Failed to update club " + club.id(), e);
        }
    }

    @Override
    public boolean deleteById(UUID id) {
        try {
            return jdbcTemplate.update("DELETE FROM clubs WHERE id = ?::uuid", id.toString()) > 0;
        } catch (DataAccessException e) {
            logger.error("Error deleting club {}", id, e);
            throw new RuntimeException("Failed to delete club " + id, e);
        }
    }

    static String escapeLike(String term) {
        return term.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
