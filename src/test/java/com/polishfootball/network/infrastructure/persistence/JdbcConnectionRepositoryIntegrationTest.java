package com.polishfootball.network.infrastructure.persistence;

import com.polishfootball.network.domain.model.Club;
import com.polishfootball.network.domain.model.Connection;
import com.polishfootball.network.domain.model.ConnectionStrength;
import com.polishfootball.network.domain.model.ConnectionType;
import com.polishfootball.network.domain.model.LeagueType;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Testcontainers(disabledWithoutDocker = true)
class JdbcConnectionRepositoryIntegrationTest {

    @Container
    private static final PostgreSQLContainer<?> postgres =
            new PostgreSQLContainer<>("postgres:15-alpine")
                    .withDatabaseName("football_test")
                    .withUsername("test")
                    .withPassword("test");

    private static HikariDataSource dataSource;
    private static JdbcTemplate jdbcTemplate;
    private static JdbcClubRepository clubRepository;
    private static JdbcConnectionRepository repository;

    private Club legia;
    private Club zaglebie;
    private Club radomiak;

    @BeforeAll
    static void setup() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(postgres.getJdbcUrl());
        config.setUsername(postgres.getUsername());
        config.setPassword(postgres.getPassword());
        dataSource = new HikariDataSource(config);

        jdbcTemplate = new JdbcTemplate(dataSource);
        Flyway.configure().dataSource(dataSource).load().migrate();

        clubRepository = new JdbcClubRepository(jdbcTemplate);
        repository = new JdbcConnectionRepository(jdbcTemplate);
    }

    @AfterAll
    static void tearDown() {
        dataSource.close();
    }

    @BeforeEach
    void cleanup() {
        jdbcTemplate.execute("DELETE FROM connections");
        jdbcTemplate.execute("DELETE FROM clubs");

        legia = saveClub("Legia Warszawa", "LEG");
        zaglebie = saveClub("Zagłębie Sosnowiec", "ZAG");
        radomiak = saveClub("Radomiak Radom", "RAD");
    }

    @Test
    void shouldFindConnectionsInBothDirections() {
        // Given
        Connection outgoing = connection(legia, zaglebie, 0.85);
        Connection incoming = connection(radomiak, legia, null);
        Connection unrelated = connection(zaglebie, radomiak, 0.5);
        repository.save(outgoing);
        repository.save(incoming);
        repository.save(unrelated);

        // When & Then
        assertThat(repository.findByClubId(legia.id()))
                .extracting(Connection::id)
                .containsExactlyInAnyOrder(outgoing.id(), incoming.id());
        assertThat(repository.findAll()).hasSize(3);
    }

    @Test
    void shouldRoundTripReliabilityScore() {
        // Given
        Connection scored = connection(legia, zaglebie, 0.85);
        Connection unscored = connection(legia, radomiak, null);

        // When
        repository.save(scored);
        repository.save(unscored);

        // Then
        assertThat(repository.findById(scored.id())).contains(scored);
        assertThat(repository.findById(unscored.id()).orElseThrow().reliabilityScore()).isNull();
    }

    @Test
    void shouldRejectSelfConnectionAtSchemaLevel() {
        assertThatThrownBy(() -> repository.save(connection(legia, legia, null)))
                .isInstanceOf(RuntimeException.class)
                .hasMessageStartingWith("Failed to save connection");
    }

    @Test
    void shouldDeleteConnectionsWithTheirClub() {
        // Given
        Connection connection = connection(legia, zaglebie, 0.7);
        repository.save(connection);

        // When
        clubRepository.deleteById(zaglebie.id());

        // Then
        assertThat(repository.findById(connection.id())).isEmpty();
    }

    @Test
    void shouldUpdateAndDeleteConnection() {
        // Given
        Connection connection = connection(legia, zaglebie, 0.7);
        repository.save(connection);
        Connection updated = new Connection(connection.id(), legia.id(), zaglebie.id(), ConnectionType.RIVALRY,
                ConnectionStrength.VERY_STRONG, "Cup final 2019", 0.95, true, connection.createdAt(),
                Instant.now().truncatedTo(ChronoUnit.MICROS));

        // When & Then
        assertThat(repository.update(updated)).isTrue();
        assertThat(repository.findById(connection.id())).contains(updated);
        assertThat(repository.deleteById(connection.id())).isTrue();
        assertThat(repository.deleteById(connection.id())).isFalse();
    }

    private static Club saveClub(String name, String shortName) {
        Club club = new Club(UUID.randomUUID(), name, shortName, LeagueType.EKSTRAKLASA, "Poland", "Warszawa",
                null, 1920, true, true, false, Instant.now().truncatedTo(ChronoUnit.MICROS), null);
        clubRepository.save(club);
        return club;
    }

    private static Connection connection(Club source, Club target, Double reliability) {
        return new Connection(UUID.randomUUID(), source.id(), target.id(), ConnectionType.FRIENDSHIP,
                ConnectionStrength.MEDIUM, null, reliability, true,
                Instant.now().truncatedTo(ChronoUnit.MICROS), null);
    }
}
