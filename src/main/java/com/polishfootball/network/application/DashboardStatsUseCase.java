package com.polishfootball.network.application;

import com.polishfootball.network.application.dto.DashboardStats;
import com.polishfootball.network.application.query.CachedQuery;
import com.polishfootball.network.application.query.CachedQueryPipeline;
import com.polishfootball.network.application.query.DashboardStatsQuery;
import com.polishfootball.network.application.query.QueryResult;
import com.polishfootball.network.domain.model.Club;
import com.polishfootball.network.domain.model.Connection;
import com.polishfootball.network.domain.port.out.ClubRepository;
import com.polishfootball.network.domain.port.out.ConnectionRepository;
import com.polishfootball.network.infrastructure.cache.CacheKeyBuilder;
import com.polishfootball.network.infrastructure.cache.CacheNamespaces;
import com.polishfootball.network.infrastructure.cache.CacheProperties;
import com.polishfootball.network.infrastructure.cache.CacheValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
public class DashboardStatsUseCase implements FindDashboardStats, CachedQuery<DashboardStatsQuery, DashboardStats> {

    private static final Logger logger = LoggerFactory.getLogger(DashboardStatsUseCase.class);

    private static final CacheValueType<DashboardStats> RESULT_TYPE = CacheValueType.json(DashboardStats.class);

    private static final int RECENT_ACTIVITY_DAYS = 30;

    private final ClubRepository clubRepository;
    private final ConnectionRepository connectionRepository;
    private final CachedQueryPipeline pipeline;
    private final CacheProperties cacheProperties;
    private final Clock clock;

    public DashboardStatsUseCase(ClubRepository clubRepository, ConnectionRepository connectionRepository,
                                 CachedQueryPipeline pipeline, CacheProperties cacheProperties, Clock clock) {
        this.clubRepository = clubRepository;
        this.connectionRepository = connectionRepository;
        this.pipeline = pipeline;
        this.cacheProperties = cacheProperties;
        this.clock = clock;
    }

    @Override
    public QueryResult<DashboardStats> execute(DashboardStatsQuery query) {
        return pipeline.execute(this, query);
    }

    @Override
    public String name() {
        return "dashboard statistics";
    }

    @Override
    public String cacheKey(DashboardStatsQuery query) {
        return CacheKeyBuilder.forNamespace(CacheNamespaces.DASHBOARD_STATS)
                .tokenIfPresent("start", query.startDate())
                .tokenIfPresent("end", query.endDate())
                .flag("detailed", query.includeDetails())
                .build();
    }

    @Override
    public CacheValueType<DashboardStats> resultType() {
        return RESULT_TYPE;
    }

    @Override
    public Duration ttl() {
        return cacheProperties.getDashboardStatsTtl();
    }

    @Override
    public DashboardStats load(DashboardStatsQuery query) {
        Predicate<Instant> inWindow = createdWithin(query);

        List<Club> clubs = clubRepository.findAll().stream()
                .filter(club -> inWindow.test(club.createdAt()))
                .toList();
        List<Connection> connections = connectionRepository.findAll().stream()
                .filter(connection -> inWindow.test(connection.createdAt()))
                .toList();

        Map<String, Long> clubsByLeague = null;
        Map<String, Long> connectionsByType = null;
        Map<String, Long> connectionsByStrength = null;
        DashboardStats.RecentActivity recentActivity = null;

        if (query.includeDetails()) {
            clubsByLeague = countBy(clubs, club -> club.league().name());
            connectionsByType = countBy(connections, connection -> connection.type().name());
            connectionsByStrength = countBy(connections, connection -> connection.strength().name());
            recentActivity = recentActivity(clubs, connections);
        }

        DashboardStats stats = new DashboardStats(
                clubs.size(),
                clubs.stream().filter(Club::active).count(),
                clubs.stream().filter(Club::verified).count(),
                clubs.stream().filter(Club::featured).count(),
                connections.size(),
                connections.stream().filter(Connection::verified).count(),
                clubs.stream().filter(club -> club.logoPath() != null && !club.logoPath().isBlank()).count(),
                clock.instant(),
                clubsByLeague,
                connectionsByType,
                connectionsByStrength,
                recentActivity
        );

        logger.info("Generated dashboard stats: {} clubs, {} connections", stats.totalClubs(), stats.totalConnections());
        return stats;
    }

    private DashboardStats.RecentActivity recentActivity(List<Club> clubs, List<Connection> connections) {
        Instant since = clock.instant().minus(RECENT_ACTIVITY_DAYS, ChronoUnit.DAYS);

        Instant lastModification = Stream.concat(
                        clubs.stream().map(Club::modifiedAt),
                        connections.stream().map(Connection::modifiedAt))
                .filter(Objects::nonNull)
                .max(Instant::compareTo)
                .orElse(null);

        return new DashboardStats.RecentActivity(
                clubs.stream().filter(club -> !club.createdAt().isBefore(since)).count(),
                connections.stream().filter(connection -> !connection.createdAt().isBefore(since)).count(),
                lastModification
        );
    }

    // both bounds are whole UTC days, inclusive
    private static Predicate<Instant> createdWithin(DashboardStatsQuery query) {
        Instant from = query.startDate() == null ? null : query.startDate().atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant until = query.endDate() == null ? null
                : query.endDate().plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();

        return createdAt -> (from == null || !createdAt.isBefore(from))
                && (until == null || createdAt.isBefore(until));
    }

    private static <T> Map<String, Long> countBy(List<T> items, Function<T, String> category) {
        return items.stream().collect(Collectors.groupingBy(category, TreeMap::new, Collectors.counting()));
    }
}
