package com.polishfootball.network.application;

import com.fasterxml.jackson.core.type.TypeReference;
import com.polishfootball.network.application.dto.ConnectionSummary;
import com.polishfootball.network.application.dto.PagedResult;
import com.polishfootball.network.application.query.CachedQuery;
import com.polishfootball.network.application.query.CachedQueryPipeline;
import com.polishfootball.network.application.query.ConnectionSearchQuery;
import com.polishfootball.network.application.query.QueryResult;
import com.polishfootball.network.domain.model.Club;
import com.polishfootball.network.domain.model.Connection;
import com.polishfootball.network.domain.model.ConnectionSortField;
import com.polishfootball.network.domain.port.out.ClubRepository;
import com.polishfootball.network.domain.port.out.ConnectionRepository;
import com.polishfootball.network.infrastructure.cache.CacheKeyBuilder;
import com.polishfootball.network.infrastructure.cache.CacheNamespaces;
import com.polishfootball.network.infrastructure.cache.CacheProperties;
import com.polishfootball.network.infrastructure.cache.CacheValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
public class ConnectionSearchUseCase implements FindConnections,
        CachedQuery<ConnectionSearchQuery, PagedResult<ConnectionSummary>> {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionSearchUseCase.class);

    private static final CacheValueType<PagedResult<ConnectionSummary>> RESULT_TYPE =
            CacheValueType.json(new TypeReference<PagedResult<ConnectionSummary>>() {});

    private final ConnectionRepository connectionRepository;
    private final ClubRepository clubRepository;
    private final CachedQueryPipeline pipeline;
    private final CacheProperties cacheProperties;

    public ConnectionSearchUseCase(ConnectionRepository connectionRepository, ClubRepository clubRepository,
                                   CachedQueryPipeline pipeline, CacheProperties cacheProperties) {
        this.connectionRepository = connectionRepository;
        this.clubRepository = clubRepository;
        this.pipeline = pipeline;
        this.cacheProperties = cacheProperties;
    }

    @Override
    public QueryResult<PagedResult<ConnectionSummary>> execute(ConnectionSearchQuery query) {
        return pipeline.execute(this, query);
    }

    @Override
    public String name() {
        return "connections";
    }

    @Override
    public String cacheKey(ConnectionSearchQuery query) {
        CacheKeyBuilder key = CacheKeyBuilder.forNamespace(CacheNamespaces.CONNECTIONS)
                .token("page", query.page())
                .token("size", query.pageSize())
                .tokenIfPresent("type", query.type())
                .tokenIfPresent("strength", query.strength())
                .tokenIfPresent("verified", query.verified())
                .tokenIfPresent("club", query.clubId())
                .tokenIfPresent("reliability", query.minReliabilityScore());

        if (!query.hasDefaultSort()) {
            String direction = query.descending() ? "desc" : "asc";
            key.caseInsensitiveTokenIfPresent("sort", query.resolvedSortField().fieldName() + "-" + direction);
        }
        return key.build();
    }

    @Override
    public CacheValueType<PagedResult<ConnectionSummary>> resultType() {
        return RESULT_TYPE;
    }

    @Override
    public Duration ttl() {
        return cacheProperties.getConnectionsTtl();
    }

    @Override
    public PagedResult<ConnectionSummary> load(ConnectionSearchQuery query) {
        List<Connection> connections = filtered(query).toList();

        Set<UUID> clubIds = connections.stream()
                .flatMap(connection -> Stream.of(connection.sourceClubId(), connection.targetClubId()))
                .collect(Collectors.toSet());
        Map<UUID, Club> clubs = clubIds.isEmpty()
                ? Map.of()
                : clubRepository.findByIds(clubIds).stream().collect(Collectors.toMap(Club::id, Function.identity()));

        List<ConnectionSummary> summaries = connections.stream()
                .filter(connection -> clubs.containsKey(connection.sourceClubId())
                        && clubs.containsKey(connection.targetClubId()))
                .map(connection -> ConnectionSummary.of(connection,
                        clubs.get(connection.sourceClubId()), clubs.get(connection.targetClubId())))
                .sorted(ordering(query.resolvedSortField(), query.descending()))
                .toList();

        PagedResult<ConnectionSummary> result = PagedResult.slice(summaries, query.page(), query.pageSize());
        logger.info("Retrieved {} connections for page {} ({} matching)",
                result.items().size(), query.page(), result.totalCount());
        return result;
    }

    private Stream<Connection> filtered(ConnectionSearchQuery query) {
        List<Connection> source = query.clubId() != null
                ? connectionRepository.findByClubId(query.clubId())
                : connectionRepository.findAll();

        Double minReliability = query.minReliabilityScore();
        return source.stream()
                .filter(connection -> query.type() == null || connection.type() == query.type())
                .filter(connection -> query.strength() == null || connection.strength() == query.strength())
                .filter(connection -> query.verified() == null || connection.verified() == query.verified())
                .filter(connection -> minReliability == null
                        || (connection.reliabilityScore() != null && connection.reliabilityScore() >= minReliability));
    }

    private static Comparator<ConnectionSummary> ordering(ConnectionSortField field, boolean descending) {
        Comparator<ConnectionSummary> comparator = switch (field) {
            case TYPE -> Comparator.comparing(ConnectionSummary::type);
            case STRENGTH -> Comparator.comparing(ConnectionSummary::strength);
            case RELIABILITY_SCORE -> Comparator.comparing(ConnectionSummary::reliabilityScore,
                    Comparator.nullsFirst(Comparator.<Double>naturalOrder()));
            case CREATED_AT -> Comparator.comparing(ConnectionSummary::createdAt);
        };
        if (descending) {
            comparator = comparator.reversed();
        }
        // ties keep a stable page order
        return comparator.thenComparing(ConnectionSummary::id);
    }
}
