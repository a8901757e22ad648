package com.polishfootball.network.application;

import com.fasterxml.jackson.core.type.TypeReference;
import com.polishfootball.network.application.dto.ConnectionDetail;
import com.polishfootball.network.application.dto.PagedResult;
import com.polishfootball.network.application.query.CachedQuery;
import com.polishfootball.network.application.query.CachedQueryPipeline;
import com.polishfootball.network.application.query.ClubConnectionsQuery;
import com.polishfootball.network.application.query.QueryResult;
import com.polishfootball.network.application.query.ResourceNotFoundException;
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

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class ClubConnectionsUseCase implements FindClubConnections,
        CachedQuery<ClubConnectionsQuery, PagedResult<ConnectionDetail>> {

    private static final Logger logger = LoggerFactory.getLogger(ClubConnectionsUseCase.class);

    private static final CacheValueType<PagedResult<ConnectionDetail>> RESULT_TYPE =
            CacheValueType.json(new TypeReference<PagedResult<ConnectionDetail>>() {});

    private final ClubRepository clubRepository;
    private final ConnectionRepository connectionRepository;
    private final CachedQueryPipeline pipeline;
    private final CacheProperties cacheProperties;

    public ClubConnectionsUseCase(ClubRepository clubRepository, ConnectionRepository connectionRepository,
                                  CachedQueryPipeline pipeline, CacheProperties cacheProperties) {
        this.clubRepository = clubRepository;
        this.connectionRepository = connectionRepository;
        this.pipeline = pipeline;
        this.cacheProperties = cacheProperties;
    }

    @Override
    public QueryResult<PagedResult<ConnectionDetail>> execute(ClubConnectionsQuery query) {
        return pipeline.execute(this, query);
    }

    @Override
    public String name() {
        return "club connections";
    }

    @Override
    public String cacheKey(ClubConnectionsQuery query) {
        return CacheKeyBuilder.forNamespace(CacheNamespaces.CLUB_CONNECTIONS)
                .segment(query.clubId())
                .token("page", query.page())
                .token("size", query.pageSize())
                .flag("verified", query.verifiedOnly())
                .build();
    }

    @Override
    public CacheValueType<PagedResult<ConnectionDetail>> resultType() {
        return RESULT_TYPE;
    }

    @Override
    public Duration ttl() {
        return cacheProperties.getClubConnectionsTtl();
    }

    @Override
    public PagedResult<ConnectionDetail> load(ClubConnectionsQuery query) {
        UUID clubId = query.clubId();
        if (clubRepository.findById(clubId).isEmpty()) {
            throw ResourceNotFoundException.club(clubId);
        }

        List<Connection> connections = connectionRepository.findByClubId(clubId).stream()
                .filter(connection -> !query.verifiedOnly() || connection.verified())
                .toList();

        Set<UUID> relatedIds = connections.stream()
                .map(connection -> connection.otherEnd(clubId))
                .collect(Collectors.toSet());
        Map<UUID, Club> relatedClubs = clubRepository.findByIds(relatedIds).stream()
                .collect(Collectors.toMap(Club::id, Function.identity()));

        List<ConnectionDetail> details = connections.stream()
                .filter(connection -> relatedClubs.containsKey(connection.otherEnd(clubId)))
                .map(connection -> ConnectionDetail.of(connection, relatedClubs.get(connection.otherEnd(clubId))))
                .toList();

        PagedResult<ConnectionDetail> result = PagedResult.slice(details, query.page(), query.pageSize());
        logger.info("Retrieved {} connections for club {}", result.items().size(), clubId);
        return result;
    }
}
