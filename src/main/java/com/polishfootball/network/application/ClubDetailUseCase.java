package com.polishfootball.network.application;

import com.polishfootball.network.application.dto.ClubDetail;
import com.polishfootball.network.application.dto.ConnectionDetail;
import com.polishfootball.network.application.query.CachedQuery;
import com.polishfootball.network.application.query.CachedQueryPipeline;
import com.polishfootball.network.application.query.ClubDetailQuery;
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
public class ClubDetailUseCase implements FindClubDetail, CachedQuery<ClubDetailQuery, ClubDetail> {

    private static final Logger logger = LoggerFactory.getLogger(ClubDetailUseCase.class);

    private static final CacheValueType<ClubDetail> RESULT_TYPE = CacheValueType.json(ClubDetail.class);

    private final ClubRepository clubRepository;
    private final ConnectionRepository connectionRepository;
    private final CachedQueryPipeline pipeline;
    private final CacheProperties cacheProperties;

    public ClubDetailUseCase(ClubRepository clubRepository, ConnectionRepository connectionRepository,
                             CachedQueryPipeline pipeline, CacheProperties cacheProperties) {
        this.clubRepository = clubRepository;
        this.connectionRepository = connectionRepository;
        this.pipeline = pipeline;
        this.cacheProperties = cacheProperties;
    }

    @Override
    public QueryResult<ClubDetail> execute(ClubDetailQuery query) {
        return pipeline.execute(this, query);
    }

    @Override
    public String name() {
        return "club";
    }

    @Override
    public String cacheKey(ClubDetailQuery query) {
        return CacheKeyBuilder.forNamespace(CacheNamespaces.CLUB_DETAIL)
                .segment(query.clubId())
                .flag("with-connections", query.includeConnections())
                .build();
    }

    @Override
    public CacheValueType<ClubDetail> resultType() {
        return RESULT_TYPE;
    }

    @Override
    public Duration ttl() {
        return cacheProperties.getClubDetailTtl();
    }

    @Override
    public ClubDetail load(ClubDetailQuery query) {
        UUID clubId = query.clubId();
        Club club = clubRepository.findById(clubId)
                .orElseThrow(() -> ResourceNotFoundException.club(clubId));

        List<ConnectionDetail> connections = query.includeConnections() ? connectionsOf(clubId) : List.of();

        logger.info("Retrieved club detail: {} - {} ({} connections)", club.id(), club.name(), connections.size());
        return ClubDetail.fromClub(club, connections);
    }

    private List<ConnectionDetail> connectionsOf(UUID clubId) {
        List<Connection> connections = connectionRepository.findByClubId(clubId);
        if (connections.isEmpty()) {
            return List.of();
        }

        Set<UUID> relatedIds = connections.stream()
                .map(connection -> connection.otherEnd(clubId))
                .collect(Collectors.toSet());
        Map<UUID, Club> relatedClubs = clubRepository.findByIds(relatedIds).stream()
                .collect(Collectors.toMap(Club::id, Function.identity()));

        return connections.stream()
                .filter(connection -> relatedClubs.containsKey(connection.otherEnd(clubId)))
                .map(connection -> ConnectionDetail.of(connection, relatedClubs.get(connection.otherEnd(clubId))))
                .toList();
    }
}
