package com.polishfootball.network.application;

import com.fasterxml.jackson.core.type.TypeReference;
import com.polishfootball.network.application.dto.ClubSummary;
import com.polishfootball.network.application.dto.PagedResult;
import com.polishfootball.network.application.query.CachedQuery;
import com.polishfootball.network.application.query.CachedQueryPipeline;
import com.polishfootball.network.application.query.ClubSearchQuery;
import com.polishfootball.network.application.query.QueryResult;
import com.polishfootball.network.domain.model.Club;
import com.polishfootball.network.domain.model.RecordPage;
import com.polishfootball.network.domain.port.out.ClubRepository;
import com.polishfootball.network.infrastructure.cache.CacheKeyBuilder;
import com.polishfootball.network.infrastructure.cache.CacheNamespaces;
import com.polishfootball.network.infrastructure.cache.CacheProperties;
import com.polishfootball.network.infrastructure.cache.CacheValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

@Service
public class ClubSearchUseCase implements FindClubs, CachedQuery<ClubSearchQuery, PagedResult<ClubSummary>> {

    private static final Logger logger = LoggerFactory.getLogger(ClubSearchUseCase.class);

    private static final CacheValueType<PagedResult<ClubSummary>> RESULT_TYPE =
            CacheValueType.json(new TypeReference<PagedResult<ClubSummary>>() {});

    private final ClubRepository clubRepository;
    private final CachedQueryPipeline pipeline;
    private final CacheProperties cacheProperties;

    public ClubSearchUseCase(ClubRepository clubRepository, CachedQueryPipeline pipeline,
                             CacheProperties cacheProperties) {
        this.clubRepository = clubRepository;
        this.pipeline = pipeline;
        this.cacheProperties = cacheProperties;
    }

    @Override
    public QueryResult<PagedResult<ClubSummary>> execute(ClubSearchQuery query) {
        return pipeline.execute(this, query);
    }

    @Override
    public String name() {
        return "clubs";
    }

    @Override
    public String cacheKey(ClubSearchQuery query) {
        CacheKeyBuilder key = CacheKeyBuilder.forNamespace(CacheNamespaces.CLUBS)
                .token("page", query.page())
                .token("size", query.pageSize())
                .caseInsensitiveTokenIfPresent("search", query.searchTerm())
                .tokenIfPresent("league", query.league())
                .caseInsensitiveTokenIfPresent("city", query.city())
                .tokenIfPresent("active", query.active())
                .tokenIfPresent("verified", query.verified())
                .tokenIfPresent("featured", query.featured())
                .tokenIfPresent("from", query.foundedYearFrom())
                .tokenIfPresent("to", query.foundedYearTo());

        if (!query.hasDefaultSort()) {
            String direction = query.descending() ? "desc" : "asc";
            key.caseInsensitiveTokenIfPresent("sort", query.resolvedSortField().fieldName() + "-" + direction);
        }
        return key.build();
    }

    @Override
    public CacheValueType<PagedResult<ClubSummary>> resultType() {
        return RESULT_TYPE;
    }

    @Override
    public Duration ttl() {
        return cacheProperties.getClubsTtl();
    }

    @Override
    public PagedResult<ClubSummary> load(ClubSearchQuery query) {
        RecordPage<Club> page = clubRepository.findPage(query.toCriteria());

        List<ClubSummary> items = page.records().stream()
                .map(ClubSummary::fromClub)
                .toList();

        logger.info("Retrieved {} clubs (page {} of {} total)", items.size(), query.page(), page.totalCount());
        return PagedResult.of(items, page.totalCount(), query.page(), query.pageSize());
    }
}
