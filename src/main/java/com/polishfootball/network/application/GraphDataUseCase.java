package com.polishfootball.network.application;

import com.polishfootball.network.application.dto.GraphData;
import com.polishfootball.network.application.query.CachedQuery;
import com.polishfootball.network.application.query.CachedQueryPipeline;
import com.polishfootball.network.application.query.GraphDataQuery;
import com.polishfootball.network.application.query.QueryResult;
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

@Service
public class GraphDataUseCase implements FindGraphData, CachedQuery<GraphDataQuery, GraphData> {

    private static final Logger logger = LoggerFactory.getLogger(GraphDataUseCase.class);

    private static final CacheValueType<GraphData> RESULT_TYPE = CacheValueType.json(GraphData.class);

    private final ClubRepository clubRepository;
    private final ConnectionRepository connectionRepository;
    private final GraphAssembler graphAssembler;
    private final CachedQueryPipeline pipeline;
    private final CacheProperties cacheProperties;

    public GraphDataUseCase(ClubRepository clubRepository, ConnectionRepository connectionRepository,
                            GraphAssembler graphAssembler, CachedQueryPipeline pipeline,
                            CacheProperties cacheProperties) {
        this.clubRepository = clubRepository;
        this.connectionRepository = connectionRepository;
        this.graphAssembler = graphAssembler;
        this.pipeline = pipeline;
        this.cacheProperties = cacheProperties;
    }

    @Override
    public QueryResult<GraphData> execute(GraphDataQuery query) {
        logger.debug("Graph data requested: verifiedOnly={}, activeOnly={}", query.verifiedOnly(), query.activeOnly());
        return pipeline.execute(this, query);
    }

    @Override
    public String name() {
        return "graph data";
    }

    @Override
    public String cacheKey(GraphDataQuery query) {
        return CacheKeyBuilder.forNamespace(CacheNamespaces.GRAPH_DATA)
                .flag("verified", query.verifiedOnly())
                .flag("active", query.activeOnly())
                .tokenIfPresent("reliability", query.minReliabilityScore())
                .setTokenIfPresent("leagues", query.includeLeagues())
                .flag("no-isolated", !query.includeIsolatedNodes())
                .build();
    }

    @Override
    public CacheValueType<GraphData> resultType() {
        return RESULT_TYPE;
    }

    @Override
    public Duration ttl() {
        return cacheProperties.getGraphDataTtl();
    }

    @Override
    public GraphData load(GraphDataQuery query) {
        GraphData graph = graphAssembler.assemble(clubRepository.findAll(), connectionRepository.findAll(), query);
        logger.info("Generated graph data with {} nodes and {} edges",
                graph.metadata().totalNodes(), graph.metadata().totalEdges());
        return graph;
    }
}
