package com.polishfootball.network.infrastructure.web;

import com.polishfootball.network.application.FindGraphData;
import com.polishfootball.network.application.dto.GraphData;
import com.polishfootball.network.application.query.GraphDataQuery;
import com.polishfootball.network.domain.model.LeagueType;
import com.polishfootball.network.infrastructure.web.dto.ApiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/graph")
public class GraphController {

    private final FindGraphData findGraphData;

    public GraphController(FindGraphData findGraphData) {
        this.findGraphData = findGraphData;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<GraphData>> getGraphData(
            @RequestParam(defaultValue = "false") boolean verifiedOnly,
            @RequestParam(required = false) Boolean activeOnly,
            @RequestParam(required = false) Double minReliabilityScore,
            @RequestParam(name = "leagues", required = false) List<LeagueType> includeLeagues,
            @RequestParam(required = false) Boolean includeIsolatedNodes
    ) {
        var query = new GraphDataQuery(verifiedOnly, activeOnly, minReliabilityScore, includeLeagues, includeIsolatedNodes);
        return QueryResponses.toResponse(findGraphData.execute(query));
    }
}
