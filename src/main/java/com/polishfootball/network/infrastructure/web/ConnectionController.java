package com.polishfootball.network.infrastructure.web;

import com.polishfootball.network.application.FindConnections;
import com.polishfootball.network.application.dto.ConnectionSummary;
import com.polishfootball.network.application.dto.PagedResult;
import com.polishfootball.network.application.query.ConnectionSearchQuery;
import com.polishfootball.network.domain.model.ConnectionStrength;
import com.polishfootball.network.domain.model.ConnectionType;
import com.polishfootball.network.infrastructure.web.dto.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/connections")
public class ConnectionController {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionController.class);

    private final FindConnections findConnections;

    public ConnectionController(FindConnections findConnections) {
        this.findConnections = findConnections;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<PagedResult<ConnectionSummary>>> listConnections(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer pageSize,
            @RequestParam(required = false) ConnectionType type,
            @RequestParam(required = false) ConnectionStrength strength,
            @RequestParam(required = false) Boolean verified,
            @RequestParam(required = false) UUID clubId,
            @RequestParam(required = false) Double minReliabilityScore,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortDirection
    ) {
        logger.info("Listing connections: type={}, strength={}, clubId={}", type, strength, clubId);

        var query = new ConnectionSearchQuery(page, pageSize, type, strength, verified, clubId,
                minReliabilityScore, sortBy, sortDirection);
        return QueryResponses.toResponse(findConnections.execute(query));
    }
}
