package com.polishfootball.network.infrastructure.web;

import com.polishfootball.network.application.FindClubConnections;
import com.polishfootball.network.application.FindClubDetail;
import com.polishfootball.network.application.FindClubs;
import com.polishfootball.network.application.dto.ClubDetail;
import com.polishfootball.network.application.dto.ClubSummary;
import com.polishfootball.network.application.dto.ConnectionDetail;
import com.polishfootball.network.application.dto.PagedResult;
import com.polishfootball.network.application.query.ClubConnectionsQuery;
import com.polishfootball.network.application.query.ClubDetailQuery;
import com.polishfootball.network.application.query.ClubSearchQuery;
import com.polishfootball.network.domain.model.LeagueType;
import com.polishfootball.network.infrastructure.web.dto.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/clubs")
public class ClubController {

    private static final Logger logger = LoggerFactory.getLogger(ClubController.class);

    private final FindClubs findClubs;
    private final FindClubDetail findClubDetail;
    private final FindClubConnections findClubConnections;

    public ClubController(FindClubs findClubs, FindClubDetail findClubDetail,
                          FindClubConnections findClubConnections) {
        this.findClubs = findClubs;
        this.findClubDetail = findClubDetail;
        this.findClubConnections = findClubConnections;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<PagedResult<ClubSummary>>> searchClubs(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer pageSize,
            @RequestParam(name = "search", required = false) String searchTerm,
            @RequestParam(required = false) LeagueType league,
            @RequestParam(required = false) String city,
            @RequestParam(required = false) Boolean active,
            @RequestParam(required = false) Boolean verified,
            @RequestParam(required = false) Boolean featured,
            @RequestParam(required = false) Integer foundedYearFrom,
            @RequestParam(required = false) Integer foundedYearTo,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortDirection
    ) {
        logger.info("Searching clubs: page={}, pageSize={}, search={}, league={}", page, pageSize, searchTerm, league);

        var query = new ClubSearchQuery(page, pageSize, searchTerm, league, city, active, verified, featured,
                foundedYearFrom, foundedYearTo, sortBy, sortDirection);
        return QueryResponses.toResponse(findClubs.execute(query));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ClubDetail>> getClub(
            @PathVariable UUID id,
            @RequestParam(defaultValue = "false") boolean includeConnections
    ) {
        logger.info("Fetching club {} (includeConnections={})", id, includeConnections);
        return QueryResponses.toResponse(findClubDetail.execute(new ClubDetailQuery(id, includeConnections)));
    }

    @GetMapping("/{id}/connections")
    public ResponseEntity<ApiResponse<PagedResult<ConnectionDetail>>> getClubConnections(
            @PathVariable UUID id,
            @RequestParam(defaultValue = "false") boolean verifiedOnly,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer pageSize
    ) {
        logger.info("Listing connections of club {}", id);
        return QueryResponses.toResponse(
                findClubConnections.execute(new ClubConnectionsQuery(id, verifiedOnly, page, pageSize)));
    }
}
