package com.polishfootball.network.application;

import com.polishfootball.network.application.dto.ClubSummary;
import com.polishfootball.network.application.dto.PagedResult;
import com.polishfootball.network.application.query.ClubSearchQuery;
import com.polishfootball.network.application.query.QueryResult;

/**
 * Read access to clubs.
 */
public interface FindClubs {

    /**
     * Searches clubs with optional filters, sorting and pagination.
     *
     * @param query the search filter; validated before use
     * @return the requested page, or a validation/failure outcome
     */
    QueryResult<PagedResult<ClubSummary>> execute(ClubSearchQuery query);
}
