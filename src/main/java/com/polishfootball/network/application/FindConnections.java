package com.polishfootball.network.application;

import com.polishfootball.network.application.dto.ConnectionSummary;
import com.polishfootball.network.application.dto.PagedResult;
import com.polishfootball.network.application.query.ConnectionSearchQuery;
import com.polishfootball.network.application.query.QueryResult;

/**
 * Read access to the connection list across all clubs.
 */
public interface FindConnections {

    /**
     * Lists connections with optional filters, sorting and pagination.
     *
     * @param query the listing filter; validated before use
     * @return the requested page, or a validation/failure outcome
     */
    QueryResult<PagedResult<ConnectionSummary>> execute(ConnectionSearchQuery query);
}
