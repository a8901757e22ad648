package com.polishfootball.network.application;

import com.polishfootball.network.application.dto.ConnectionDetail;
import com.polishfootball.network.application.dto.PagedResult;
import com.polishfootball.network.application.query.ClubConnectionsQuery;
import com.polishfootball.network.application.query.QueryResult;

public interface FindClubConnections {

    /**
     * Lists the connections of one club, paged. Reports not-found when the club does not exist.
     */
    QueryResult<PagedResult<ConnectionDetail>> execute(ClubConnectionsQuery query);
}
