package com.polishfootball.network.application;

import com.polishfootball.network.application.dto.ClubDetail;
import com.polishfootball.network.application.query.ClubDetailQuery;
import com.polishfootball.network.application.query.QueryResult;

public interface FindClubDetail {

    /**
     * Loads one club, optionally with its connections. Reports not-found when the club does not exist.
     */
    QueryResult<ClubDetail> execute(ClubDetailQuery query);
}
