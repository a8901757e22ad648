package com.polishfootball.network.application;

import com.polishfootball.network.application.dto.DashboardStats;
import com.polishfootball.network.application.query.DashboardStatsQuery;
import com.polishfootball.network.application.query.QueryResult;

public interface FindDashboardStats {

    QueryResult<DashboardStats> execute(DashboardStatsQuery query);
}
