package com.polishfootball.network.application;

import com.polishfootball.network.application.dto.GraphData;
import com.polishfootball.network.application.query.GraphDataQuery;
import com.polishfootball.network.application.query.QueryResult;

public interface FindGraphData {

    QueryResult<GraphData> execute(GraphDataQuery query);
}
