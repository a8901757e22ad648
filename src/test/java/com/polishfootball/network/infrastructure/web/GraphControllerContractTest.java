package com.polishfootball.network.infrastructure.web;

import com.polishfootball.network.application.FindGraphData;
import com.polishfootball.network.application.dto.GraphData;
import com.polishfootball.network.application.query.GraphDataQuery;
import com.polishfootball.network.application.query.QueryResult;
import com.polishfootball.network.domain.model.LeagueType;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GraphController.class)
class GraphControllerContractTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FindGraphData findGraphData;

    @Test
    void shouldBindFiltersAndReturnGraph() throws Exception {
        // Given
        GraphData graph = new GraphData(List.of(), List.of(), new GraphData.Metadata(0, 0,
                Instant.parse("2024-06-01T08:00:00Z"), Map.of(), Map.of(), Map.of("verifiedOnly", "true")));
        when(findGraphData.execute(any())).thenReturn(QueryResult.success(graph));

        // When & Then
        mockMvc.perform(get("/api/graph")
                        .param("verifiedOnly", "true")
                        .param("minReliabilityScore", "0.6")
                        .param("leagues", "EKSTRAKLASA", "EUROPEAN_CLUB")
                        .param("includeIsolatedNodes", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.nodes", hasSize(0)))
                .andExpect(jsonPath("$.data.metadata.generatedAt", is("2024-06-01T08:00:00Z")))
                .andExpect(jsonPath("$.data.metadata.appliedFilters.verifiedOnly", is("true")));

        ArgumentCaptor<GraphDataQuery> query = ArgumentCaptor.forClass(GraphDataQuery.class);
        verify(findGraphData).execute(query.capture());
        assertThat(query.getValue().verifiedOnly()).isTrue();
        assertThat(query.getValue().activeOnly()).isTrue();
        assertThat(query.getValue().minReliabilityScore()).isEqualTo(0.6);
        assertThat(query.getValue().includeLeagues())
                .containsExactly(LeagueType.EKSTRAKLASA, LeagueType.EUROPEAN_CLUB);
        assertThat(query.getValue().includeIsolatedNodes()).isFalse();
    }

    @Test
    void shouldIgnoreEmptyLeagueEntryFromTrailingComma() throws Exception {
        // Given
        GraphData graph = new GraphData(List.of(), List.of(), new GraphData.Metadata(0, 0,
                Instant.parse("2024-06-01T08:00:00Z"), Map.of(), Map.of(), Map.of()));
        when(findGraphData.execute(any())).thenReturn(QueryResult.success(graph));

        // When & Then
        mockMvc.perform(get("/api/graph").param("leagues", "EKSTRAKLASA,"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", is(true)));

        ArgumentCaptor<GraphDataQuery> query = ArgumentCaptor.forClass(GraphDataQuery.class);
        verify(findGraphData).execute(query.capture());
        assertThat(query.getValue().includeLeagues()).containsExactly(LeagueType.EKSTRAKLASA);
    }

    @Test
    void shouldReturnBadRequestForNonNumericReliability() throws Exception {
        mockMvc.perform(get("/api/graph").param("minReliabilityScore", "high"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].field", is("minReliabilityScore")));
    }
}
