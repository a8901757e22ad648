package com.polishfootball.network.infrastructure.web;

import com.polishfootball.network.infrastructure.cache.CacheStats;
import com.polishfootball.network.infrastructure.cache.CacheStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CacheAdminController.class)
class CacheAdminControllerContractTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CacheStore cacheStore;

    @Test
    void shouldEvictByPattern() throws Exception {
        // Given
        when(cacheStore.removeByPattern("^graph-data")).thenReturn(3);

        // When & Then
        mockMvc.perform(delete("/api/admin/cache").param("pattern", "^graph-data"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.removed", is(3)))
                .andExpect(jsonPath("$.message", is("Removed 3 cache entries")));
    }

    @Test
    void shouldRequirePattern() throws Exception {
        mockMvc.perform(delete("/api/admin/cache"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].field", is("pattern")));

        verifyNoInteractions(cacheStore);
    }

    @Test
    void shouldRejectBlankPattern() throws Exception {
        // Given
        when(cacheStore.removeByPattern(" "))
                .thenThrow(new IllegalArgumentException("Cache key pattern must not be blank"));

        // When & Then
        mockMvc.perform(delete("/api/admin/cache").param("pattern", " "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", is("Cache key pattern must not be blank")));
    }

    @Test
    void shouldExposeStats() throws Exception {
        // Given
        when(cacheStore.stats()).thenReturn(new CacheStats(3, 1, 0, 2, 5));

        // When & Then
        mockMvc.perform(get("/api/admin/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.activeEntries", is(5)))
                .andExpect(jsonPath("$.data.hitRatio", closeTo(0.75, 0.0001)));
    }
}
