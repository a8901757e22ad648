package com.polishfootball.network.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CacheInvalidatorTest {

    @Mock
    private CacheStore cacheStore;

    private CacheInvalidator invalidator;

    @BeforeEach
    void setUp() {
        invalidator = new CacheInvalidator(cacheStore);
    }

    @Test
    void clubChangeShouldEvictEveryNamespaceHoldingClubData() {
        // When
        invalidator.onClubChanged();

        // Then
        verify(cacheStore).removeByPattern(CacheNamespaces.pattern("clubs"));
        verify(cacheStore).removeByPattern(CacheNamespaces.pattern("club-detail"));
        verify(cacheStore).removeByPattern(CacheNamespaces.pattern("club-connections"));
        verify(cacheStore).removeByPattern(CacheNamespaces.pattern("connections"));
        verify(cacheStore).removeByPattern(CacheNamespaces.pattern("graph-data"));
        verify(cacheStore).removeByPattern(CacheNamespaces.pattern("dashboard-stats"));
    }

    @Test
    void connectionChangeShouldLeaveClubListingsCached() {
        // When
        invalidator.onConnectionChanged();

        // Then
        verify(cacheStore).removeByPattern(CacheNamespaces.pattern("club-detail"));
        verify(cacheStore).removeByPattern(CacheNamespaces.pattern("club-connections"));
        verify(cacheStore).removeByPattern(CacheNamespaces.pattern("connections"));
        verify(cacheStore).removeByPattern(CacheNamespaces.pattern("graph-data"));
        verify(cacheStore).removeByPattern(CacheNamespaces.pattern("dashboard-stats"));
        verify(cacheStore, never()).removeByPattern(CacheNamespaces.pattern("clubs"));
    }

    @Test
    void shouldContinueWithRemainingNamespacesWhenOneEvictionFails() {
        // Given
        when(cacheStore.removeByPattern(CacheNamespaces.pattern("club-connections")))
                .thenThrow(new CacheOperationException("redis down", new RuntimeException()));

        // When & Then
        assertThatCode(() -> invalidator.onConnectionChanged()).doesNotThrowAnyException();
        verify(cacheStore).removeByPattern(CacheNamespaces.pattern("graph-data"));
        verify(cacheStore).removeByPattern(CacheNamespaces.pattern("dashboard-stats"));
    }

    @Test
    void evictionsShouldBeScopedToTheirNamespace() {
        // Given
        LocalCacheStore store = new LocalCacheStore(new ObjectMapper(), Duration.ofMinutes(5), 100);
        CacheValueType<String> type = CacheValueType.primitive(String.class);
        store.set("clubs:page-1:size-20", "clubs", type);
        store.set("club-connections:x:page-1:size-20", "connections", type);
        store.set("graph-data:active", "graph", type);
        store.set("connections:page-1:size-20", "listing", type);
        store.set("club-detail:x:with-connections", "detail", type);

        // When
        new CacheInvalidator(store).onConnectionChanged();

        // Then
        assertThat(store.exists("clubs:page-1:size-20")).isTrue();
        assertThat(store.exists("club-connections:x:page-1:size-20")).isFalse();
        assertThat(store.exists("connections:page-1:size-20")).isFalse();
        assertThat(store.exists("club-detail:x:with-connections")).isFalse();
        assertThat(store.exists("graph-data:active")).isFalse();
        store.close();
    }
}
