package com.polishfootball.network.application.dto;

import java.time.Instant;
import java.util.Map;

/**
 * Admin dashboard aggregates. Breakdowns and recent activity are only
 * populated for detailed requests and are null otherwise.
 */
public record DashboardStats(
        long totalClubs,
        long activeClubs,
        long verifiedClubs,
        long featuredClubs,
        long totalConnections,
        long verifiedConnections,
        long clubsWithLogos,
        Instant generatedAt,
        Map<String, Long> clubsByLeague,
        Map<String, Long> connectionsByType,
        Map<String, Long> connectionsByStrength,
        RecentActivity recentActivity
) {
    public record RecentActivity(
            long clubsCreatedLast30Days,
            long connectionsCreatedLast30Days,
            Instant lastDataModificationAt
    ) {}
}
