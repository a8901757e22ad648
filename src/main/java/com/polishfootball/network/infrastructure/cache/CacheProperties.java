package com.polishfootball.network.infrastructure.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Cache store and per-handler expiration settings.
 */
@Component
@ConfigurationProperties(prefix = "football.cache")
public class CacheProperties {

    private String provider = "memory";
    private Duration defaultTtl = Duration.ofMinutes(30);
    private long maximumSize = 10_000;
    private String keyPrefix = "football:cache:";

    private Duration clubsTtl = Duration.ofMinutes(5);
    private Duration clubDetailTtl = Duration.ofMinutes(10);
    private Duration clubConnectionsTtl = Duration.ofMinutes(5);
    private Duration connectionsTtl = Duration.ofMinutes(5);
    private Duration graphDataTtl = Duration.ofMinutes(10);
    private Duration dashboardStatsTtl = Duration.ofMinutes(5);

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public void setMaximumSize(long maximumSize) {
        this.maximumSize = maximumSize;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public Duration getClubsTtl() {
        return clubsTtl;
    }

    public void setClubsTtl(Duration clubsTtl) {
        this.clubsTtl = clubsTtl;
    }

    public Duration getClubDetailTtl() {
        return clubDetailTtl;
    }

    public void setClubDetailTtl(Duration clubDetailTtl) {
        this.clubDetailTtl = clubDetailTtl;
    }

    public Duration getConnectionsTtl() {
        return connectionsTtl;
    }

    public void setConnectionsTtl(Duration connectionsTtl) {
        this.connectionsTtl = connectionsTtl;
    }

    public Duration getClubConnectionsTtl() {
        return clubConnectionsTtl;
    }

    public void setClubConnectionsTtl(Duration clubConnectionsTtl) {
        this.clubConnectionsTtl = clubConnectionsTtl;
    }

    public Duration getGraphDataTtl() {
        return graphDataTtl;
    }

    public void setGraphDataTtl(Duration graphDataTtl) {
        this.graphDataTtl = graphDataTtl;
    }

    public Duration getDashboardStatsTtl() {
        return dashboardStatsTtl;
    }

    public void setDashboardStatsTtl(Duration dashboardStatsTtl) {
        this.dashboardStatsTtl = dashboardStatsTtl;
    }
}
