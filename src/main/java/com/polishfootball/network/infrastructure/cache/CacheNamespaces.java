package com.polishfootball.network.infrastructure.cache;

import java.util.regex.Pattern;

/**
 * Cache key namespaces. Each handler's keys start with {@code namespace + ":"}
 * (or equal the bare namespace), which is what invalidation patterns target.
 */
public final class CacheNamespaces {

    public static final String CLUBS = "clubs";
    public static final String CLUB_DETAIL = "club-detail";
    public static final String CLUB_CONNECTIONS = "club-connections";
    public static final String CONNECTIONS = "connections";
    public static final String GRAPH_DATA = "graph-data";
    public static final String DASHBOARD_STATS = "dashboard-stats";

    private CacheNamespaces() {
    }

    /**
     * Regular expression matching every key of the namespace.
     */
    public static String pattern(String namespace) {
        return "^" + Pattern.quote(namespace) + "(:|$)";
    }
}
