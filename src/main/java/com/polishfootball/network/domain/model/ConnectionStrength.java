package com.polishfootball.network.domain.model;

/**
 * Strength of a fan connection, with the edge weight used by graph rendering.
 */
public enum ConnectionStrength {
    WEAK(1),
    MEDIUM(2),
    STRONG(3),
    VERY_STRONG(4);

    private final int weight;

    ConnectionStrength(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }
}
