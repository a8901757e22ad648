package com.polishfootball.network.domain.model;

public enum ConnectionType {
    ALLIANCE,
    RIVALRY,
    FRIENDSHIP
}
