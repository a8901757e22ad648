package com.polishfootball.network.domain.model;

public enum LeagueType {
    EKSTRAKLASA,
    FORTUNA_1_LIGA,
    EUROPEAN_CLUB
}
