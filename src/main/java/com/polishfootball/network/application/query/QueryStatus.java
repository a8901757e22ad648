package com.polishfootball.network.application.query;

public enum QueryStatus {
    SUCCESS,
    VALIDATION_FAILED,
    NOT_FOUND,
    CANCELLED,
    FAILED
}
