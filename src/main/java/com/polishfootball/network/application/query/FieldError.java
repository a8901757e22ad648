package com.polishfootball.network.application.query;

public record FieldError(String field, String message) {}
