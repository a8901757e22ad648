package com.polishfootball.network.application.query;

import java.util.UUID;

public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException club(UUID id) {
        return new ResourceNotFoundException("Club with ID '" + id + "' not found.");
    }

    public static ResourceNotFoundException connection(UUID id) {
        return new ResourceNotFoundException("Connection with ID '" + id + "' not found.");
    }
}
