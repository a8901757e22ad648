package com.polishfootball.network.application.command;

import com.polishfootball.network.application.query.FieldError;
import com.polishfootball.network.application.query.RequestValidator;
import com.polishfootball.network.application.query.ResourceNotFoundException;
import com.polishfootball.network.domain.model.Connection;
import com.polishfootball.network.domain.port.out.ClubRepository;
import com.polishfootball.network.domain.port.out.ConnectionRepository;
import com.polishfootball.network.infrastructure.cache.CacheInvalidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Service
public class ConnectionCommandService {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionCommandService.class);

    private final ConnectionRepository connectionRepository;
    private final ClubRepository clubRepository;
    private final RequestValidator validator;
    private final CacheInvalidator cacheInvalidator;
    private final Clock clock;

    public ConnectionCommandService(ConnectionRepository connectionRepository, ClubRepository clubRepository,
                                    RequestValidator validator, CacheInvalidator cacheInvalidator, Clock clock) {
        this.connectionRepository = connectionRepository;
        this.clubRepository = clubRepository;
        this.validator = validator;
        this.cacheInvalidator = cacheInvalidator;
        this.clock = clock;
    }

    public Connection create(ConnectionCommand command) {
        requireValid(command);
        requireClubsExist(command);

        Connection connection = command.toConnection(UUID.randomUUID(), clock.instant(), null);
        connectionRepository.save(connection);
        cacheInvalidator.onConnectionChanged();

        logger.info("Created {} connection {} between {} and {}",
                connection.type(), connection.id(), connection.sourceClubId(), connection.targetClubId());
        return connection;
    }

    public Connection update(UUID connectionId, ConnectionCommand command) {
        requireValid(command);

        Connection existing = connectionRepository.findById(connectionId)
                .orElseThrow(() -> ResourceNotFoundException.connection(connectionId));
        requireClubsExist(command);

        Connection updated = command.toConnection(connectionId, existing.createdAt(), clock.instant());
        if (!connectionRepository.update(updated)) {
            throw ResourceNotFoundException.connection(connectionId);
        }
        cacheInvalidator.onConnectionChanged();

        logger.info("Updated connection {}", connectionId);
        return updated;
    }

    public void delete(UUID connectionId) {
        if (!connectionRepository.deleteById(connectionId)) {
            throw ResourceNotFoundException.connection(connectionId);
        }
        cacheInvalidator.onConnectionChanged();

        logger.info("Deleted connection {}", connectionId);
    }

    private void requireClubsExist(ConnectionCommand command) {
        if (clubRepository.findById(command.sourceClubId()).isEmpty()) {
            throw ResourceNotFoundException.club(command.sourceClubId());
        }
        if (clubRepository.findById(command.targetClubId()).isEmpty()) {
            throw ResourceNotFoundException.club(command.targetClubId());
        }
    }

    private void requireValid(ConnectionCommand command) {
        List<FieldError> errors = validator.validate(command);
        if (!errors.isEmpty()) {
            logger.warn("Rejected connection command: {}", errors);
            throw new CommandValidationException(errors);
        }
    }
}
