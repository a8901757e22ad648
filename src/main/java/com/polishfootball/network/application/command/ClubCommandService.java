package com.polishfootball.network.application.command;

import com.polishfootball.network.application.dto.ClubSummary;
import com.polishfootball.network.application.query.FieldError;
import com.polishfootball.network.application.query.RequestValidator;
import com.polishfootball.network.application.query.ResourceNotFoundException;
import com.polishfootball.network.domain.model.Club;
import com.polishfootball.network.domain.port.out.ClubRepository;
import com.polishfootball.network.infrastructure.cache.CacheInvalidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Club mutations. Each successful write invalidates every cached view that contains club data.
 */
@Service
public class ClubCommandService {

    private static final Logger logger = LoggerFactory.getLogger(ClubCommandService.class);

    private final ClubRepository clubRepository;
    private final RequestValidator validator;
    private final CacheInvalidator cacheInvalidator;
    private final Clock clock;

    public ClubCommandService(ClubRepository clubRepository, RequestValidator validator,
                              CacheInvalidator cacheInvalidator, Clock clock) {
        this.clubRepository = clubRepository;
        this.validator = validator;
        this.cacheInvalidator = cacheInvalidator;
        this.clock = clock;
    }

    public ClubSummary create(ClubCommand command) {
        requireValid(command);

        Club club = command.toClub(UUID.randomUUID(), clock.instant(), null);
        clubRepository.save(club);
        cacheInvalidator.onClubChanged();

        logger.info("Created club {} ({})", club.name(), club.id());
        return ClubSummary.fromClub(club);
    }

    public ClubSummary update(UUID clubId, ClubCommand command) {
        requireValid(command);

        Club existing = clubRepository.findById(clubId)
                .orElseThrow(() -> ResourceNotFoundException.club(clubId));

        Instant now = clock.instant();
        Club updated = command.toClub(clubId, existing.createdAt(), now);
        if (!clubRepository.update(updated)) {
            throw ResourceNotFoundException.club(clubId);
        }
        cacheInvalidator.onClubChanged();

        logger.info("Updated club {} ({})", updated.name(), clubId);
        return ClubSummary.fromClub(updated);
    }

    public void delete(UUID clubId) {
        if (!clubRepository.deleteById(clubId)) {
            throw ResourceNotFoundException.club(clubId);
        }
        cacheInvalidator.onClubChanged();

        logger.info("Deleted club {}", clubId);
    }

    private void requireValid(ClubCommand command) {
        List<FieldError> errors = validator.validate(command);
        if (!errors.isEmpty()) {
            logger.warn("Rejected club command: {}", errors);
            throw new CommandValidationException(errors);
        }
    }
}
