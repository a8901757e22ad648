package com.polishfootball.network.domain.port.out;

import com.polishfootball.network.domain.model.Connection;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository port for connections between clubs.
 */
public interface ConnectionRepository {

    /**
     * All connections where the club is either the source or the target.
     */
    List<Connection> findByClubId(UUID clubId);

    Optional<Connection> findById(UUID id);

    List<Connection> findAll();

    void save(Connection connection);

    boolean update(Connection connection);

    boolean deleteById(UUID id);
}
