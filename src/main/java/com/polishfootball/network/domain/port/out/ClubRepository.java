package com.polishfootball.network.domain.port.out;

import com.polishfootball.network.domain.model.Club;
import com.polishfootball.network.domain.model.ClubSearchCriteria;
import com.polishfootball.network.domain.model.RecordPage;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository port for clubs.
 * Implementations must give consistent reads; transactions are not required by callers.
 */
public interface ClubRepository {

    /**
     * Find one page of clubs matching the criteria, together with the total match count.
     */
    RecordPage<Club> findPage(ClubSearchCriteria criteria);

    Optional<Club> findById(UUID id);

    List<Club> findByIds(Collection<UUID> ids);

    List<Club> findAll();

    void save(Club club);

    /**
     * @return false when no club with that id exists
     */
    boolean update(Club club);

    /**
     * Delete the club and, through the schema, its connections.
     * @return false when no club with that id exists
     */
    boolean deleteById(UUID id);
}
