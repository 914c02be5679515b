package com.phantom.repository;

import com.phantom.domain.model.Event;
import com.phantom.domain.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface EventRepository extends JpaRepository<Event, UUID> {

    @Query("""
            select e from Event e
            where e.user = :user
              and e.startsAt < :windowEnd
              and e.endsAt > :windowStart
            order by e.startsAt asc
            """)
    List<Event> findOverlapping(@Param("user") User user,
                                @Param("windowStart") OffsetDateTime windowStart,
                                @Param("windowEnd") OffsetDateTime windowEnd);

    Optional<Event> findByIdAndUser(UUID id, User user);

    List<Event> findByUserAndIdIn(User user, Collection<UUID> ids);

    @Modifying
    @Transactional
    @Query("update Event e set e.googleEventId = :googleEventId where e.id = :id")
    int updateGoogleEventId(@Param("id") UUID id, @Param("googleEventId") String googleEventId);
}
