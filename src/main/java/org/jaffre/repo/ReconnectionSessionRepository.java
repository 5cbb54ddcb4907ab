package org.jaffre.repo;

import org.jaffre.model.game.ReconnectionSessionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface ReconnectionSessionRepository extends JpaRepository<ReconnectionSessionEntity, String> {

    @Transactional
    @Modifying
    @Query("delete from ReconnectionSessionEntity s where s.gameId = :gameId and s.seatName = :seatName")
    int deleteSeat(@Param("gameId") String gameId, @Param("seatName") String seatName);

    @Transactional
    @Modifying
    @Query("delete from ReconnectionSessionEntity s where s.gameId = :gameId")
    int deleteGame(@Param("gameId") String gameId);

    @Transactional
    @Modifying
    @Query("delete from ReconnectionSessionEntity s where s.lastUsedAt < :cutoff")
    int deleteIdleSince(@Param("cutoff") long cutoff);
}
