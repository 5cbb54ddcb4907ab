package org.jaffre.repo;

import org.jaffre.model.game.FinishedGameEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FinishedGameRepository extends JpaRepository<FinishedGameEntity, Long> {
    List<FinishedGameEntity> findTop20ByOrderByFinishedAtDesc();
}
