package org.jaffre.repo;

import org.jaffre.model.game.GameSnapshotEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface GameSnapshotRepository extends JpaRepository<GameSnapshotEntity, String> {
    List<GameSnapshotEntity> findByPhaseIn(Collection<String> phases);
}
