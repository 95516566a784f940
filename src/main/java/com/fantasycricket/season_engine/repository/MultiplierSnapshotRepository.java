package com.fantasycricket.season_engine.repository;

import com.fantasycricket.season_engine.model.MultiplierScope;
import com.fantasycricket.season_engine.model.MultiplierSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Latest handicap snapshot per scope within one season. Saving replaces
 * the previous snapshot for that scope.
 */
public interface MultiplierSnapshotRepository {

    MultiplierSnapshot save(MultiplierSnapshot snapshot);

    Optional<MultiplierSnapshot> findByScope(MultiplierScope scope);

    List<MultiplierSnapshot> findAll();
}
