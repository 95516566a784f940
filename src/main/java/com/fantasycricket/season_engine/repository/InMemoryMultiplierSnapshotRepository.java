package com.fantasycricket.season_engine.repository;

import com.fantasycricket.season_engine.model.MultiplierScope;
import com.fantasycricket.season_engine.model.MultiplierSnapshot;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryMultiplierSnapshotRepository implements MultiplierSnapshotRepository {

    private final Map<MultiplierScope, MultiplierSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public MultiplierSnapshot save(MultiplierSnapshot snapshot) {
        snapshots.put(snapshot.scope(), snapshot);
        return snapshot;
    }

    @Override
    public Optional<MultiplierSnapshot> findByScope(MultiplierScope scope) {
        return Optional.ofNullable(snapshots.get(scope));
    }

    @Override
    public List<MultiplierSnapshot> findAll() {
        return List.copyOf(snapshots.values());
    }
}
