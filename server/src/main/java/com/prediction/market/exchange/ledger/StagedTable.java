package com.prediction.market.exchange.ledger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Session view over one in-memory table. Rows are copied on first read, so a
 * session never touches committed state until {@link #commit()}. Repeated
 * reads of the same id inside a session return the same instance.
 */
final class StagedTable<E> {

    private final Map<String, E> committed;
    private final Function<E, String> idOf;
    private final UnaryOperator<E> copier;

    private final Map<String, E> loaded = new HashMap<>();
    private final Set<String> dirty = new LinkedHashSet<>();
    private final Set<String> deleted = new HashSet<>();

    StagedTable(Map<String, E> committed, Function<E, String> idOf, UnaryOperator<E> copier) {
        this.committed = committed;
        this.idOf = idOf;
        this.copier = copier;
    }

    Optional<E> find(String id) {
        if (id == null || deleted.contains(id)) {
            return Optional.empty();
        }
        E row = loaded.get(id);
        if (row == null) {
            E stored = committed.get(id);
            if (stored == null) {
                return Optional.empty();
            }
            row = copier.apply(stored);
            loaded.put(id, row);
        }
        return Optional.of(row);
    }

    List<E> all() {
        Set<String> ids = new LinkedHashSet<>(committed.keySet());
        ids.addAll(loaded.keySet());
        List<E> rows = new ArrayList<>(ids.size());
        for (String id : ids) {
            find(id).ifPresent(rows::add);
        }
        return rows;
    }

    List<E> filter(Predicate<E> predicate) {
        List<E> rows = new ArrayList<>();
        for (E row : all()) {
            if (predicate.test(row)) {
                rows.add(row);
            }
        }
        return rows;
    }

    void save(E row) {
        String id = idOf.apply(row);
        if (id == null) {
            throw new IllegalArgumentException("row without id: " + row);
        }
        loaded.put(id, row);
        dirty.add(id);
        deleted.remove(id);
    }

    void delete(String id) {
        loaded.remove(id);
        dirty.remove(id);
        deleted.add(id);
    }

    void commit() {
        for (String id : deleted) {
            committed.remove(id);
        }
        for (String id : dirty) {
            committed.put(id, copier.apply(loaded.get(id)));
        }
    }
}
