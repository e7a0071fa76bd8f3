package com.ella.analyzer.repositories;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Coleção em memória copy-on-write: toda escrita publica um novo snapshot imutável.
 */
public class InMemoryEntityStore<T> implements EntityStore<T> {

    private final Function<T, String> idOf;
    private volatile Map<String, T> snapshot = Collections.emptyMap();

    public InMemoryEntityStore(Function<T, String> idOf) {
        this.idOf = idOf;
    }

    @Override
    public List<T> findAll() {
        return new ArrayList<>(snapshot.values());
    }

    @Override
    public Optional<T> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshot.get(id));
    }

    @Override
    public synchronized void saveAll(Collection<T> entities) {
        if (entities == null || entities.isEmpty()) {
            return;
        }
        Map<String, T> next = new LinkedHashMap<>(snapshot);
        for (T entity : entities) {
            next.put(requireId(entity), entity);
        }
        snapshot = Collections.unmodifiableMap(next);
    }

    @Override
    public synchronized void replaceAll(Collection<T> entities) {
        Map<String, T> next = new LinkedHashMap<>();
        if (entities != null) {
            for (T entity : entities) {
                next.put(requireId(entity), entity);
            }
        }
        snapshot = Collections.unmodifiableMap(next);
    }

    // a função roda sob o mesmo monitor das outras escritas; se ela lançar exceção, nada é publicado
    @Override
    public synchronized List<T> update(UnaryOperator<List<T>> change) {
        List<T> next = change.apply(findAll());
        replaceAll(next);
        return findAll();
    }

    @Override
    public synchronized boolean deleteById(String id) {
        if (id == null || !snapshot.containsKey(id)) {
            return false;
        }
        Map<String, T> next = new LinkedHashMap<>(snapshot);
        next.remove(id);
        snapshot = Collections.unmodifiableMap(next);
        return true;
    }

    @Override
    public int count() {
        return snapshot.size();
    }

    private String requireId(T entity) {
        String id = entity == null ? null : idOf.apply(entity);
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Entity id is required");
        }
        return id;
    }
}
