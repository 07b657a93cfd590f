package io.healthcontroller.index;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * In-memory cache of one object kind with named secondary indexes.
 *
 * Each indexer maps an object to zero or more index values; {@link #byIndex(String, String)}
 * returns every cached object the indexer mapped to that value. Contents are fed by the store
 * watcher and are only eventually consistent with etcd.
 *
 * @param <T> cached object type
 */
@Slf4j
public class ObjectIndex<T> {

    private final String kind;
    private final Function<T, String> keyFunction;
    private final Map<String, Function<T, List<String>>> indexers = new HashMap<>();

    // object key -> object, sorted for stable enumeration
    private final Map<String, T> objects = new TreeMap<>();
    // index name -> index value -> object keys
    private final Map<String, Map<String, Set<String>>> indices = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public ObjectIndex(String kind, Function<T, String> keyFunction) {
        this.kind = kind;
        this.keyFunction = keyFunction;
    }

    /**
     * Register a named indexer. Already cached objects are indexed immediately.
     */
    public void addIndexer(String indexName, Function<T, List<String>> indexer) {
        lock.writeLock().lock();
        try {
            if (indexers.containsKey(indexName)) {
                throw new IllegalArgumentException("Indexer " + indexName + " already registered for " + kind);
            }
            indexers.put(indexName, indexer);
            Map<String, Set<String>> index = new HashMap<>();
            indices.put(indexName, index);
            for (Map.Entry<String, T> entry : objects.entrySet()) {
                addToIndex(index, indexName, indexer, entry.getKey(), entry.getValue());
            }
            log.debug("Registered index {} on {}", indexName, kind);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void upsert(T object) {
        String key = keyFunction.apply(object);
        lock.writeLock().lock();
        try {
            T previous = objects.put(key, object);
            if (previous != null) {
                removeFromIndices(key, previous);
            }
            for (Map.Entry<String, Function<T, List<String>>> entry : indexers.entrySet()) {
                addToIndex(indices.get(entry.getKey()), entry.getKey(), entry.getValue(), key, object);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove an object by key.
     *
     * @return the last cached version, if any
     */
    public Optional<T> delete(String key) {
        lock.writeLock().lock();
        try {
            T previous = objects.remove(key);
            if (previous != null) {
                removeFromIndices(key, previous);
            }
            return Optional.ofNullable(previous);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replace the whole cache content, e.g. after a full re-list.
     */
    public void replaceAll(Collection<T> items) {
        lock.writeLock().lock();
        try {
            objects.clear();
            indices.values().forEach(Map::clear);
            for (T item : items) {
                String key = keyFunction.apply(item);
                objects.put(key, item);
                for (Map.Entry<String, Function<T, List<String>>> entry : indexers.entrySet()) {
                    addToIndex(indices.get(entry.getKey()), entry.getKey(), entry.getValue(), key, item);
                }
            }
            log.info("Replaced {} cache with {} objects", kind, objects.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<T> get(String key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(objects.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<T> list() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(objects.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * List cached objects whose indexer produced the given value, ordered by object key.
     */
    public List<T> byIndex(String indexName, String indexValue) {
        lock.readLock().lock();
        try {
            Map<String, Set<String>> index = indices.get(indexName);
            if (index == null) {
                throw new IllegalArgumentException("Index " + indexName + " does not exist for " + kind);
            }
            Set<String> keys = index.getOrDefault(indexValue, Collections.emptySet());
            List<T> result = new ArrayList<>(keys.size());
            for (String key : keys) {
                T object = objects.get(key);
                if (object != null) {
                    result.add(object);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return objects.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void addToIndex(Map<String, Set<String>> index, String indexName, Function<T, List<String>> indexer,
                            String key, T object) {
        List<String> values;
        try {
            values = indexer.apply(object);
        } catch (RuntimeException e) {
            log.error("Indexer {} failed for {} {}, object left out of the index", indexName, kind, key, e);
            return;
        }
        if (values == null) {
            return;
        }
        for (String value : values) {
            index.computeIfAbsent(value, v -> new TreeSet<>()).add(key);
        }
    }

    private void removeFromIndices(String key, T object) {
        for (Map.Entry<String, Function<T, List<String>>> entry : indexers.entrySet()) {
            Map<String, Set<String>> index = indices.get(entry.getKey());
            // values may have changed since insertion, so scan instead of recomputing
            index.values().removeIf(keys -> keys.remove(key) && keys.isEmpty());
        }
    }
}
