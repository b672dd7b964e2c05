/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package co.tracecore.collections;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An insertion ordered container with a fixed capacity.
 * <p>
 * When an entry is added to a full buffer, the eldest entry is evicted and the {@link #getDroppedCount() dropped count}
 * is incremented.
 * In {@link Mode#UPDATE_IN_PLACE_BY_KEY} mode, putting a key which is already contained replaces the value,
 * moves the key to the youngest position and evicts nothing.
 * In {@link Mode#FIFO} mode, every {@link #add(Object)} appends a new entry, keyed by its insertion sequence number.
 * </p>
 * <p>
 * This class is not thread-safe. Owners have to guard all access with their own lock.
 * </p>
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class BoundedBuffer<K, V> {

    public enum Mode {
        UPDATE_IN_PLACE_BY_KEY,
        FIFO
    }

    private final Mode mode;
    private final int capacity;
    private final LinkedHashMap<K, V> entries;
    private long nextSequence;
    private int droppedCount;

    private BoundedBuffer(Mode mode, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1, was " + capacity);
        }
        this.mode = mode;
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>();
    }

    public static <K, V> BoundedBuffer<K, V> updateInPlaceByKey(int capacity) {
        return new BoundedBuffer<>(Mode.UPDATE_IN_PLACE_BY_KEY, capacity);
    }

    public static <V> BoundedBuffer<Long, V> fifo(int capacity) {
        return new BoundedBuffer<>(Mode.FIFO, capacity);
    }

    /**
     * Sets the value of a key and makes it the youngest entry.
     *
     * @throws IllegalStateException if this is a {@link Mode#FIFO} buffer
     */
    public void put(K key, V value) {
        if (mode != Mode.UPDATE_IN_PLACE_BY_KEY) {
            throw new IllegalStateException("put is only supported by keyed buffers, use add");
        }
        if (entries.remove(key) == null) {
            evictIfFull();
        }
        entries.put(key, value);
    }

    /**
     * Appends a value as the youngest entry.
     *
     * @throws IllegalStateException if this is a {@link Mode#UPDATE_IN_PLACE_BY_KEY} buffer
     */
    @SuppressWarnings("unchecked")
    public void add(V value) {
        if (mode != Mode.FIFO) {
            throw new IllegalStateException("add is only supported by FIFO buffers, use put");
        }
        evictIfFull();
        // only FIFO buffers are created with Long keys, see #fifo
        entries.put((K) Long.valueOf(nextSequence++), value);
    }

    private void evictIfFull() {
        if (entries.size() >= capacity) {
            Iterator<K> eldest = entries.keySet().iterator();
            eldest.next();
            eldest.remove();
            droppedCount++;
        }
    }

    public V get(K key) {
        return entries.get(key);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * @return the number of entries evicted because the buffer was full
     */
    public int getDroppedCount() {
        return droppedCount;
    }

    /**
     * @return a copy of the values, eldest first
     */
    public List<V> values() {
        return Collections.unmodifiableList(new ArrayList<>(entries.values()));
    }

    /**
     * @return a copy of the entries, eldest first
     */
    public Map<K, V> toMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    @Override
    public String toString() {
        return "BoundedBuffer{mode=" + mode + ", capacity=" + capacity + ", size=" + entries.size() + ", dropped=" + droppedCount + '}';
    }
}
