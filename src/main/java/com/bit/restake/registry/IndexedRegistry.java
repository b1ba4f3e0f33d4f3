package com.bit.restake.registry;

import com.bit.restake.exception.ErrorType;
import com.bit.restake.exception.RestakeException;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * id索引 + 插入顺序列表
 * 存在性检查 O(1)，遍历顺序为插入顺序（默认选择依赖该顺序）
 * 删除保持剩余元素的相对顺序，并重建其后的下标
 */
public class IndexedRegistry<K, V> {

    private final String name;
    private final Map<K, Integer> index = new HashMap<>();
    private final List<K> keys = new ArrayList<>();
    private final List<V> entries = new ArrayList<>();

    public IndexedRegistry(String name) {
        this.name = name;
    }

    public void add(K key, V value) {
        if (index.containsKey(key)) {
            throw new RestakeException(ErrorType.ALREADY_ADDED, name + ": " + key);
        }
        index.put(key, entries.size());
        keys.add(key);
        entries.add(value);
    }

    public V remove(K key) {
        Integer position = index.remove(key);
        if (position == null) {
            throw new RestakeException(ErrorType.NOT_FOUND, name + ": " + key);
        }
        keys.remove((int) position);
        V removed = entries.remove((int) position);
        for (int i = position; i < keys.size(); i++) {
            index.put(keys.get(i), i);
        }
        return removed;
    }

    public boolean contains(K key) {
        return index.containsKey(key);
    }

    public V get(K key) {
        Integer position = index.get(key);
        if (position == null) {
            throw new RestakeException(ErrorType.NOT_FOUND, name + ": " + key);
        }
        return entries.get(position);
    }

    public Optional<V> find(K key) {
        Integer position = index.get(key);
        return position == null ? Optional.empty() : Optional.of(entries.get(position));
    }

    public int indexOf(K key) {
        Integer position = index.get(key);
        if (position == null) {
            throw new RestakeException(ErrorType.NOT_FOUND, name + ": " + key);
        }
        return position;
    }

    public V get(int position) {
        return entries.get(position);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<V> values() {
        return ImmutableList.copyOf(entries);
    }

    public List<K> keys() {
        return ImmutableList.copyOf(keys);
    }
}
