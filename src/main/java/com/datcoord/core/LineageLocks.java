package com.datcoord.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

public class LineageLocks {
    private final Map<String, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();

    public ReentrantReadWriteLock forLineage(String lineage) {
        return locks.computeIfAbsent(lineage, key -> new ReentrantReadWriteLock(true));
    }

    public <T> T withReadLock(String lineage, Supplier<T> action) {
        Lock lock = forLineage(lineage).readLock();
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public <T> T withWriteLock(String lineage, Supplier<T> action) {
        Lock lock = forLineage(lineage).writeLock();
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public <T> T withAllWriteLocks(Supplier<T> action) {
        List<String> names = new ArrayList<>(locks.keySet());
        names.sort(null);
        List<Lock> held = new ArrayList<>();
        try {
            for (String name : names) {
                Lock lock = forLineage(name).writeLock();
                lock.lock();
                held.add(lock);
            }
            return action.get();
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
        }
    }
}
