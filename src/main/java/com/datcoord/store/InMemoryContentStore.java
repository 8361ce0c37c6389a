package com.datcoord.store;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryContentStore implements ContentStore {
    private final Map<ContentId, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public ContentId put(byte[] data) {
        Objects.requireNonNull(data, "data");
        ContentId id = ContentDigests.contentIdOf(data);
        blobs.putIfAbsent(id, data.clone());
        return id;
    }

    @Override
    public byte[] get(ContentId id) {
        byte[] data = blobs.get(id);
        if (data == null) {
            throw new ContentNotFoundException(id);
        }
        return data.clone();
    }

    public int size() {
        return blobs.size();
    }
}
