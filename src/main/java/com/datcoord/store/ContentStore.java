package com.datcoord.store;

public interface ContentStore {
    ContentId put(byte[] data);

    byte[] get(ContentId id);

    default String describe() {
        return getClass().getSimpleName();
    }
}
