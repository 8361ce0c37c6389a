package com.datcoord.store;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

public class LocalContentStore implements ContentStore {
    private final Path root;

    public LocalContentStore(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    @Override
    public ContentId put(byte[] data) {
        Objects.requireNonNull(data, "data");
        ContentId id = ContentDigests.contentIdOf(data);
        Path target = pathOf(id);
        if (Files.exists(target)) {
            return id;
        }
        try {
            Files.createDirectories(root);
            Path temp = Files.createTempFile(root, "blob", ".tmp");
            Files.write(temp, data);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return id;
        } catch (IOException e) {
            throw new StorageUnavailableException("unable to write blob under " + root, e);
        }
    }

    @Override
    public byte[] get(ContentId id) {
        try {
            return Files.readAllBytes(pathOf(id));
        } catch (NoSuchFileException e) {
            throw new ContentNotFoundException(id);
        } catch (IOException e) {
            throw new StorageUnavailableException("unable to read blob " + id, e);
        }
    }

    @Override
    public String describe() {
        return "local:" + root;
    }

    private Path pathOf(ContentId id) {
        String value = id.value();
        if (!value.startsWith(ContentDigests.PREFIX)) {
            throw new ContentNotFoundException(id);
        }
        String hex = value.substring(ContentDigests.PREFIX.length());
        if (!hex.matches("[0-9a-f]{64}")) {
            throw new ContentNotFoundException(id);
        }
        return root.resolve(hex + ".blob");
    }
}
