package net.neurod3.model;

import java.util.Objects;

/**
 * Natural key of a catalog entry: the source catalog plus its source-local identifier.
 */
public record DatasetKey(DatasetSource source, String id) {

    public DatasetKey {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(id, "id");
    }

    @Override
    public String toString() {
        return source.label() + ":" + id;
    }
}
