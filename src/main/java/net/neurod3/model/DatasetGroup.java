package net.neurod3.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A primary catalog entry together with the near-duplicates found for it in other catalogs.
 *
 * @param primary representative shown by default
 * @param alternates near-duplicates in scan order, possibly empty
 */
public record DatasetGroup(DatasetRecord primary, List<DatasetRecord> alternates) {

    public DatasetGroup {
        Objects.requireNonNull(primary, "primary");
        alternates = alternates == null ? List.of() : List.copyOf(alternates);
    }

    public boolean hasDuplicates() {
        return !alternates.isEmpty();
    }

    public int size() {
        return 1 + alternates.size();
    }

    /**
     * Primary followed by its alternates.
     */
    public List<DatasetRecord> members() {
        List<DatasetRecord> members = new ArrayList<>(size());
        members.add(primary);
        members.addAll(alternates);
        return List.copyOf(members);
    }
}
