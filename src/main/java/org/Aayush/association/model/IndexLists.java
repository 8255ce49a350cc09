package org.Aayush.association.model;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import lombok.experimental.UtilityClass;
import org.Aayush.association.core.AssociationException;

/**
 * Helpers for the ordered, duplicate-free index lists that map cost-matrix rows and
 * columns back to positions in the caller's collections.
 */
@UtilityClass
public class IndexLists {

    /**
     * Returns {@code [0, size)} as a fresh list.
     */
    public IntArrayList all(int size) {
        IntArrayList indices = new IntArrayList(size);
        for (int i = 0; i < size; i++) {
            indices.add(i);
        }
        return indices;
    }

    /**
     * Returns {@code indices} when present, otherwise every position of a collection of {@code size}.
     */
    public IntList orAll(IntList indices, int size) {
        return indices == null ? all(size) : indices;
    }

    /**
     * Validates that every index is inside {@code [0, size)} and appears once.
     *
     * @param indices index list to check.
     * @param size size of the referenced collection.
     * @param name list name used in the failure message.
     * @throws AssociationException on out-of-range or duplicate entries.
     */
    public void validate(IntList indices, int size, String name) {
        IntOpenHashSet seen = new IntOpenHashSet(indices.size());
        for (int i = 0; i < indices.size(); i++) {
            int index = indices.getInt(i);
            if (index < 0 || index >= size) {
                throw new AssociationException(
                        AssociationException.REASON_INVALID_INDEX,
                        name + "[" + i + "] = " + index + " is outside [0, " + size + ")"
                );
            }
            if (!seen.add(index)) {
                throw new AssociationException(
                        AssociationException.REASON_DUPLICATE_INDEX,
                        name + " contains duplicate index " + index
                );
            }
        }
    }
}
