package org.tilecascade.runtime.gravity;

import java.util.List;
import java.util.SortedMap;

import org.tilecascade.runtime.model.FallOperation;

/**
 * The falls of one gravity pass.
 * @param falls All applied falls, column by column from the low edge up.
 * @param bySourceRow The same falls grouped by the row they left, lowest row first. The grouping is a
 *                    stagger hint for animators.
 */
public record GravityResult(List<FallOperation> falls, SortedMap<Integer, List<FallOperation>> bySourceRow) {

    public boolean isEmpty() {
        return falls.isEmpty();
    }
}
