package org.railyard.pipeline.api.data;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Thrown when an input table lacks columns a stage needs.
 */
public class MissingColumnsException extends RuntimeException {

    private final SortedSet<String> missingColumns;

    public MissingColumnsException(String owner, Collection<String> missingColumns) {
        super(String.format("%s: required columns %s are missing from the input", owner, new TreeSet<>(missingColumns)));
        this.missingColumns = Collections.unmodifiableSortedSet(new TreeSet<>(missingColumns));
    }

    public SortedSet<String> getMissingColumns() {
        return missingColumns;
    }
}
