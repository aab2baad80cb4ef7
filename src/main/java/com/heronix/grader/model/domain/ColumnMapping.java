package com.heronix.grader.model.domain;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;

/**
 * Names of the columns of a raw export that carry student information.
 *
 * Either {@code first} and {@code last} or {@code full} identifies the name;
 * {@code id} and/or {@code email} identifies the student. Unused entries are null.
 */
@Builder(toBuilder = true)
public record ColumnMapping(
        String first,
        String last,
        String full,
        String id,
        String email
) {

    public boolean hasSplitNames() {
        return first != null && last != null;
    }

    public boolean hasFullName() {
        return full != null;
    }

    /**
     * Raw columns consumed by this mapping; they are not passed through.
     */
    public List<String> mappedColumns() {
        List<String> mapped = new ArrayList<>();
        for (String column : new String[] {first, last, full, id, email}) {
            if (column != null) {
                mapped.add(column);
            }
        }
        return mapped;
    }
}
