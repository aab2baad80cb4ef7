package com.heronix.grader.model.domain;

import java.util.List;

/**
 * Names of the standardized student information columns of every gradebook.
 */
public record InfoColumns(
        String last,
        String first,
        String id,
        String email
) {

    public static final InfoColumns DEFAULT = new InfoColumns("Last Name", "First Name", "ID", "Email");

    public InfoColumns {
        if (last == null || first == null || id == null || email == null) {
            throw new IllegalArgumentException("All info column names are required");
        }
    }

    /**
     * The info columns in roster order: last, first, ID, email.
     */
    public List<String> all() {
        return List.of(last, first, id, email);
    }
}
