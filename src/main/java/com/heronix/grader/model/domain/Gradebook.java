package com.heronix.grader.model.domain;

import com.heronix.grader.model.table.GradeTable;

/**
 * One normalized gradebook export: info columns first (last, first, ID, email),
 * then every other column of the source, keyed by student ID.
 *
 * @param source label of the export, used in logs
 * @param table  the normalized table
 * @param infoColumns names of the info columns in {@code table}
 */
public record Gradebook(
        String source,
        GradeTable table,
        InfoColumns infoColumns
) {

    public int size() {
        return table.size();
    }
}
