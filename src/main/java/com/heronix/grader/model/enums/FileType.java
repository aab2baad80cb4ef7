package com.heronix.grader.model.enums;

import java.util.List;

import com.heronix.grader.model.domain.ColumnMapping;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Known gradebook export formats and their column conventions.
 */
@Getter
@RequiredArgsConstructor
public enum FileType {

    /**
     * Gradescope: "Name" as "First Last", SID and Email columns
     */
    GS("Gradescope",
            ColumnMapping.builder().full("Name").id("SID").email("Email").build(),
            " ", false, List.of()),

    /**
     * WebAssign: "Fullname" as "Last, First", no ID column, ND/NS for missing work
     */
    WA("WebAssign",
            ColumnMapping.builder().full("Fullname").email("Email").build(),
            ", ", true, List.of("ND", "NS"));

    /**
     * Display name of the source platform
     */
    private final String displayName;

    /**
     * Columns holding student information in this format
     */
    private final ColumnMapping columns;

    /**
     * Separator between names in the full name column
     */
    private final String nameSeparator;

    /**
     * Whether the full name starts with the last name
     */
    private final boolean lastNameFirst;

    /**
     * Cell values meaning "no score"
     */
    private final List<String> missingValues;
}
