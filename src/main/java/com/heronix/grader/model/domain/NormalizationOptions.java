package com.heronix.grader.model.domain;

import java.util.List;

import com.heronix.grader.exception.SchemaException;
import com.heronix.grader.model.enums.FileType;

import lombok.Builder;

/**
 * How to read one raw export into a gradebook.
 *
 * A file type preset supplies the column mapping, name format and missing
 * value aliases of a known platform. Anything set explicitly here overrides
 * the preset. Without a preset, names are separated by a space with the first
 * name first and no missing value alias is recognized besides empty cells.
 */
@Builder(toBuilder = true)
public record NormalizationOptions(
        FileType fileType,
        ColumnMapping columns,
        InfoColumns infoColumns,
        Boolean lastNameFirst,
        String nameSeparator,
        List<String> missingValues
) {

    public static final String DEFAULT_NAME_SEPARATOR = " ";

    public static NormalizationOptions preset(FileType fileType) {
        return builder().fileType(fileType).build();
    }

    public static NormalizationOptions mapping(ColumnMapping columns) {
        return builder().columns(columns).build();
    }

    /**
     * Options with the preset folded in and every default applied.
     *
     * @throws SchemaException if neither a preset nor a column mapping is given
     */
    public Effective resolve() {
        ColumnMapping mapping = columns != null ? columns : fileType != null ? fileType.getColumns() : null;
        if (mapping == null) {
            throw new SchemaException("Either a file type or a column mapping must be specified");
        }
        boolean lastFirst = lastNameFirst != null ? lastNameFirst : fileType != null && fileType.isLastNameFirst();
        String separator = nameSeparator != null ? nameSeparator
                : fileType != null ? fileType.getNameSeparator() : DEFAULT_NAME_SEPARATOR;
        List<String> missing = missingValues != null ? List.copyOf(missingValues)
                : fileType != null ? fileType.getMissingValues() : List.of();
        return new Effective(mapping, infoColumns != null ? infoColumns : InfoColumns.DEFAULT,
                lastFirst, separator, missing);
    }

    /**
     * Fully resolved normalization settings.
     */
    public record Effective(
            ColumnMapping columns,
            InfoColumns infoColumns,
            boolean lastNameFirst,
            String nameSeparator,
            List<String> missingValues
    ) {}
}
