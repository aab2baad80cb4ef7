package com.heronix.grader.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.heronix.grader.diagnostics.GradingDiagnostics;
import com.heronix.grader.exception.GradeValidationException;
import com.heronix.grader.exception.SchemaException;
import com.heronix.grader.model.domain.ColumnMapping;
import com.heronix.grader.model.domain.Gradebook;
import com.heronix.grader.model.domain.InfoColumns;
import com.heronix.grader.model.domain.NormalizationOptions;
import com.heronix.grader.model.enums.DiagnosticType;
import com.heronix.grader.model.table.GradeTable;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a raw export into a gradebook with standard info columns keyed by
 * student ID.
 *
 * Steps:
 * 1. resolve the column mapping (explicit mapping over file type preset); a
 *    raw column already named like an info column fills that info column when
 *    the mapping leaves it uncovered
 * 2. replace empty cells and missing value aliases by the absent marker
 * 3. build first/last names, splitting a full name column if needed
 * 4. take the ID column, filling absent IDs from the email username
 * 5. reject absent and duplicated IDs
 * 6. append every other column unchanged
 */
@Component
@Slf4j
public class SchemaNormalizer {

    public Gradebook normalize(String source, GradeTable raw, NormalizationOptions options,
                               GradingDiagnostics diagnostics) {
        NormalizationOptions.Effective effective = options.resolve();
        InfoColumns info = effective.infoColumns();
        requireMapped(raw, effective.columns());
        ColumnMapping mapping = completeMapping(raw, effective.columns(), info);

        Set<String> missingAliases = new HashSet<>(effective.missingValues());
        List<String> rawRows = raw.rowIds();

        // Names
        Map<String, String[]> names = new LinkedHashMap<>();
        if (mapping.hasSplitNames()) {
            for (String row : rawRows) {
                names.put(row, new String[] {
                        cell(raw, row, mapping.first(), missingAliases),
                        cell(raw, row, mapping.last(), missingAliases)});
            }
        } else if (mapping.hasFullName()) {
            names.putAll(splitNames(raw, mapping.full(), effective, missingAliases, diagnostics));
        } else {
            throw new SchemaException("First and last name columns or a full name column must be specified");
        }

        // IDs
        if (mapping.id() == null && mapping.email() == null) {
            throw new SchemaException("An ID column or an email column must be provided");
        }
        Map<String, String> emails = new LinkedHashMap<>();
        Map<String, String> ids = new LinkedHashMap<>();
        for (String row : rawRows) {
            String email = mapping.email() == null ? null : cell(raw, row, mapping.email(), missingAliases);
            String id = mapping.id() == null ? null : cell(raw, row, mapping.id(), missingAliases);
            if (id == null && email != null) {
                id = emailUsername(email);
            }
            emails.put(row, email);
            ids.put(row, id);
        }
        checkIds(ids, names);

        // Assemble
        Set<String> passthrough = new LinkedHashSet<>(raw.columns());
        passthrough.removeAll(mapping.mappedColumns());
        List<String> shadowed = passthrough.stream().filter(info.all()::contains).toList();
        if (!shadowed.isEmpty()) {
            diagnostics.warn(DiagnosticType.DUPLICATE_COLUMN, "Columns " + shadowed + " of " + source
                    + " are replaced by the info columns built from " + mapping.mappedColumns());
            passthrough.removeAll(shadowed);
        }

        GradeTable.Builder builder = GradeTable.builder().columns(info.all()).columns(passthrough);
        for (String row : rawRows) {
            String id = ids.get(row);
            builder.set(id, info.last(), names.get(row)[1]);
            builder.set(id, info.first(), names.get(row)[0]);
            builder.set(id, info.id(), id);
            builder.set(id, info.email(), emails.get(row));
            for (String column : passthrough) {
                builder.set(id, column, cell(raw, row, column, missingAliases));
            }
        }

        GradeTable table = builder.build();
        log.info("Normalized {} students from {}", table.size(), source);
        return new Gradebook(source, table, info);
    }

    /**
     * Split full names into {first, last}, using only the first two parts.
     */
    private Map<String, String[]> splitNames(GradeTable raw, String fullColumn,
                                             NormalizationOptions.Effective effective,
                                             Set<String> missingAliases, GradingDiagnostics diagnostics) {
        Pattern separator = Pattern.compile(Pattern.quote(effective.nameSeparator()));
        int firstIndex = effective.lastNameFirst() ? 1 : 0;
        int lastIndex = 1 - firstIndex;

        Map<String, String[]> names = new LinkedHashMap<>();
        List<String> ambiguous = new ArrayList<>();
        for (String row : raw.rowIds()) {
            String full = cell(raw, row, fullColumn, missingAliases);
            if (full == null) {
                names.put(row, new String[] {null, null});
                continue;
            }
            String[] parts = separator.split(full, -1);
            if (parts.length > 2) {
                ambiguous.add(full);
            }
            names.put(row, new String[] {part(parts, firstIndex), part(parts, lastIndex)});
        }

        if (!ambiguous.isEmpty()) {
            diagnostics.warn(DiagnosticType.NAME_SPLIT,
                    "The following students have more than 2 names, the name split may be incorrect: " + ambiguous);
        }
        return names;
    }

    /**
     * Fill the roles the mapping leaves open from raw columns carrying the info column name.
     */
    private ColumnMapping completeMapping(GradeTable raw, ColumnMapping mapping, InfoColumns info) {
        List<String> used = mapping.mappedColumns();
        ColumnMapping.ColumnMappingBuilder completed = mapping.toBuilder();
        if (!mapping.hasSplitNames() && !mapping.hasFullName()
                && isFree(raw, used, info.first()) && isFree(raw, used, info.last())) {
            completed.first(info.first()).last(info.last());
        }
        if (mapping.id() == null && isFree(raw, used, info.id())) {
            completed.id(info.id());
        }
        if (mapping.email() == null && isFree(raw, used, info.email())) {
            completed.email(info.email());
        }
        return completed.build();
    }

    private static boolean isFree(GradeTable raw, List<String> used, String column) {
        return raw.hasColumn(column) && !used.contains(column);
    }

    private void checkIds(Map<String, String> ids, Map<String, String[]> names) {
        List<String> withoutId = new ArrayList<>();
        ids.forEach((row, id) -> {
            if (id == null) {
                String[] name = names.get(row);
                withoutId.add(name[0] + " " + name[1]);
            }
        });
        if (!withoutId.isEmpty()) {
            throw new GradeValidationException("Some students do not have an ID nor an email", withoutId);
        }

        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (String id : ids.values()) {
            if (!seen.add(id)) {
                duplicates.add(id);
            }
        }
        if (!duplicates.isEmpty()) {
            throw new GradeValidationException("Some IDs are duplicated", duplicates);
        }
    }

    private void requireMapped(GradeTable raw, ColumnMapping mapping) {
        List<String> missing = mapping.mappedColumns().stream()
                .filter(column -> !raw.hasColumn(column))
                .toList();
        if (!missing.isEmpty()) {
            throw new SchemaException("Columns " + missing + " not found in " + raw.columns());
        }
    }

    private static String cell(GradeTable raw, String row, String column, Set<String> missingAliases) {
        String value = raw.getText(row, column);
        if (value == null || value.isEmpty() || missingAliases.contains(value)) {
            return null;
        }
        return value;
    }

    private static String part(String[] parts, int index) {
        return index < parts.length ? parts[index] : null;
    }

    static String emailUsername(String email) {
        int at = email.indexOf('@');
        return at < 0 ? email : email.substring(0, at);
    }
}
