package com.heronix.grader.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.heronix.grader.model.enums.FileType;
import com.heronix.grader.model.enums.ReportSection;
import com.heronix.grader.model.enums.SchemeType;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Configuration properties for Heronix Grader: one course, its gradebook
 * exports and how its grades are reported.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "heronix.grader")
public class GraderProperties {

    /**
     * Run the configured course once at startup and write the report files.
     */
    private boolean runOnStartup = false;

    /**
     * Names of the standard info columns
     */
    @Valid
    private InfoColumnsConfig infoColumns = new InfoColumnsConfig();

    /**
     * Gradebook exports; the first one is the reference roster
     */
    @Valid
    private List<GradebookConfig> gradebooks = new ArrayList<>();

    /**
     * Assignments of the course, in report order
     */
    @Valid
    private List<AssignmentConfig> assignments = new ArrayList<>();

    /**
     * Schemes combining assignment averages into the final grade (best one counts).
     * Defaults to the mean of all assignments.
     */
    @Valid
    private List<SchemeConfig> courseSchemes = new ArrayList<>();

    /**
     * Report configuration
     */
    @Valid
    private ReportConfig report = new ReportConfig();

    /**
     * LMS reimport configuration
     */
    @Valid
    private ReimportConfig reimport = new ReimportConfig();

    @Data
    public static class InfoColumnsConfig {
        @NotBlank
        private String last = "Last Name";

        @NotBlank
        private String first = "First Name";

        @NotBlank
        private String id = "ID";

        @NotBlank
        private String email = "Email";
    }

    @Data
    public static class GradebookConfig {
        /**
         * Path of the CSV export
         */
        @NotBlank
        private String path;

        /**
         * Known export format (GS, WA); optional when columns are given
         */
        private FileType fileType;

        /**
         * Explicit source columns, overriding the file type preset
         */
        private ColumnsConfig columns;

        /**
         * Whether the full name column starts with the last name
         */
        private Boolean lastNameFirst;

        /**
         * Separator inside the full name column
         */
        private String nameSeparator;

        /**
         * Cell values meaning "no score"
         */
        private List<String> missingValues;
    }

    @Data
    public static class ColumnsConfig {
        private String first;
        private String last;
        private String full;
        private String id;
        private String email;
    }

    @Data
    public static class AssignmentConfig {
        @NotBlank
        private String name;

        /**
         * Max points: one value for every test, or one per test
         */
        private List<Double> maxPoints = new ArrayList<>();

        /**
         * Number of tests; unset for a single test named after the assignment
         */
        private Integer nbTests;

        /**
         * Versions per test: one value for every test, or one per test; unset for bare tests
         */
        private List<Integer> nbVersions;

        /**
         * Display scale of the average; defaults to the max points or 100
         */
        private Double scaling;

        private String testSeparator = " ";

        private String versionSeparator = " - v";

        /**
         * Averaging schemes (best one counts); defaults to the mean
         */
        @Valid
        private List<SchemeConfig> schemes = new ArrayList<>();
    }

    @Data
    public static class SchemeConfig {
        private SchemeType type = SchemeType.MEAN;

        /**
         * Number of lowest scores dropped (DROP_LOWEST)
         */
        private Integer drop;

        /**
         * Positional weights (WEIGHTED_LIST)
         */
        private List<Double> weights;

        /**
         * Weights by assignment or test name (WEIGHTED_MAP)
         */
        private Map<String, Double> namedWeights = new LinkedHashMap<>();
    }

    @Data
    public static class ReportConfig {
        private List<Double> thresholds = new ArrayList<>(List.of(93.0, 90.0, 87.0, 83.0, 80.0, 75.0, 65.0, 50.0));

        private List<String> letters = new ArrayList<>(List.of("A", "A-", "B+", "B", "B-", "C+", "C", "D", "F"));

        private List<ReportSection> include = new ArrayList<>(List.of(
                ReportSection.AVERAGES, ReportSection.MISSED, ReportSection.FINAL, ReportSection.LETTER));

        /**
         * Other gradebook columns to copy, e.g. Comments
         */
        private List<String> includeOthers = new ArrayList<>();

        /**
         * Column the written report is sorted on, unset to keep roster order
         */
        private String sortBy = "Final grade";

        private boolean sortDescending = true;

        /**
         * Where the report is written
         */
        private String output = "grades.csv";
    }

    @Data
    public static class ReimportConfig {
        private boolean enabled = false;

        /**
         * Report file to read, possibly edited by hand; defaults to the report output
         */
        private String input;

        private String output = "import.csv";

        private String letterGradeColumn = "Letter grade";

        private boolean standardize = true;

        /**
         * Report columns exported as points grades, e.g. Final exam
         */
        private List<String> includeOthers = new ArrayList<>();
    }
}
