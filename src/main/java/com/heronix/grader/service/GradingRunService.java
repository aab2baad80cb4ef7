package com.heronix.grader.service;

import java.io.Reader;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.heronix.grader.adapter.csv.CsvTableReader;
import com.heronix.grader.adapter.csv.CsvTableWriter;
import com.heronix.grader.config.CourseConfigFactory;
import com.heronix.grader.config.GraderProperties;
import com.heronix.grader.config.GraderProperties.GradebookConfig;
import com.heronix.grader.diagnostics.Diagnostic;
import com.heronix.grader.diagnostics.GradingDiagnostics;
import com.heronix.grader.exception.GradingConfigException;
import com.heronix.grader.model.domain.Course;
import com.heronix.grader.model.domain.GradeReport;
import com.heronix.grader.model.domain.Gradebook;
import com.heronix.grader.model.domain.ImportOptions;
import com.heronix.grader.model.domain.ReportOptions;
import com.heronix.grader.model.table.GradeTable;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Grading run orchestration: reads the configured gradebook exports, builds
 * the course, computes and writes the report, and prepares the LMS import.
 *
 * Data Flow:
 * CSV exports → SchemaNormalizer → GradebookMerger → GradeAggregator → CSV report → ImportExporter
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GradingRunService {

    private final GraderProperties properties;
    private final CourseConfigFactory configFactory;
    private final CsvTableReader csvReader;
    private final CsvTableWriter csvWriter;
    private final SchemaNormalizer normalizer;
    private final GradebookMerger merger;
    private final GradeAggregator aggregator;
    private final ImportExporter importExporter;

    /**
     * Result of a full grading run.
     */
    public record RunResult(
            int students,
            Path reportPath,
            Path importPath,
            List<Diagnostic> diagnostics,
            LocalDateTime startedAt,
            LocalDateTime completedAt
    ) {}

    /**
     * Read and normalize every configured gradebook.
     */
    public List<Gradebook> loadGradebooks(GradingDiagnostics diagnostics) {
        if (properties.getGradebooks().isEmpty()) {
            throw new GradingConfigException("No gradebook configured under heronix.grader.gradebooks");
        }
        List<Gradebook> gradebooks = new ArrayList<>();
        for (GradebookConfig config : properties.getGradebooks()) {
            GradeTable raw = csvReader.read(Path.of(config.getPath()));
            gradebooks.add(normalizer.normalize(config.getPath(), raw,
                    configFactory.normalizationOptions(config), diagnostics));
        }
        return gradebooks;
    }

    /**
     * Build the configured course from its gradebook files.
     * Normalization warnings are included in the course diagnostics.
     */
    public Course buildConfiguredCourse() {
        GradingDiagnostics diagnostics = new GradingDiagnostics();
        List<Gradebook> gradebooks = loadGradebooks(diagnostics);
        Course course = merger.buildCourse(configFactory.assignments(), gradebooks, configFactory.infoColumns());
        if (diagnostics.isEmpty()) {
            return course;
        }
        diagnostics.addAll(course.getDiagnostics());
        return new Course(course.getAssignments(), course.getInfoColumns(), course.getRoster(),
                course.getGradebook(), course.getGrades(), diagnostics.list());
    }

    public GradeReport computeReport(ReportOptions options) {
        return aggregator.computeGrades(buildConfiguredCourse(), options);
    }

    public ReportOptions configuredReportOptions() {
        return configFactory.reportOptions();
    }

    public ImportOptions configuredImportOptions() {
        return configFactory.importOptions();
    }

    /**
     * Build the LMS import from a report CSV.
     */
    public GradeTable createImport(Reader reportCsv, String source, ImportOptions options) {
        return importExporter.createImport(csvReader.read(reportCsv, source), options);
    }

    public String toCsv(GradeTable table) {
        return csvWriter.writeToString(table);
    }

    /**
     * Run the configured course end to end and write the output files.
     */
    public RunResult runConfiguredCourse() {
        LocalDateTime startedAt = LocalDateTime.now();
        GraderProperties.ReportConfig reportConfig = properties.getReport();

        log.info("GRADER: Starting run over {} gradebooks", properties.getGradebooks().size());

        Course course = buildConfiguredCourse();
        GradeReport report = aggregator.computeGrades(course, configFactory.reportOptions());

        GradeTable table = report.table();
        if (reportConfig.getSortBy() != null && table.hasColumn(reportConfig.getSortBy())) {
            table = table.sortedBy(reportConfig.getSortBy(), reportConfig.isSortDescending());
        }
        Path reportPath = Path.of(reportConfig.getOutput());
        csvWriter.write(table, reportPath);

        Path importPath = null;
        GraderProperties.ReimportConfig reimport = properties.getReimport();
        if (reimport.isEnabled()) {
            Path input = reimport.getInput() != null ? Path.of(reimport.getInput()) : reportPath;
            importPath = Path.of(reimport.getOutput());
            GradeTable edited = csvReader.read(input);
            csvWriter.write(importExporter.createImport(edited, configFactory.importOptions()), importPath);
        }

        List<Diagnostic> diagnostics = new ArrayList<>(course.getDiagnostics());
        diagnostics.addAll(report.diagnostics());
        log.info("GRADER: Run complete for {} students with {} warnings", table.size(), diagnostics.size());

        return new RunResult(table.size(), reportPath, importPath, diagnostics, startedAt, LocalDateTime.now());
    }
}
