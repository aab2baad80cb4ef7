package com.heronix.grader.controller.api;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.grader.diagnostics.Diagnostic;
import com.heronix.grader.model.domain.GradeReport;
import com.heronix.grader.model.domain.ImportOptions;
import com.heronix.grader.model.domain.ReportOptions;
import com.heronix.grader.model.enums.ReportSection;
import com.heronix.grader.model.table.GradeTable;
import com.heronix.grader.service.GradingRunService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for grade reports of the configured course.
 */
@RestController
@RequestMapping("/api/v1/grader")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Grade Reports", description = "APIs for computing course grades and LMS imports")
public class GradeReportController {

    static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final GradingRunService runService;

    @GetMapping("/report")
    @Operation(summary = "Compute report", description = "Compute the grades of the configured course")
    @ApiResponse(responseCode = "200", description = "Report returned")
    public ResponseEntity<ReportResponse> report(
            @RequestParam(required = false) List<ReportSection> include,
            @RequestParam(required = false) List<String> includeOthers,
            @RequestParam(required = false) String sortBy,
            @RequestParam(defaultValue = "true") boolean descending) {

        log.info("Computing report (include: {}, others: {})", include, includeOthers);

        GradeReport report = compute(include, includeOthers, sortBy, descending);
        return ResponseEntity.ok(ReportResponse.of(report));
    }

    @GetMapping(value = "/report.csv", produces = "text/csv")
    @Operation(summary = "Download report", description = "Compute the grades of the configured course as CSV")
    @ApiResponse(responseCode = "200", description = "CSV report returned")
    public ResponseEntity<String> reportCsv(
            @RequestParam(required = false) List<ReportSection> include,
            @RequestParam(required = false) List<String> includeOthers,
            @RequestParam(required = false) String sortBy,
            @RequestParam(defaultValue = "true") boolean descending) {

        GradeReport report = compute(include, includeOthers, sortBy, descending);
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"grades.csv\"")
                .body(runService.toCsv(report.table()));
    }

    @PostMapping(value = "/import", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE}, produces = "text/csv")
    @Operation(summary = "Create LMS import", description = "Turn a (hand-edited) report CSV into an LMS grade import")
    @ApiResponse(responseCode = "200", description = "Import CSV returned")
    public ResponseEntity<String> createImport(
            @RequestBody String reportCsv,
            @RequestParam(required = false) String letterGradeColumn,
            @RequestParam(required = false) Boolean standardize,
            @RequestParam(required = false) List<String> includeOthers) {

        ImportOptions.ImportOptionsBuilder options = runService.configuredImportOptions().toBuilder();
        if (letterGradeColumn != null) {
            options.letterGradeColumn(letterGradeColumn);
        }
        if (standardize != null) {
            options.standardize(standardize);
        }
        if (includeOthers != null) {
            options.includeOthers(includeOthers);
        }

        GradeTable table = runService.createImport(new StringReader(reportCsv), "request body", options.build());
        log.info("Created LMS import for {} students", table.size());

        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"import.csv\"")
                .body(runService.toCsv(table));
    }

    @GetMapping("/diagnostics")
    @Operation(summary = "Course diagnostics", description = "Warnings raised while building the configured course")
    @ApiResponse(responseCode = "200", description = "Diagnostics returned")
    public ResponseEntity<List<Diagnostic>> diagnostics() {
        return ResponseEntity.ok(runService.buildConfiguredCourse().getDiagnostics());
    }

    private GradeReport compute(List<ReportSection> include, List<String> includeOthers,
                                String sortBy, boolean descending) {
        ReportOptions.ReportOptionsBuilder options = runService.configuredReportOptions().toBuilder();
        if (include != null && !include.isEmpty()) {
            options.include(EnumSet.copyOf(include));
        }
        if (includeOthers != null) {
            options.includeOthers(includeOthers);
        }

        GradeReport report = runService.computeReport(options.build());
        if (sortBy != null) {
            report = report.sortedBy(sortBy, descending);
        }
        return report;
    }

    // ========================================================================
    // REQUEST/RESPONSE TYPES
    // ========================================================================

    public record ReportResponse(
            List<String> columns,
            List<Map<String, Object>> rows,
            List<Diagnostic> diagnostics
    ) {
        static ReportResponse of(GradeReport report) {
            GradeTable table = report.table();
            List<Map<String, Object>> rows = new ArrayList<>(table.size());
            for (String id : table.rowIds()) {
                rows.add(table.row(id));
            }
            return new ReportResponse(table.columns(), rows, report.diagnostics());
        }
    }
}
