package com.heronix.grader.config;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.heronix.grader.config.GraderProperties.AssignmentConfig;
import com.heronix.grader.config.GraderProperties.ColumnsConfig;
import com.heronix.grader.config.GraderProperties.GradebookConfig;
import com.heronix.grader.config.GraderProperties.SchemeConfig;
import com.heronix.grader.exception.GradingConfigException;
import com.heronix.grader.model.domain.Assignment;
import com.heronix.grader.model.domain.ColumnMapping;
import com.heronix.grader.model.domain.ImportOptions;
import com.heronix.grader.model.domain.InfoColumns;
import com.heronix.grader.model.domain.LetterScale;
import com.heronix.grader.model.domain.NormalizationOptions;
import com.heronix.grader.model.domain.ReportOptions;
import com.heronix.grader.model.enums.ReportSection;
import com.heronix.grader.model.scheme.GradingScheme;

import lombok.RequiredArgsConstructor;

/**
 * Translates {@link GraderProperties} into grading domain objects.
 */
@Component
@RequiredArgsConstructor
public class CourseConfigFactory {

    private final GraderProperties properties;

    public InfoColumns infoColumns() {
        GraderProperties.InfoColumnsConfig config = properties.getInfoColumns();
        return new InfoColumns(config.getLast(), config.getFirst(), config.getId(), config.getEmail());
    }

    public NormalizationOptions normalizationOptions(GradebookConfig config) {
        if (config.getFileType() == null && config.getColumns() == null) {
            throw new GradingConfigException("Gradebook " + config.getPath() + " needs a file type or columns");
        }
        return NormalizationOptions.builder()
                .fileType(config.getFileType())
                .columns(columnMapping(config.getColumns()))
                .infoColumns(infoColumns())
                .lastNameFirst(config.getLastNameFirst())
                .nameSeparator(config.getNameSeparator())
                .missingValues(config.getMissingValues())
                .build();
    }

    public List<Assignment> assignments() {
        List<Assignment> assignments = new ArrayList<>();
        for (AssignmentConfig config : properties.getAssignments()) {
            assignments.add(assignment(config));
        }
        return assignments;
    }

    public Assignment assignment(AssignmentConfig config) {
        Assignment.Builder builder = Assignment.builder(config.getName())
                .testSeparator(config.getTestSeparator())
                .versionSeparator(config.getVersionSeparator());

        if (config.getNbTests() != null) {
            builder.tests(config.getNbTests());
        }

        List<Double> maxPoints = config.getMaxPoints();
        if (maxPoints == null || maxPoints.isEmpty()) {
            throw new GradingConfigException("Assignment " + config.getName() + " needs max points");
        }
        if (maxPoints.size() == 1) {
            builder.maxPoints(maxPoints.get(0));
        } else {
            builder.maxPoints(maxPoints);
        }

        List<Integer> versions = config.getNbVersions();
        if (versions != null && versions.size() == 1 && versions.get(0) != null) {
            builder.versions(versions.get(0));
        } else if (versions != null && !versions.isEmpty()) {
            builder.versions(versions);
        }

        if (config.getScaling() != null) {
            builder.scaling(config.getScaling());
        }
        return builder.schemes(schemes(config.getSchemes())).build();
    }

    public List<GradingScheme> schemes(List<SchemeConfig> configs) {
        List<GradingScheme> schemes = new ArrayList<>();
        if (configs != null) {
            for (SchemeConfig config : configs) {
                schemes.add(scheme(config));
            }
        }
        return schemes;
    }

    public GradingScheme scheme(SchemeConfig config) {
        switch (config.getType()) {
            case MEAN:
                return GradingScheme.mean();
            case DROP_LOWEST:
                if (config.getDrop() == null) {
                    throw new GradingConfigException("DROP_LOWEST scheme needs 'drop'");
                }
                return GradingScheme.drop(config.getDrop());
            case WEIGHTED_LIST:
                if (config.getWeights() == null || config.getWeights().isEmpty()) {
                    throw new GradingConfigException("WEIGHTED_LIST scheme needs 'weights'");
                }
                return GradingScheme.weights(config.getWeights());
            case WEIGHTED_MAP:
                if (config.getNamedWeights() == null || config.getNamedWeights().isEmpty()) {
                    throw new GradingConfigException("WEIGHTED_MAP scheme needs 'named-weights'");
                }
                return GradingScheme.weights(config.getNamedWeights());
            default:
                throw new GradingConfigException("Scheme type " + config.getType() + " cannot be configured from properties");
        }
    }

    public ReportOptions reportOptions() {
        GraderProperties.ReportConfig report = properties.getReport();
        List<GradingScheme> courseSchemes = schemes(properties.getCourseSchemes());
        Set<ReportSection> include = report.getInclude() == null || report.getInclude().isEmpty()
                ? ReportSection.DEFAULTS
                : EnumSet.copyOf(report.getInclude());

        ReportOptions.ReportOptionsBuilder builder = ReportOptions.builder()
                .letterScale(new LetterScale(report.getThresholds(), report.getLetters()))
                .include(include)
                .includeOthers(List.copyOf(report.getIncludeOthers()));
        if (!courseSchemes.isEmpty()) {
            builder.gradingSchemes(courseSchemes);
        }
        return builder.build();
    }

    public ImportOptions importOptions() {
        GraderProperties.ReimportConfig reimport = properties.getReimport();
        GraderProperties.ReportConfig report = properties.getReport();
        return ImportOptions.builder()
                .infoColumns(infoColumns())
                .letterGradeColumn(reimport.getLetterGradeColumn())
                .standardize(reimport.isStandardize())
                .letterScale(new LetterScale(report.getThresholds(), report.getLetters()))
                .includeOthers(List.copyOf(reimport.getIncludeOthers()))
                .build();
    }

    private ColumnMapping columnMapping(ColumnsConfig columns) {
        if (columns == null) {
            return null;
        }
        return ColumnMapping.builder()
                .first(columns.getFirst())
                .last(columns.getLast())
                .full(columns.getFull())
                .id(columns.getId())
                .email(columns.getEmail())
                .build();
    }
}
