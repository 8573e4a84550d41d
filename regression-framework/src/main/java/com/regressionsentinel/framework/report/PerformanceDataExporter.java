package com.regressionsentinel.framework.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.regressionsentinel.core.store.ObjectMappers;
import com.regressionsentinel.framework.model.ExportFormat;
import com.regressionsentinel.framework.model.PerformanceExport;
import com.regressionsentinel.framework.model.PerformanceReport;
import com.regressionsentinel.framework.model.PerformanceTestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Writes exports and reports to disk.
 *
 * <p>
 * JSON goes through the shared indenting mapper. CSV flattens one row per
 * test result:
 * </p>
 *
 * <pre>
 * timestamp,testName,testType,regressionDetected,responseTime,throughput,errorRate
 * </pre>
 */
public class PerformanceDataExporter {

    private static final Logger LOG = LoggerFactory.getLogger(PerformanceDataExporter.class);

    static final String CSV_HEADER =
            "timestamp,testName,testType,regressionDetected,responseTime,throughput,errorRate";

    private final ObjectMapper mapper;

    public PerformanceDataExporter() {
        this(ObjectMappers.standard());
    }

    public PerformanceDataExporter(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * @throws IllegalStateException if the file cannot be written
     */
    public void export(PerformanceExport data, Path path, ExportFormat format) {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(format, "format must not be null");
        switch (format) {
            case JSON -> writeJson(data, path);
            case CSV -> writeText(toCsv(data.getTestResults()), path);
        }
        LOG.info("Exported {} test result(s) as {} to {}", data.getTestResults().size(), format, path);
    }

    /**
     * Write a report as {@code <directory>/<id>.json}.
     *
     * @return the written file
     * @throws IllegalStateException if the file cannot be written
     */
    public Path writeReport(PerformanceReport report, Path directory) {
        Objects.requireNonNull(report, "report must not be null");
        Path path = directory.resolve(report.getId() + ".json");
        writeJson(report, path);
        LOG.debug("Saved report {} to {}", report.getId(), path);
        return path;
    }

    public static String toCsv(List<PerformanceTestResult> results) {
        StringJoiner lines = new StringJoiner("\n");
        lines.add(CSV_HEADER);
        for (PerformanceTestResult r : results) {
            StringJoiner row = new StringJoiner(",");
            row.add(r.getTimestamp().toString());
            row.add(csvField(r.getTestName()));
            row.add(csvField(r.getTestType()));
            row.add(String.valueOf(r.isRegressionDetected()));
            row.add(number(r.getMetrics().getResponseTime().getMean()));
            row.add(number(r.getMetrics().getThroughput().getRequestsPerSecond()));
            row.add(number(r.getMetrics().getErrorMetrics().getErrorRate()));
            lines.add(row.toString());
        }
        return lines.toString();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void writeJson(Object value, Path path) {
        try {
            createParent(path);
            mapper.writeValue(path.toFile(), value);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write " + path, e);
        }
    }

    private static void writeText(String text, Path path) {
        try {
            createParent(path);
            Files.writeString(path, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write " + path, e);
        }
    }

    private static void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    /** Integral values print without a fraction. */
    static String number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    static String csvField(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return '"' + value.replace("\"", "\"\"") + '"';
        }
        return value;
    }
}
