package com.regressionsentinel.framework.collaborator;

import com.regressionsentinel.core.model.PerformanceMetrics;
import com.regressionsentinel.core.model.TimeRange;

import java.util.List;

/**
 * External store of performance baselines.
 *
 * <p>
 * Baseline persistence and quality gating belong to the implementation; the
 * framework only records a baseline after each run (unless the run asks to
 * skip it) and lists baselines for exports.
 * </p>
 */
public interface BaselineRecorder {

    /**
     * Record the metrics of a run as a baseline candidate.
     *
     * @param testType   test type, for example {@code load}
     * @param descriptor the run
     * @param metrics    measured metrics
     * @param metadata   version and tags of the run
     * @return the stored baseline
     */
    BaselineRecord recordBaseline(String testType, TestDescriptor descriptor, PerformanceMetrics metrics,
            RunMetadata metadata);

    /**
     * @param range filter on the baseline timestamp; {@code null} for all
     * @return the baselines to include in an export
     */
    List<BaselineRecord> exportBaselines(TimeRange range);
}
