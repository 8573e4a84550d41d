package com.regressionsentinel.framework.collaborator;

import com.regressionsentinel.core.model.PerformanceMetrics;
import com.regressionsentinel.core.model.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Keeps recorded baselines in memory. Used when no baseline service is
 * attached to the process, so exports still list the runs seen since start.
 */
public class InMemoryBaselineRecorder implements BaselineRecorder {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryBaselineRecorder.class);

    private final Clock clock;
    private final List<BaselineRecord> records = new ArrayList<>();

    public InMemoryBaselineRecorder(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public synchronized BaselineRecord recordBaseline(String testType, TestDescriptor descriptor,
            PerformanceMetrics metrics, RunMetadata metadata) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        BaselineRecord record = new BaselineRecord(
                "baseline-" + descriptor.getName() + "-" + clock.millis(),
                testType, descriptor.getName(), clock.instant(), metrics);
        if (metadata != null) {
            record.setVersion(metadata.getVersion());
            record.setTags(metadata.getTags());
        }
        records.add(record);
        LOG.debug("Recorded baseline {} for [{}]", record.getId(), descriptor.getName());
        return record;
    }

    @Override
    public synchronized List<BaselineRecord> exportBaselines(TimeRange range) {
        if (range == null) {
            return List.copyOf(records);
        }
        return records.stream().filter(r -> range.contains(r.getTimestamp())).toList();
    }
}
