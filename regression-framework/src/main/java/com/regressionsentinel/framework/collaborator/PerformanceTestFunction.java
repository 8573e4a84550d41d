package com.regressionsentinel.framework.collaborator;

import com.regressionsentinel.core.model.PerformanceMetrics;

/**
 * The measured workload of a performance test. Any exception it throws is
 * the system under test failing and is propagated to the caller unchanged.
 */
@FunctionalInterface
public interface PerformanceTestFunction {

    PerformanceMetrics run() throws Exception;
}
