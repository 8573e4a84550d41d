package com.regressionsentinel.framework.collaborator;

import com.regressionsentinel.core.model.VisualRegressionResult;

/**
 * External visual regression service: captures screenshots and compares
 * them with the stored references.
 */
public interface VisualRegressionRunner {

    VisualRegressionResult runVisualTest(String testName, VisualTestOptions options);

    /**
     * Delete screenshots older than the retention.
     *
     * @param retentionDays age in days beyond which screenshots are removed
     */
    void cleanupOldScreenshots(int retentionDays);
}
