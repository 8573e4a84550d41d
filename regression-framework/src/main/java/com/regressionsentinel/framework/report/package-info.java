/**
 * Recommendations, report files and data exports.
 */
package com.regressionsentinel.framework.report;
