package com.regressionsentinel.framework.collaborator;

import java.util.Objects;

/**
 * Capture settings for a visual test.
 */
public final class VisualTestOptions {

    public static final int DEFAULT_WIDTH = 1920;
    public static final int DEFAULT_HEIGHT = 1080;

    private final String testType;
    private final int viewportWidth;
    private final int viewportHeight;

    public VisualTestOptions(String testType, int viewportWidth, int viewportHeight) {
        this.testType = testType;
        this.viewportWidth = viewportWidth;
        this.viewportHeight = viewportHeight;
    }

    /**
     * Options with the default desktop viewport.
     */
    public static VisualTestOptions desktop(String testType) {
        return new VisualTestOptions(testType, DEFAULT_WIDTH, DEFAULT_HEIGHT);
    }

    public String getTestType() {
        return testType;
    }

    public int getViewportWidth() {
        return viewportWidth;
    }

    public int getViewportHeight() {
        return viewportHeight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof VisualTestOptions that))
            return false;
        return viewportWidth == that.viewportWidth && viewportHeight == that.viewportHeight
                && Objects.equals(testType, that.testType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(testType, viewportWidth, viewportHeight);
    }

    @Override
    public String toString() {
        return "VisualTestOptions{testType='" + testType + "', viewport=" + viewportWidth + 'x'
                + viewportHeight + '}';
    }
}
