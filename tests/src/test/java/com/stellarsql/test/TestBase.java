package com.stellarsql.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for stellarsql tests.
 *
 * <p>Provides per-test logging in Given/When/Then style and setup/teardown
 * hooks. Subclasses override {@link #doSetUp()} and {@link #doTearDown()}
 * instead of declaring their own {@code @BeforeEach} methods.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private String testName;

    @BeforeEach
    void setUpBase(TestInfo testInfo) {
        this.testName = testInfo.getDisplayName();
        logger.debug("==> {}", testName);
        doSetUp();
    }

    @AfterEach
    void tearDownBase() {
        doTearDown();
        logger.debug("<== {}", testName);
    }

    /**
     * Per-test setup hook.
     */
    protected void doSetUp() {
    }

    /**
     * Per-test teardown hook.
     */
    protected void doTearDown() {
    }

    /**
     * Returns the display name of the running test.
     */
    protected String testName() {
        return testName;
    }

    protected void logStep(String step) {
        logger.debug("  {}", step);
    }

    protected void logData(String label, Object value) {
        logger.debug("  {}: {}", label, value);
    }
}
