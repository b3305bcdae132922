package com.quarry.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for quarry tests.
 *
 * <p>Logs the start and end of every test and gives subclasses
 * {@link #logStep(String)} / {@link #logData(String, Object)} for
 * Given/When/Then style narration. Subclasses override {@link #doSetUp()}
 * and {@link #doTearDown()} instead of declaring their own lifecycle methods.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private String testName;

    @BeforeEach
    protected final void setUpBase(TestInfo testInfo) {
        testName = testInfo.getDisplayName();
        logger.debug("Starting test: {}", testName);
        doSetUp();
    }

    @AfterEach
    protected final void tearDownBase() {
        try {
            doTearDown();
        } finally {
            logger.debug("Finished test: {}", testName);
        }
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

    protected void logStep(String step) {
        logger.info("  {}", step);
    }

    protected void logData(String label, Object value) {
        logger.info("    {}: {}", label, value);
    }
}
