package org.silica.junit.extensions.logging;

import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.silica.junit.extensions.logging.LogLevel.ERROR;
import static org.silica.junit.extensions.logging.LogLevel.WARN;

/**
 * Each test logs different events; rules and captured events must not leak between tests.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class LogWatchExtensionIsolationTest {

    private static final Logger logger = LoggerFactory.getLogger(LogWatchExtensionIsolationTest.class);

    @Test
    @Order(1)
    @ExpectLog(level = ERROR, messagePattern = "first: expected error")
    void expectedErrorIsAccepted() {
        logger.info("first: ignored info");
        logger.error("first: expected error");
    }

    @Test
    @Order(2)
    @AllowLog(level = WARN, messagePattern = "second: allowed warning")
    void allowedWarningDoesNotSeePreviousError() {
        logger.warn("second: allowed warning");
    }

    @Test
    @Order(3)
    @ExpectLog(level = WARN, messagePattern = "third: repeated", occurrences = 3)
    void occurrencesAreCountedPerTest() {
        logger.warn("third: repeated");
        logger.warn("third: repeated");
        logger.warn("third: repeated");
    }

    @Test
    @Order(4)
    void infoAndDebugNeverFail() {
        logger.info("fourth: info");
        logger.debug("fourth: debug");
    }

    @Test
    @Order(5)
    @FailOnLog(disabled = true)
    void disabledWatchAcceptsAnything() {
        logger.warn("fifth: not declared");
    }
}
