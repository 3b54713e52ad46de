package org.sn.blockdeque.testutils;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.junit.jupiter.api.extension.ExtendWith;


/**
 * Base test class that logs when the tests of a class start and end, and when each test starts and ends.
 * This makes it easier to study the console output of running all tests,
 * for example to find which of the randomized tests is slow.
 */
@ExtendWith(LogFailureToConsoleTestWatcher.class)
public abstract class TestBase {
    private static Instant startOfClass;
    private Instant startOfTest;

    @BeforeAll
    static void onStartAllTests() {
        startOfClass = Instant.now();
        System.out.println("start all tests");
        System.out.println("--------------------------------------------------------------------------------");
    }
    
    @AfterAll
    static void printAllTestsFinished() {
        System.out.println("--------------------------------------------------------------------------------");
        System.out.println("all tests finished"
                                   + "(" + Duration.between(startOfClass, Instant.now()).toMillis() + "ms)");
    }
    
    @BeforeEach
    void setStartOfTime(TestInfo testInfo) {
        startOfTest = Instant.now();
        System.out.println("--------------------------------------------------------------------------------");
        System.out.println("test started: " + testInfo.getDisplayName());
    }
    
    @AfterEach
    void printTestFinished(TestInfo testInfo) {
        System.out.println("test finished: " + testInfo.getDisplayName()
                                   + "(" + Duration.between(startOfTest, Instant.now()).toMillis() + "ms)");
    }
}
