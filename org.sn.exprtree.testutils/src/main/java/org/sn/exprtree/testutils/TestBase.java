package org.sn.exprtree.testutils;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.junit.jupiter.api.extension.ExtendWith;


/**
 * Base class of the expression tree tests.
 * Prints when the tests of a class start and end, and when each test starts and ends.
 * A test may change the default locale, for example to check that messages do not depend on it,
 * and the locale is put back after each test.
 */
@ExtendWith(LogFailureToConsoleTestWatcher.class)
public abstract class TestBase {
    private static Instant startOfClass;
    private Instant startOfTest;
    private Locale defaultLocale;

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
        defaultLocale = Locale.getDefault();
        System.out.println("--------------------------------------------------------------------------------");
        System.out.println("test started: " + testInfo.getDisplayName());
    }
    
    @AfterEach
    void printTestFinished(TestInfo testInfo) {
        Locale.setDefault(defaultLocale);
        System.out.println("test finished: " + testInfo.getDisplayName()
                                   + "(" + Duration.between(startOfTest, Instant.now()).toMillis() + "ms)");
    }
}
