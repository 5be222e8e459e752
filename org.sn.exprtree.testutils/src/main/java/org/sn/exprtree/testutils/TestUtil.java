package org.sn.exprtree.testutils;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Consumer;
import org.hamcrest.BaseMatcher;
import org.hamcrest.Description;
import org.junit.jupiter.params.ParameterizedTest;


public class TestUtil {
    private TestUtil() {
    }

    public static final String PARAMETRIZED_TEST_DISPLAY_NAME = ParameterizedTest.DISPLAY_NAME_PLACEHOLDER + " [" + ParameterizedTest.INDEX_PLACEHOLDER + "]";

    /**
     * Split a string like "7 8 * 2 4 / -" on whitespace.
     * An empty or blank string gives an empty list.
     */
    public static List<String> tokens(String expression) {
        String trimmed = expression.trim();
        if (trimmed.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(trimmed.split("\\s+"));
    }

    /**
     * Assert that the desired exception is thrown.
     *
     * @param callable the function to run.
     * @param expectedExceptionClass the class of exception to expect.
     * @param exceptionChecker the function to check if the exception has the right value,
     *        for example <code>exception -> assertEquals(ErrorKind.INVALID_TOKEN, exception.getKind())</code>
     * @throws AssertionError if assertion fails
     */
    @SuppressWarnings("unchecked")
    public static <T, U extends Throwable> void assertExceptionFromCallable(Callable<T> callable, Class<U> expectedExceptionClass, Consumer<U> exceptionChecker) {
        Throwable thrown = null;
        try {
            callable.call();
        } catch (Throwable e) {
            thrown = e;
        }
        if (thrown == null) {
            fail("Expected exception " + expectedExceptionClass.getSimpleName() + ", but got no exception");
        }
        assertTrue(expectedExceptionClass.isInstance(thrown), "Expected " + expectedExceptionClass.getSimpleName()
                + " or an exception derived from it, " + "but got " + thrown.getClass().getSimpleName());
        exceptionChecker.accept((U) thrown);
    }

    /**
     * Assert that the desired exception is thrown.
     * 
     * @throws AssertionError if assertion fails
     */
    public static <U extends Throwable> void assertException(Runnable runnable, Class<U> expectedExceptionClass) {
        assertException(runnable, expectedExceptionClass, ignored -> { });
    }

    /**
     * Assert that the desired exception is thrown.
     *
     * @param runnable the function to run.
     * @param expectedExceptionClass the class of exception to expect.
     * @param exceptionChecker the function to check if the exception has the right value
     * @throws AssertionError if assertion fails
     */
    @SuppressWarnings("unchecked")
    public static <U extends Throwable> void assertException(Runnable runnable, Class<U> expectedExceptionClass, Consumer<U> exceptionChecker) {
        RuntimeException thrown = null;
        try {
            runnable.run();
        } catch (RuntimeException e) {
            thrown = e;
        }
        if (thrown == null) {
            fail("Expected exception " + expectedExceptionClass.getSimpleName() + ", but got no exception");
        }
        assertTrue(expectedExceptionClass.isInstance(thrown), "Expected " + expectedExceptionClass.getSimpleName()
                + " or an exception derived from it, " + "but got " + thrown.getClass().getSimpleName());
        exceptionChecker.accept((U) thrown);
    }

    public static <T extends Comparable<T>> Between<T> between(T low, T high) {
        return new Between<>(low, high);
    }
    
    public static class Between<T extends Comparable<T>> extends BaseMatcher<T> {
        private final T low;
        private final T high;
        
        public Between(T low, T high) {
            if (low.compareTo(high) > 0) {
                throw new IllegalArgumentException("low (" + low + ") should be less than or equal to high (" + high + ")");
            }
            this.low = low;
            this.high = high;
        }

        @Override
        public boolean matches(Object actualObject) {
            @SuppressWarnings("unchecked")
            T actual = (T) actualObject;
            return low.compareTo(actual) <= 0 && high.compareTo(actual) >= 0;
        }

        @Override
        public void describeTo(Description description) {
            description.appendText("between " + low + " and " + high + " inclusive");
        }
    }
}
