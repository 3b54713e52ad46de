package org.sn.blockdeque.testutils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.util.ArrayList;
import java.util.List;
import java.util.PrimitiveIterator;
import java.util.concurrent.Callable;
import java.util.function.Consumer;
import org.junit.jupiter.params.ParameterizedTest;


public class TestUtil {
    private TestUtil() {
    }

    public static final String PARAMETRIZED_TEST_DISPLAY_NAME = ParameterizedTest.DISPLAY_NAME_PLACEHOLDER + " [" + ParameterizedTest.INDEX_PLACEHOLDER + "]";


    /**
     * Drain an int iterator into a list, so that hamcrest's collection matchers can be used on it.
     */
    public static List<Integer> toList(PrimitiveIterator.OfInt iter) {
        List<Integer> list = new ArrayList<>();
        while (iter.hasNext()) {
            list.add(iter.nextInt());
        }
        return list;
    }

    /**
     * Assert that the desired exception is thrown.
     * 
     * @throws AssertionError if assertion fails
     */
    public static <T, U extends Throwable> void assertExceptionFromCallable(Callable<T> callable, Class<U> expectedExceptionClass) {
        assertExceptionFromCallable(callable, expectedExceptionClass, unused -> { });
    }

    /**
     * Assert that the desired exception is thrown.
     *
     * @throws AssertionError if assertion fails
     */
    public static <T, U extends Throwable> void assertExceptionFromCallable(Callable<T> callable, Class<U> expectedExceptionClass, String expectedMessage) {
        assertExceptionFromCallable(callable, expectedExceptionClass, exception -> assertEquals(expectedMessage, exception.getMessage()));
    }

    /**
     * Assert that the desired exception is thrown.
     *
     * @param callable the function to run.
     * @param expectedExceptionClass the class of exception to expect.
     * @param exceptionChecker the function to check if the exception has the right value,
     *        for example <code>exception -> assertEquals(expectedMessage, exception.getMessage())</code>
     * @throws AssertionError if assertion fails
     */
    @SuppressWarnings("unchecked")
    public static <T, U extends Throwable> void assertExceptionFromCallable(Callable<T> callable, Class<U> expectedExceptionClass, Consumer<U> exceptionChecker) {
        try {
            callable.call();
        } catch (Throwable e) {
            assertTrue(expectedExceptionClass.isInstance(e), "Expected " + expectedExceptionClass.getSimpleName()
                    + " or an exception derived from it, " + "but got " + e.getClass().getSimpleName());
            exceptionChecker.accept((U) e);
            return;
        }
        fail("Expected exception " + expectedExceptionClass.getSimpleName() + ", but got no exception");
    }

    /**
     * Assert that the desired exception is thrown.
     * 
     * @throws AssertionError if assertion fails
     */
    public static <U extends Throwable> void assertException(Runnable runnable, Class<U> expectedExceptionClass) {
        assertException(runnable, expectedExceptionClass, unused -> { });
    }

    /**
     * Assert that the desired exception is thrown.
     *
     * @throws AssertionError if assertion fails
     */
    public static <U extends Throwable> void assertException(Runnable runnable, Class<U> expectedExceptionClass, String expectedMessage) {
        assertException(runnable, expectedExceptionClass, exception -> assertEquals(expectedMessage, exception.getMessage()));
    }

    /**
     * Assert that the desired exception is thrown.
     *
     * @param runnable the function to run.
     * @param expectedExceptionClass the class of exception to expect.
     * @param exceptionChecker the function to check if the exception has the right value,
     *        for example <code>exception -> assertEquals(expectedMessage, exception.getMessage())</code>
     * @throws AssertionError if assertion fails
     */
    @SuppressWarnings("unchecked")
    public static <U extends Throwable> void assertException(Runnable runnable, Class<U> expectedExceptionClass, Consumer<U> exceptionChecker) {
        try {
            runnable.run();
        } catch (RuntimeException | Error e) {
            assertTrue(expectedExceptionClass.isInstance(e), "Expected " + expectedExceptionClass.getSimpleName()
                    + " or an exception derived from it, " + "but got " + e.getClass().getSimpleName());
            exceptionChecker.accept((U) e);
            return;
        }
        fail("Expected exception " + expectedExceptionClass.getSimpleName() + ", but got no exception");
    }
}
