package org.sn.blockdeque.testutils;

import java.util.Arrays;
import java.util.Optional;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.TestWatcher;


/**
 * Print the call stack of a failed test to stderr once the test method finishes.
 * The call stack is cut after the last frame in our own code, so the junit and reflection frames are not printed.
 */
public final class LogFailureToConsoleTestWatcher implements TestWatcher {
    private static final String OUR_PACKAGE_PREFIX = "org.sn.blockdeque.";

    @Override
    public void testDisabled(ExtensionContext context, Optional<String> reason) {
    }

    @Override
    public void testSuccessful(ExtensionContext context) {
    }

    @Override
    public void testAborted(ExtensionContext context, Throwable cause) {
        System.err.println(context.getDisplayName() + " aborted");
    }

    @Override
    public void testFailed(ExtensionContext context, Throwable cause) {
        System.err.println(context.getDisplayName() + " failed");
        cause.setStackTrace(truncateCallStack(cause.getStackTrace()));
        cause.printStackTrace();
    }

    private static StackTraceElement[] truncateCallStack(StackTraceElement[] stackTraceElements) {
        // set lastElem to the last item in the call stack that is in our package
        int lastElem = stackTraceElements.length - 1;
        for ( ; lastElem >= 0; lastElem--) {
            StackTraceElement elem = stackTraceElements[lastElem];
            if (elem.getClassName().startsWith(OUR_PACKAGE_PREFIX)) {
                break;
            }
        }
        if (lastElem < 0) {
            return stackTraceElements;
        }
        return Arrays.copyOf(stackTraceElements, lastElem + 1);
    }
}
