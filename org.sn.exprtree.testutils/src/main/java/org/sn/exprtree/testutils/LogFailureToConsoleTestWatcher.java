package org.sn.exprtree.testutils;

import java.util.Arrays;
import java.util.Optional;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.TestWatcher;


/**
 * Log the call stack of a failed test to stderr after the test method finishes,
 * cut off below the last frame that belongs to this project.
 */
public final class LogFailureToConsoleTestWatcher implements TestWatcher {
    private static final String PROJECT_PACKAGE_PREFIX = "org.sn.exprtree.";

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
        // set lastElem to the last item in the call stack that starts with "org.sn.exprtree."
        // but exclude the shell's main, which tests may call directly
        int lastElem = stackTraceElements.length - 1;
        for ( ; lastElem >= 0; lastElem--) {
            StackTraceElement elem = stackTraceElements[lastElem];
            if (elem.getClassName().startsWith(PROJECT_PACKAGE_PREFIX) && !elem.getMethodName().equals("main")) {
                break;
            }
        }
        if (lastElem < 0) {
            return stackTraceElements;
        }
        return Arrays.copyOf(stackTraceElements, lastElem + 1);
    }
}
