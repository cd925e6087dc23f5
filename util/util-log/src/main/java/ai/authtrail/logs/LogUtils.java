package ai.authtrail.logs;

import org.apache.logging.log4j.CloseableThreadContext;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

public final class LogUtils {
    private LogUtils() { }

    public static Map<String, String> callContext(String methodName, String callId) {
        var context = new HashMap<String, String>();
        context.put(LogContextKey.METHOD, methodName);
        context.put(LogContextKey.CALL_ID, callId);
        return context;
    }

    public static void withLoggingContext(Map<String, String> additionalContext, Runnable f) {
        try (var ignore = CloseableThreadContext.putAll(additionalContext)) {
            f.run();
        }
    }

    public static <T> T withLoggingContext(Map<String, String> additionalContext, Supplier<T> f) {
        try (var ignore = CloseableThreadContext.putAll(additionalContext)) {
            return f.get();
        }
    }
}
