package ai.authtrail.util.grpc.trailers;

import io.grpc.Metadata;
import io.grpc.Status;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scratch state of one intercepted call: captured headers, final status and lifecycle phase.
 *
 * <p>Phases go {@code STARTED -> HANDLER_RUNNING -> SUCCEEDED|FAILED -> TRAILERS_MERGED -> SENT};
 * {@code CANCELLED} may be entered from any phase before {@code TRAILERS_MERGED}.
 */
public final class CallContext {
    private static final Logger LOG = LogManager.getLogger(CallContext.class);

    private final PropagationRule rule;
    private final HeaderSet headers = new HeaderSet();
    private final AtomicReference<CallPhase> phase = new AtomicReference<>(CallPhase.STARTED);

    @Nullable
    private volatile Status status = null;

    public CallContext(PropagationRule rule) {
        this.rule = Objects.requireNonNull(rule, "rule is null");
    }

    public HeaderSet headers() {
        return headers;
    }

    public CallPhase phase() {
        return phase.get();
    }

    @Nullable
    public Status status() {
        return status;
    }

    public void handlerStarted() {
        phase.compareAndSet(CallPhase.STARTED, CallPhase.HANDLER_RUNNING);
    }

    /**
     * Records the final status of the handler chain.
     *
     * @return {@code false} if the call was already finished or cancelled, so nothing must be merged
     */
    public boolean finish(Status status) {
        var next = status.isOk() ? CallPhase.SUCCEEDED : CallPhase.FAILED;
        while (true) {
            var current = phase.get();
            if (current != CallPhase.STARTED && current != CallPhase.HANDLER_RUNNING) {
                return false;
            }
            if (phase.compareAndSet(current, next)) {
                this.status = status;
                return true;
            }
        }
    }

    /**
     * Appends eligible captured headers to {@code trailers}. Runs at most once per call and only
     * after {@link #finish(Status)}; any other invocation leaves {@code trailers} untouched.
     *
     * @return number of copied header values
     */
    public int mergeInto(Metadata trailers) {
        if (!phase.compareAndSet(CallPhase.SUCCEEDED, CallPhase.TRAILERS_MERGED)
            && !phase.compareAndSet(CallPhase.FAILED, CallPhase.TRAILERS_MERGED))
        {
            LOG.trace("Skip trailers merge in phase {}", phase.get());
            return 0;
        }

        return copyInto(trailers, "trailers");
    }

    /**
     * Copies eligible captured headers to {@code target} without touching the call phase.
     */
    public int copyInto(Metadata target, String targetName) {
        int copied = 0;
        for (var key : List.copyOf(headers.keys())) {
            if (!rule.isEligible(key)) {
                LOG.trace("Header '{}' is not eligible for {}", key, targetName);
                continue;
            }

            var values = headers.get(key);
            try {
                append(target, key, values);
            } catch (IllegalArgumentException e) {
                LOG.warn("Cannot copy header '{}' to {}: {}", key, targetName, e.getMessage());
                continue;
            }

            copied += values.size();
            LOG.debug("Copied header '{}' with value '{}' to {}", key, values, targetName);
        }
        return copied;
    }

    public void markSent() {
        phase.compareAndSet(CallPhase.TRAILERS_MERGED, CallPhase.SENT);
    }

    /**
     * Moves the call to {@code CANCELLED} and drops captured headers, unless trailers were already merged.
     */
    public boolean cancel() {
        while (true) {
            var current = phase.get();
            if (current.isFinished()) {
                return false;
            }
            if (phase.compareAndSet(current, CallPhase.CANCELLED)) {
                headers.clear();
                return true;
            }
        }
    }

    private static void append(Metadata target, String key, List<String> values) {
        if (key.endsWith(Metadata.BINARY_HEADER_SUFFIX)) {
            var binaryKey = Metadata.Key.of(key, Metadata.BINARY_BYTE_MARSHALLER);
            for (var value : values) {
                target.put(binaryKey, value.getBytes(StandardCharsets.UTF_8));
            }
        } else {
            var asciiKey = Metadata.Key.of(key, Metadata.ASCII_STRING_MARSHALLER);
            for (var value : values) {
                target.put(asciiKey, value);
            }
        }
    }

    @Override
    public String toString() {
        return "CallContext{phase=" + phase.get() + ", status=" + status + ", headers=" + headers + "}";
    }
}
