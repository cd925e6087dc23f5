package ai.authtrail.util.grpc.trailers;

import com.google.common.collect.ImmutableSet;

import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which captured response headers may be copied into trailers.
 * Keys owned by the transport are never eligible, whatever the mode.
 */
public final class PropagationRule {

    public enum Mode {
        ALL,
        ALLOW,
        DENY
    }

    private static final Set<String> RESERVED_KEYS = ImmutableSet.of(
        "content-type",
        "content-length",
        "te",
        "host",
        "user-agent",
        "connection",
        "keep-alive",
        "transfer-encoding",
        "upgrade",
        "trailer"
    );

    private static final PropagationRule COPY_ALL = new PropagationRule(Mode.ALL, ImmutableSet.of());

    private final Mode mode;
    private final Set<String> keys;

    private PropagationRule(Mode mode, Set<String> keys) {
        this.mode = mode;
        this.keys = keys;
    }

    public static PropagationRule copyAll() {
        return COPY_ALL;
    }

    public static PropagationRule allowOnly(String... keys) {
        return allowOnly(Arrays.asList(keys));
    }

    public static PropagationRule allowOnly(Collection<String> keys) {
        return new PropagationRule(Mode.ALLOW, normalize(keys));
    }

    public static PropagationRule denyAll(String... keys) {
        return denyAll(Arrays.asList(keys));
    }

    public static PropagationRule denyAll(Collection<String> keys) {
        return new PropagationRule(Mode.DENY, normalize(keys));
    }

    public static PropagationRule fromConfig(String mode, Collection<String> keys) {
        Objects.requireNonNull(mode, "propagation mode is null");
        final Mode parsed;
        try {
            parsed = Mode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new PropagationRuleException("Unknown propagation mode '%s', expected one of %s"
                .formatted(mode, Arrays.toString(Mode.values())));
        }

        return switch (parsed) {
            case ALL -> {
                if (keys != null && !keys.isEmpty()) {
                    throw new PropagationRuleException("Propagation mode ALL does not take header names, got " + keys);
                }
                yield copyAll();
            }
            case ALLOW -> allowOnly(keys == null ? Set.of() : keys);
            case DENY -> denyAll(keys == null ? Set.of() : keys);
        };
    }

    public static boolean isReserved(String key) {
        var normalized = HeaderSet.normalize(key);
        return normalized.startsWith(":") || normalized.startsWith("grpc-") || RESERVED_KEYS.contains(normalized);
    }

    /**
     * Rejects rules which explicitly ask for transport-owned keys.
     *
     * @throws PropagationRuleException if an allow-list names a reserved key
     */
    public void validate() throws PropagationRuleException {
        if (mode != Mode.ALLOW) {
            return;
        }

        var reserved = keys.stream()
            .filter(PropagationRule::isReserved)
            .sorted()
            .collect(Collectors.toList());
        if (!reserved.isEmpty()) {
            throw new PropagationRuleException("Reserved headers cannot be propagated to trailers: " + reserved);
        }
    }

    public boolean isEligible(String key) {
        var normalized = HeaderSet.normalize(key);
        if (isReserved(normalized)) {
            return false;
        }

        return switch (mode) {
            case ALL -> true;
            case ALLOW -> keys.contains(normalized);
            case DENY -> !keys.contains(normalized);
        };
    }

    public Mode mode() {
        return mode;
    }

    public Set<String> keys() {
        return keys;
    }

    private static Set<String> normalize(Collection<String> keys) {
        Objects.requireNonNull(keys, "keys is null");
        return keys.stream()
            .map(HeaderSet::normalize)
            .filter(key -> !key.isEmpty())
            .collect(ImmutableSet.toImmutableSet());
    }

    @Override
    public String toString() {
        return mode == Mode.ALL ? "PropagationRule{ALL}" : "PropagationRule{" + mode + " " + keys + "}";
    }
}
