package ai.authtrail.auth.utils;

import java.util.Locale;
import java.util.Objects;

public final class TokenParser {
    private static final String BEARER = "bearer";

    private TokenParser() {
    }

    public static Token parse(String header) throws IllegalArgumentException {
        Objects.requireNonNull(header, "header is null");

        var trimmed = header.trim();
        var separator = trimmed.indexOf(' ');
        if (separator > 0) {
            var scheme = trimmed.substring(0, separator);
            var token = trimmed.substring(separator + 1).trim();
            if (BEARER.equals(scheme.toLowerCase(Locale.ROOT)) && !token.isEmpty()) {
                return new Token(Token.Kind.BEARER, token);
            }
        }

        throw new IllegalArgumentException("Authorization header is invalid: it MUST start with \"Bearer\" " +
            "authentication scheme and token divided by space(s) (RFC 6750).");
    }

    public record Token(Kind kind, String token) {
        public enum Kind {
            BEARER
        }
    }
}
