package ai.authtrail.auth.grpc.context;

import ai.authtrail.auth.resources.Subject;
import io.grpc.Context;
import jakarta.annotation.Nonnull;
import jakarta.annotation.Nullable;

import java.util.Objects;

public class AuthenticationContext {
    public static final Context.Key<AuthenticationContext> KEY = Context.key("authentication-context");

    private final Subject subject;

    public AuthenticationContext(Subject subject) {
        this.subject = Objects.requireNonNull(subject, "subject is null");
    }

    @Nullable
    public static AuthenticationContext current() {
        return KEY.get();
    }

    public static boolean isAuthenticated() {
        return current() != null;
    }

    @Nonnull
    public static Subject currentSubject() {
        AuthenticationContext ctx = current();
        if (ctx == null) {
            throw new IllegalStateException("Must be called in AuthenticationContext context!");
        } else {
            return ctx.getSubject();
        }
    }

    @Nonnull
    public Subject getSubject() {
        return this.subject;
    }
}
