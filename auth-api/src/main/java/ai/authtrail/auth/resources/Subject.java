package ai.authtrail.auth.resources;

import java.util.Objects;

public record Subject(String id, String name) {
    public Subject {
        Objects.requireNonNull(id, "id is null");
        Objects.requireNonNull(name, "name is null");
    }

    public String str() {
        return name + "(" + id + ")";
    }
}
