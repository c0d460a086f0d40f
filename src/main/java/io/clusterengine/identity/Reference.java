package io.clusterengine.identity;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.regex.Pattern;

/**
 * A caller-supplied reference to an entity: either its UUID or its name.
 * Raw tokens are classified once, at the API boundary.
 */
@Getter
@EqualsAndHashCode
public final class Reference {

    private static final Pattern UUID_PATTERN = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    public enum Kind {
        BY_ID,
        BY_NAME
    }

    private final Kind kind;
    private final String value;

    private Reference(Kind kind, String value) {
        this.kind = kind;
        this.value = value;
    }

    public static Reference byId(String id) {
        return new Reference(Kind.BY_ID, id);
    }

    public static Reference byName(String name) {
        return new Reference(Kind.BY_NAME, name);
    }

    /**
     * A well-formed UUID is an id reference, anything else is a name.
     */
    public static Reference parse(String token) {
        String trimmed = token == null ? "" : token.trim();
        return isUuid(trimmed) ? byId(trimmed) : byName(trimmed);
    }

    public static boolean isUuid(String token) {
        return token != null && UUID_PATTERN.matcher(token).matches();
    }

    public boolean isById() {
        return kind == Kind.BY_ID;
    }

    @Override
    public String toString() {
        return value;
    }
}
