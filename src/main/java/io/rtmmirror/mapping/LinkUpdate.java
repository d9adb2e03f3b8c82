package io.rtmmirror.mapping;

import java.util.List;
import java.util.Objects;

/**
 * One link field write. The verb is always chosen by the caller; an empty key list under
 * {@link LinkVerb#SET} means "clear", under the other verbs it is a no-op.
 */
public record LinkUpdate(LinkField field, LinkVerb verb, List<String> keys) {
    public LinkUpdate {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(verb, "verb");
        keys = keys == null ? List.of() : List.copyOf(keys);
    }

    public static LinkUpdate set(LinkField field, List<String> keys) {
        return new LinkUpdate(field, LinkVerb.SET, keys);
    }

    public static LinkUpdate add(LinkField field, List<String> keys) {
        return new LinkUpdate(field, LinkVerb.ADD, keys);
    }

    public static LinkUpdate remove(LinkField field, List<String> keys) {
        return new LinkUpdate(field, LinkVerb.REMOVE, keys);
    }
}
