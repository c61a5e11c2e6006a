package ac.tagcache.tag;

/**
 * The shape of the store entry a {@link TagEntry} points at.
 */
public enum StructureKind {
    STRING('s'),
    HASH_FIELD('h'),
    SET_MEMBER('m'),
    SORTED_SET_MEMBER('z');

    private final char prefix;

    StructureKind(char prefix) {
        this.prefix = prefix;
    }

    public char getPrefix() {
        return prefix;
    }

    public boolean hasMember() {
        return this != STRING;
    }

    public static StructureKind fromPrefix(char prefix) {
        for (StructureKind kind : values()) {
            if (kind.prefix == prefix) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown structure kind prefix: " + prefix);
    }
}
