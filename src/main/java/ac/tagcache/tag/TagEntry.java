package ac.tagcache.tag;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Non-owning reference from a tag to a store entry: a plain key, a hash field,
 * or a set / sorted-set member. Fields and members are held as the exact bytes
 * the store keeps for them.
 * <p>
 * Index form: {@code s:<key>} for plain keys and {@code <kind>:<base64 bytes>:<key>}
 * otherwise. Base64 never contains {@code ':'}, so the key may contain anything.
 */
public final class TagEntry {
    private static final char SEPARATOR = ':';

    private final StructureKind kind;
    private final String key;
    private final byte[] member;

    private TagEntry(StructureKind kind, String key, byte[] member) {
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.key = Objects.requireNonNull(key, "Key cannot be null");
        if (kind.hasMember() && member == null) {
            throw new IllegalArgumentException(kind + " entries need a field or member");
        }
        this.member = kind.hasMember() ? member.clone() : null;
    }

    public static TagEntry stringKey(String key) {
        return new TagEntry(StructureKind.STRING, key, null);
    }

    public static TagEntry hashField(String key, byte[] field) {
        return new TagEntry(StructureKind.HASH_FIELD, key, field);
    }

    public static TagEntry setMember(String key, byte[] member) {
        return new TagEntry(StructureKind.SET_MEMBER, key, member);
    }

    public static TagEntry sortedSetMember(String key, byte[] member) {
        return new TagEntry(StructureKind.SORTED_SET_MEMBER, key, member);
    }

    public static TagEntry parse(String indexMember) {
        if (indexMember == null || indexMember.length() < 2 || indexMember.charAt(1) != SEPARATOR) {
            throw new IllegalArgumentException("Malformed tag entry: " + indexMember);
        }
        StructureKind kind = StructureKind.fromPrefix(indexMember.charAt(0));
        String rest = indexMember.substring(2);
        if (!kind.hasMember()) {
            return new TagEntry(kind, rest, null);
        }
        int separator = rest.indexOf(SEPARATOR);
        if (separator < 0) {
            throw new IllegalArgumentException("Malformed tag entry: " + indexMember);
        }
        byte[] member = Base64.getDecoder().decode(rest.substring(0, separator));
        return new TagEntry(kind, rest.substring(separator + 1), member);
    }

    public String toIndexMember() {
        StringBuilder sb = new StringBuilder(key.length() + 8)
                .append(kind.getPrefix())
                .append(SEPARATOR);
        if (kind.hasMember()) {
            sb.append(Base64.getEncoder().encodeToString(member)).append(SEPARATOR);
        }
        return sb.append(key).toString();
    }

    public StructureKind getKind() {
        return kind;
    }

    public String getKey() {
        return key;
    }

    /**
     * Encoded field or member, {@code null} for plain keys.
     */
    public byte[] getMember() {
        return member == null ? null : member.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TagEntry that = (TagEntry) o;
        return kind == that.kind &&
                key.equals(that.key) &&
                Arrays.equals(member, that.member);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(kind, key) + Arrays.hashCode(member);
    }

    @Override
    public String toString() {
        return toIndexMember();
    }
}
