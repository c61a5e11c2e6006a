package ac.tagcache;

/**
 * Condition under which a write is performed.
 */
public enum When {
    /** Write unconditionally. */
    ALWAYS,
    /** Write only when the key (or hash field) already exists. */
    IF_EXISTS,
    /** Write only when the key (or hash field) does not exist yet. */
    IF_NOT_EXISTS
}
