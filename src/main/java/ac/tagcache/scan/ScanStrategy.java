package ac.tagcache.scan;

/**
 * How key and hash-field enumerations are executed.
 */
public enum ScanStrategy {
    /** Pick from topology and server version on first use. */
    AUTO,
    /** Incremental cursor sweep ({@code SCAN}, {@code HSCAN}). */
    SCAN,
    /** Full listing ({@code KEYS}, {@code HGETALL}) filtered client side where needed. */
    KEYS
}
