package ac.tagcache;

import ac.tagcache.tag.TagEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Cache provider contract: typed access to strings, hashes, sets, sorted sets and
 * HyperLogLogs of the backing store, a cache-aside fetch path, and a tag index
 * over keys, hash fields and set members.
 * <p>
 * Reads never fail on a miss: they return {@code null}, an empty {@link Optional},
 * an empty collection or zero. Store failures surface as
 * {@link ac.tagcache.exception.StoreConnectivityException}, codec failures as
 * {@link ac.tagcache.exception.SerializationException}.
 * <p>
 * Operations that take tags <em>replace</em> the tags of the written entry;
 * operations without a tags argument leave the tag index untouched. Tags are
 * associated only when the value write actually happened.
 */
public interface CacheProvider {

    // ==================== FETCH ====================

    /**
     * Fetches data from the cache using the given key. On a miss the value returned
     * by {@code producer} is written under the key and returned.
     *
     * @param key      the cache key
     * @param producer computes the value, only executed on a miss
     */
    <T> T fetchObject(String key, Supplier<? extends T> producer);

    /**
     * @param ttl expiration of the produced value, {@code null} for none
     */
    <T> T fetchObject(String key, Supplier<? extends T> producer, Duration ttl);

    /**
     * Fetches data from the cache using the given key. On a hit the stored value is
     * returned and the remaining arguments are ignored. On a miss the produced value
     * is written under the key with the given ttl, and associated to the tags that
     * {@code tagBuilder} derives from it.
     *
     * @param key        the cache key
     * @param producer   computes the value, only executed on a miss
     * @param tagBuilder derives the tags from the produced value, {@code null} for no tags
     * @param ttl        expiration of the produced value, {@code null} for none
     */
    <T> T fetchObject(String key, Supplier<? extends T> producer, TagBuilder<? super T> tagBuilder, Duration ttl);

    <F, T> T fetchHashed(String key, F field, Supplier<? extends T> producer);

    <F, T> T fetchHashed(String key, F field, Supplier<? extends T> producer, Duration ttl);

    /**
     * Fetches hashed data using the given key and field. On a miss the produced value
     * is written to the field, the ttl is applied to the whole hash, and the field is
     * associated to the tags {@code tagBuilder} derives from the value.
     */
    <F, T> T fetchHashed(String key, F field, Supplier<? extends T> producer,
                         TagBuilder<? super T> tagBuilder, Duration ttl);

    // ==================== STRINGS ====================

    <T> T getObject(String key);

    /**
     * @return the value, or empty when the key does not exist
     */
    <T> Optional<T> tryGetObject(String key);

    void setObject(String key, Object value);

    /**
     * Sets the value of a key.
     *
     * @param ttl  expiration, {@code null} for none
     * @param when condition for the write
     * @return whether the write happened
     */
    boolean setObject(String key, Object value, Duration ttl, When when);

    /**
     * Sets the value of a key and replaces its tags with {@code tags}.
     *
     * @return whether the write happened; tags are untouched when it did not
     */
    boolean setObject(String key, Object value, Collection<String> tags, Duration ttl, When when);

    /**
     * Atomically sets the key to {@code value} and returns the previous value,
     * {@code null} when there was none.
     */
    <T> T getSetObject(String key, T value);

    // ==================== KEYS ====================

    boolean keyExists(String key);

    /**
     * Keys matching a glob-style pattern. Lazy; iterating again restarts the match.
     */
    Iterable<String> getKeysByPattern(String pattern);

    /**
     * Sets the expiration of a key to an absolute point in time.
     *
     * @return whether the expiration was updated
     */
    boolean keyExpire(String key, Instant expiration);

    /**
     * Sets the time to live of a key.
     *
     * @return whether the expiration was updated
     */
    boolean keyTimeToLive(String key, Duration ttl);

    /**
     * Remaining time to live of a key; empty when the key does not exist or
     * has no expiration.
     */
    Optional<Duration> keyTimeToLive(String key);

    /**
     * Removes the expiration of a key.
     *
     * @return whether an expiration was removed
     */
    boolean keyPersist(String key);

    boolean remove(String key);

    /**
     * @return the number of keys removed
     */
    long remove(String... keys);

    /**
     * Flushes every database on every master node.
     */
    void flushAll();

    // ==================== HASHES ====================

    <F, T> T getHashed(String key, F field);

    <F, T> Optional<T> tryGetHashed(String key, F field);

    /**
     * Values of {@code fields}, positionally aligned; a missing field yields {@code null}.
     */
    <F, T> List<T> getHashed(String key, List<F> fields);

    /**
     * Every field of the hash keyed by field name; empty when the key does not exist.
     * <p>
     * Field names are read back as UTF-8 text, so this suits hashes written with
     * {@code String} fields. Fields of other types are stored in the value codec's
     * binary form and come back as that form decoded as text; read them with
     * {@link #getHashed(String, Object)} instead.
     */
    <T> Map<String, T> getHashedAll(String key);

    void setHashed(String key, Object field, Object value);

    /**
     * Sets one field of a hash.
     *
     * @param ttl  applied to the whole hash, {@code null} keeps the current expiration
     * @param when condition for the write, evaluated on the field
     * @return whether the write happened
     */
    boolean setHashed(String key, Object field, Object value, Duration ttl, When when);

    /**
     * Sets one field of a hash and replaces the tags of that field.
     */
    boolean setHashed(String key, Object field, Object value, Collection<String> tags, Duration ttl, When when);

    /**
     * Sets several fields of a hash.
     *
     * @return the number of fields written
     */
    int setHashed(String key, Map<?, ?> fieldValues, Duration ttl, When when);

    /**
     * Entries of the hash whose field name matches a glob-style pattern.
     * Lazy; iterating again restarts the match. Like {@link #getHashedAll(String)},
     * only meaningful for {@code String} fields.
     */
    <T> Iterable<Map.Entry<String, T>> scanHashed(String key, String pattern);

    boolean removeHashed(String key, Object field);

    // ==================== SETS ====================

    void addToSet(String key, Object member);

    /**
     * Adds a member to a set.
     *
     * @param tags tags of the member, {@code null} to leave them untouched
     * @param ttl  applied to the whole set, {@code null} keeps the current expiration
     */
    void addToSet(String key, Object member, Collection<String> tags, Duration ttl);

    /**
     * @return whether the member was removed
     */
    boolean removeFromSet(String key, Object member);

    void addToSortedSet(String key, double score, Object member);

    /**
     * Adds a member to a sorted set with the given score.
     *
     * @param tags tags of the member, {@code null} to leave them untouched
     * @param ttl  applied to the whole sorted set, {@code null} keeps the current expiration
     */
    void addToSortedSet(String key, double score, Object member, Collection<String> tags, Duration ttl);

    boolean removeFromSortedSet(String key, Object member);

    // ==================== HYPERLOGLOG ====================

    /**
     * @return whether at least one internal register was altered
     */
    boolean hyperLogLogAdd(String key, Object item);

    boolean hyperLogLogAdd(String key, Collection<?> items);

    /**
     * Approximate number of distinct items added; 0 when the key does not exist.
     */
    long hyperLogLogCount(String key);

    // ==================== TAGS ====================

    /**
     * Whether a string key is a live member of any of the given tags.
     */
    boolean isStringKeyInTag(String key, String... tags);

    /**
     * Whether a hash field is a live member of any of the given tags.
     */
    boolean isHashFieldInTag(String key, Object field, String... tags);

    /**
     * Whether a set or sorted set member is a live member of any of the given tags.
     */
    boolean isSetMemberInTag(String key, Object member, String... tags);

    /**
     * Live entries of any of the given tags.
     */
    Set<TagEntry> getEntriesByTag(String... tags);

    /**
     * Distinct keys holding live entries of any of the given tags.
     */
    Set<String> getKeysByTag(String... tags);

    /**
     * Values of the live string keys tagged with any of the given tags.
     */
    <T> List<T> getObjectsByTag(String... tags);

    Set<String> getAllTags();

    void removeTagsFromKey(String key, String... tags);

    void removeTagsFromHashField(String key, Object field, String... tags);

    void removeTagsFromSetMember(String key, Object member, String... tags);

    /**
     * Removes every key, hash field and set member referenced by the given tags,
     * and the tags themselves.
     *
     * @return the number of entries removed; entries that were already gone are not counted
     */
    int invalidateKeysByTag(String... tags);

    // ==================== STATISTICS ====================

    CacheStatistics getStatistics();
}
