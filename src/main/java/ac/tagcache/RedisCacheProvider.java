package ac.tagcache;

import ac.tagcache.codec.HashFieldCodec;
import ac.tagcache.exception.StoreExceptionTranslator;
import ac.tagcache.scan.PatternScanner;
import ac.tagcache.scan.ScanStrategy;
import ac.tagcache.tag.StructureKind;
import ac.tagcache.tag.TagEntry;
import ac.tagcache.tag.TagIndexManager;
import org.redisson.api.BatchResult;
import org.redisson.api.RBatch;
import org.redisson.api.RBucket;
import org.redisson.api.RHyperLogLog;
import org.redisson.api.RMap;
import org.redisson.api.RMapAsync;
import org.redisson.api.RScoredSortedSet;
import org.redisson.api.RSet;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.Codec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * {@link CacheProvider} over a Redisson client.
 * <p>
 * Every store command runs through {@link StoreExceptionTranslator}; producers and
 * tag builders run outside of it so their exceptions reach the caller unchanged.
 * Value writes and tag writes are separate round trips.
 */
public class RedisCacheProvider implements CacheProvider {
    private static final Logger logger = LoggerFactory.getLogger(RedisCacheProvider.class);

    private static final String OBJECT_FLIGHT_PREFIX = "o:";
    private static final String HASH_FLIGHT_PREFIX = "h:";
    private static final int DEFAULT_SCAN_PAGE_SIZE = 250;
    private static final String DEFAULT_KEY_PREFIX = "tagcache:";

    private final RedissonClient redissonClient;
    private final HashFieldCodec codec;
    private final TagIndexManager tagIndex;
    private final PatternScanner scanner;
    private final SingleFlight singleFlight;
    private final CacheStatistics statistics;

    public RedisCacheProvider(RedissonClient redissonClient, Codec valueCodec) {
        this.redissonClient = redissonClient;
        this.codec = new HashFieldCodec(valueCodec);
        this.statistics = new CacheStatistics();
        this.scanner = new PatternScanner(redissonClient, ScanStrategy.AUTO, DEFAULT_SCAN_PAGE_SIZE);
        this.tagIndex = new TagIndexManager(redissonClient, codec, scanner, statistics, DEFAULT_KEY_PREFIX);
        this.singleFlight = SingleFlight.disabled(statistics);
    }

    public RedisCacheProvider(RedissonClient redissonClient, HashFieldCodec codec, TagIndexManager tagIndex,
                              PatternScanner scanner, SingleFlight singleFlight, CacheStatistics statistics) {
        if (redissonClient == null || codec == null || tagIndex == null || scanner == null
                || singleFlight == null || statistics == null) {
            throw new IllegalArgumentException("Provider collaborators cannot be null");
        }
        this.redissonClient = redissonClient;
        this.codec = codec;
        this.tagIndex = tagIndex;
        this.scanner = scanner;
        this.singleFlight = singleFlight;
        this.statistics = statistics;
    }

    // ==================== FETCH ====================

    @Override
    public <T> T fetchObject(String key, Supplier<? extends T> producer) {
        return fetchObject(key, producer, null, null);
    }

    @Override
    public <T> T fetchObject(String key, Supplier<? extends T> producer, Duration ttl) {
        return fetchObject(key, producer, null, ttl);
    }

    @Override
    public <T> T fetchObject(String key, Supplier<? extends T> producer, TagBuilder<? super T> tagBuilder, Duration ttl) {
        requireKey(key);
        requireProducer(producer);
        requireTtl(ttl);

        T cached = getObject(key);
        if (cached != null) {
            statistics.incrementHits();
            return cached;
        }
        statistics.incrementMisses();
        logger.debug("Cache miss for key {}", key);

        return singleFlight.execute(OBJECT_FLIGHT_PREFIX + key, () -> {
            T value = produce(producer, key);
            if (value == null) {
                return null;
            }
            Collection<String> tags = tagBuilder != null ? tagBuilder.tagsFor(value) : null;
            setObject(key, value, tags, ttl, When.ALWAYS);
            return value;
        });
    }

    @Override
    public <F, T> T fetchHashed(String key, F field, Supplier<? extends T> producer) {
        return fetchHashed(key, field, producer, null, null);
    }

    @Override
    public <F, T> T fetchHashed(String key, F field, Supplier<? extends T> producer, Duration ttl) {
        return fetchHashed(key, field, producer, null, ttl);
    }

    @Override
    public <F, T> T fetchHashed(String key, F field, Supplier<? extends T> producer,
                                TagBuilder<? super T> tagBuilder, Duration ttl) {
        requireKey(key);
        requireField(field);
        requireProducer(producer);
        requireTtl(ttl);

        T cached = getHashed(key, field);
        if (cached != null) {
            statistics.incrementHits();
            return cached;
        }
        statistics.incrementMisses();
        logger.debug("Cache miss for field {} of hash {}", field, key);

        // stored field bytes, so fields of different types never share a flight
        String flightKey = HASH_FLIGHT_PREFIX + TagEntry.hashField(key, codec.fieldBytes(field)).toIndexMember();
        return singleFlight.execute(flightKey, () -> {
            T value = produce(producer, key);
            if (value == null) {
                return null;
            }
            Collection<String> tags = tagBuilder != null ? tagBuilder.tagsFor(value) : null;
            setHashed(key, field, value, tags, ttl, When.ALWAYS);
            return value;
        });
    }

    private <T> T produce(Supplier<? extends T> producer, String key) {
        statistics.incrementProducerInvocations();
        T value = producer.get();
        if (value == null) {
            logger.debug("Producer for {} returned null, nothing cached", key);
        }
        return value;
    }

    // ==================== STRINGS ====================

    @Override
    public <T> T getObject(String key) {
        requireKey(key);
        return StoreExceptionTranslator.execute("GET " + key, () -> this.<T>bucket(key).get());
    }

    @Override
    public <T> Optional<T> tryGetObject(String key) {
        return Optional.ofNullable(getObject(key));
    }

    @Override
    public void setObject(String key, Object value) {
        setObject(key, value, null, null, When.ALWAYS);
    }

    @Override
    public boolean setObject(String key, Object value, Duration ttl, When when) {
        return setObject(key, value, null, ttl, when);
    }

    @Override
    public boolean setObject(String key, Object value, Collection<String> tags, Duration ttl, When when) {
        requireKey(key);
        requireValue(value);
        requireTtl(ttl);
        When condition = when != null ? when : When.ALWAYS;

        boolean written = StoreExceptionTranslator.execute("SET " + key,
                () -> writeBucket(this.bucket(key), value, ttl, condition));
        if (!recordWrite(written, key, condition)) {
            return false;
        }
        if (tags != null) {
            tagIndex.associateTags(tagIndex.stringEntry(key), tags);
        }
        return true;
    }

    private static boolean writeBucket(RBucket<Object> bucket, Object value, Duration ttl, When when) {
        switch (when) {
            case IF_NOT_EXISTS:
                return ttl != null ? bucket.setIfAbsent(value, ttl) : bucket.setIfAbsent(value);
            case IF_EXISTS:
                return ttl != null
                        ? bucket.setIfExists(value, ttl.toMillis(), TimeUnit.MILLISECONDS)
                        : bucket.setIfExists(value);
            case ALWAYS:
            default:
                if (ttl != null) {
                    bucket.set(value, ttl.toMillis(), TimeUnit.MILLISECONDS);
                } else {
                    bucket.set(value);
                }
                return true;
        }
    }

    @Override
    public <T> T getSetObject(String key, T value) {
        requireKey(key);
        requireValue(value);
        T previous = StoreExceptionTranslator.execute("GETSET " + key, () -> this.<T>bucket(key).getAndSet(value));
        statistics.incrementWrites();
        return previous;
    }

    // ==================== KEYS ====================

    @Override
    public boolean keyExists(String key) {
        requireKey(key);
        return StoreExceptionTranslator.execute("EXISTS " + key,
                () -> redissonClient.getKeys().countExists(key) > 0);
    }

    @Override
    public Iterable<String> getKeysByPattern(String pattern) {
        return scanner.scanKeys(pattern);
    }

    @Override
    public boolean keyExpire(String key, Instant expiration) {
        requireKey(key);
        if (expiration == null) {
            throw new IllegalArgumentException("Expiration cannot be null");
        }
        return StoreExceptionTranslator.execute("PEXPIREAT " + key,
                () -> redissonClient.getKeys().expireAt(key, expiration.toEpochMilli()));
    }

    @Override
    public boolean keyTimeToLive(String key, Duration ttl) {
        requireKey(key);
        if (ttl == null) {
            throw new IllegalArgumentException("TTL cannot be null");
        }
        requireTtl(ttl);
        return StoreExceptionTranslator.execute("PEXPIRE " + key,
                () -> redissonClient.getKeys().expire(key, ttl.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public Optional<Duration> keyTimeToLive(String key) {
        requireKey(key);
        long remaining = StoreExceptionTranslator.execute("PTTL " + key,
                () -> redissonClient.getKeys().remainTimeToLive(key));
        // -2: no such key, -1: no expiration
        return remaining < 0 ? Optional.empty() : Optional.of(Duration.ofMillis(remaining));
    }

    @Override
    public boolean keyPersist(String key) {
        requireKey(key);
        return StoreExceptionTranslator.execute("PERSIST " + key,
                () -> redissonClient.getKeys().clearExpire(key));
    }

    @Override
    public boolean remove(String key) {
        return remove(new String[]{key}) > 0;
    }

    @Override
    public long remove(String... keys) {
        if (keys == null || keys.length == 0) {
            return 0;
        }
        for (String key : keys) {
            requireKey(key);
        }
        long removed = StoreExceptionTranslator.execute("DEL " + Arrays.toString(keys),
                () -> redissonClient.getKeys().delete(keys));
        logger.debug("Removed {} of {} keys", removed, keys.length);
        return removed;
    }

    @Override
    public void flushAll() {
        StoreExceptionTranslator.run("FLUSHALL", () -> redissonClient.getKeys().flushall());
        logger.info("Flushed all databases");
    }

    // ==================== HASHES ====================

    @Override
    public <F, T> T getHashed(String key, F field) {
        requireKey(key);
        requireField(field);
        return StoreExceptionTranslator.execute("HGET " + key, () -> this.<T>map(key).get(field));
    }

    @Override
    public <F, T> Optional<T> tryGetHashed(String key, F field) {
        return Optional.ofNullable(getHashed(key, field));
    }

    @Override
    @SuppressWarnings("unchecked")
    public <F, T> List<T> getHashed(String key, List<F> fields) {
        requireKey(key);
        if (fields == null) {
            throw new IllegalArgumentException("Fields cannot be null");
        }
        if (fields.isEmpty()) {
            return Collections.emptyList();
        }
        fields.forEach(RedisCacheProvider::requireField);

        // one pipelined HGET per field keeps results aligned with non-string field types
        BatchResult<?> result = StoreExceptionTranslator.execute("HMGET " + key, () -> {
            RBatch batch = redissonClient.createBatch();
            RMapAsync<Object, Object> map = batch.getMap(key, codec);
            for (F field : fields) {
                map.getAsync(field);
            }
            return batch.execute();
        });
        List<T> values = new ArrayList<>(fields.size());
        for (Object value : result.getResponses()) {
            values.add((T) value);
        }
        return values;
    }

    @Override
    public <T> Map<String, T> getHashedAll(String key) {
        requireKey(key);
        Map<String, T> all = StoreExceptionTranslator.execute("HGETALL " + key,
                () -> redissonClient.<String, T>getMap(key, codec).readAllMap());
        return all != null ? all : Collections.emptyMap();
    }

    @Override
    public void setHashed(String key, Object field, Object value) {
        setHashed(key, field, value, null, null, When.ALWAYS);
    }

    @Override
    public boolean setHashed(String key, Object field, Object value, Duration ttl, When when) {
        return setHashed(key, field, value, null, ttl, when);
    }

    @Override
    public boolean setHashed(String key, Object field, Object value, Collection<String> tags, Duration ttl, When when) {
        requireKey(key);
        requireField(field);
        requireValue(value);
        requireTtl(ttl);
        When condition = when != null ? when : When.ALWAYS;

        boolean written = StoreExceptionTranslator.execute("HSET " + key, () -> {
            RMap<Object, Object> map = map(key);
            boolean done = writeField(map, field, value, condition);
            if (done && ttl != null) {
                map.expire(ttl);
            }
            return done;
        });
        if (!recordWrite(written, key, condition)) {
            return false;
        }
        if (tags != null) {
            tagIndex.associateTags(tagIndex.hashFieldEntry(key, field), tags);
        }
        return true;
    }

    @Override
    public int setHashed(String key, Map<?, ?> fieldValues, Duration ttl, When when) {
        requireKey(key);
        if (fieldValues == null) {
            throw new IllegalArgumentException("Field values cannot be null");
        }
        requireTtl(ttl);
        if (fieldValues.isEmpty()) {
            return 0;
        }
        for (Map.Entry<?, ?> entry : fieldValues.entrySet()) {
            requireField(entry.getKey());
            requireValue(entry.getValue());
        }
        When condition = when != null ? when : When.ALWAYS;

        int written = StoreExceptionTranslator.execute("HSET " + key, () -> {
            RMap<Object, Object> map = map(key);
            int count;
            if (condition == When.ALWAYS) {
                map.putAll(fieldValues);
                count = fieldValues.size();
            } else {
                count = 0;
                for (Map.Entry<?, ?> entry : fieldValues.entrySet()) {
                    if (writeField(map, entry.getKey(), entry.getValue(), condition)) {
                        count++;
                    }
                }
            }
            if (count > 0 && ttl != null) {
                map.expire(ttl);
            }
            return count;
        });
        for (int i = 0; i < written; i++) {
            statistics.incrementWrites();
        }
        for (int i = written; i < fieldValues.size(); i++) {
            statistics.incrementRejectedWrites();
        }
        return written;
    }

    private static boolean writeField(RMap<Object, Object> map, Object field, Object value, When when) {
        switch (when) {
            case IF_NOT_EXISTS:
                return map.fastPutIfAbsent(field, value);
            case IF_EXISTS:
                return map.fastPutIfExists(field, value);
            case ALWAYS:
            default:
                map.fastPut(field, value);
                return true;
        }
    }

    @Override
    public <T> Iterable<Map.Entry<String, T>> scanHashed(String key, String pattern) {
        requireKey(key);
        return scanner.scanHashFields(key, pattern, codec);
    }

    @Override
    public boolean removeHashed(String key, Object field) {
        requireKey(key);
        requireField(field);
        return StoreExceptionTranslator.execute("HDEL " + key, () -> map(key).fastRemove(field) > 0);
    }

    // ==================== SETS ====================

    @Override
    public void addToSet(String key, Object member) {
        addToSet(key, member, null, null);
    }

    @Override
    public void addToSet(String key, Object member, Collection<String> tags, Duration ttl) {
        requireKey(key);
        requireMember(member);
        requireTtl(ttl);

        StoreExceptionTranslator.run("SADD " + key, () -> {
            RSet<Object> set = redissonClient.getSet(key, codec);
            set.add(member);
            if (ttl != null) {
                set.expire(ttl);
            }
        });
        statistics.incrementWrites();
        if (tags != null) {
            tagIndex.associateTags(tagIndex.setMemberEntry(key, member), tags);
        }
    }

    @Override
    public boolean removeFromSet(String key, Object member) {
        requireKey(key);
        requireMember(member);
        return StoreExceptionTranslator.execute("SREM " + key,
                () -> redissonClient.getSet(key, codec).remove(member));
    }

    @Override
    public void addToSortedSet(String key, double score, Object member) {
        addToSortedSet(key, score, member, null, null);
    }

    @Override
    public void addToSortedSet(String key, double score, Object member, Collection<String> tags, Duration ttl) {
        requireKey(key);
        requireMember(member);
        requireTtl(ttl);

        StoreExceptionTranslator.run("ZADD " + key, () -> {
            RScoredSortedSet<Object> sortedSet = redissonClient.getScoredSortedSet(key, codec);
            sortedSet.add(score, member);
            if (ttl != null) {
                sortedSet.expire(ttl);
            }
        });
        statistics.incrementWrites();
        if (tags != null) {
            tagIndex.associateTags(tagIndex.sortedSetMemberEntry(key, member), tags);
        }
    }

    @Override
    public boolean removeFromSortedSet(String key, Object member) {
        requireKey(key);
        requireMember(member);
        return StoreExceptionTranslator.execute("ZREM " + key,
                () -> redissonClient.getScoredSortedSet(key, codec).remove(member));
    }

    // ==================== HYPERLOGLOG ====================

    @Override
    public boolean hyperLogLogAdd(String key, Object item) {
        requireKey(key);
        if (item == null) {
            throw new IllegalArgumentException("Item cannot be null");
        }
        return StoreExceptionTranslator.execute("PFADD " + key, () -> hyperLogLog(key).add(item));
    }

    @Override
    public boolean hyperLogLogAdd(String key, Collection<?> items) {
        requireKey(key);
        if (items == null) {
            throw new IllegalArgumentException("Items cannot be null");
        }
        for (Object item : items) {
            if (item == null) {
                throw new IllegalArgumentException("Items cannot contain null");
            }
        }
        if (items.isEmpty()) {
            return false;
        }
        List<Object> values = new ArrayList<>(items);
        return StoreExceptionTranslator.execute("PFADD " + key, () -> hyperLogLog(key).addAll(values));
    }

    @Override
    public long hyperLogLogCount(String key) {
        requireKey(key);
        return StoreExceptionTranslator.execute("PFCOUNT " + key, () -> hyperLogLog(key).count());
    }

    // ==================== TAGS ====================

    @Override
    public boolean isStringKeyInTag(String key, String... tags) {
        requireKey(key);
        return tagIndex.isInTag(tagIndex.stringEntry(key), tags);
    }

    @Override
    public boolean isHashFieldInTag(String key, Object field, String... tags) {
        requireKey(key);
        requireField(field);
        return tagIndex.isInTag(tagIndex.hashFieldEntry(key, field), tags);
    }

    @Override
    public boolean isSetMemberInTag(String key, Object member, String... tags) {
        requireKey(key);
        requireMember(member);
        return tagIndex.isAnyInTag(memberEntries(key, member), tags == null ? null : Arrays.asList(tags));
    }

    @Override
    public Set<TagEntry> getEntriesByTag(String... tags) {
        return tagIndex.getEntriesByTag(tags);
    }

    @Override
    public Set<String> getKeysByTag(String... tags) {
        return tagIndex.getKeysByTag(tags);
    }

    @Override
    public <T> List<T> getObjectsByTag(String... tags) {
        List<String> keys = new ArrayList<>();
        for (TagEntry entry : tagIndex.getEntriesByTag(tags)) {
            if (entry.getKind() == StructureKind.STRING) {
                keys.add(entry.getKey());
            }
        }
        if (keys.isEmpty()) {
            return Collections.emptyList();
        }

        Map<String, T> found = StoreExceptionTranslator.execute("MGET " + keys,
                () -> redissonClient.getBuckets(codec).get(keys.toArray(new String[0])));
        List<T> values = new ArrayList<>(keys.size());
        for (String key : keys) {
            T value = found.get(key);
            // expired between the liveness check and the read
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    @Override
    public Set<String> getAllTags() {
        return tagIndex.getAllTags();
    }

    @Override
    public void removeTagsFromKey(String key, String... tags) {
        requireKey(key);
        tagIndex.removeTags(tagIndex.stringEntry(key), tags);
    }

    @Override
    public void removeTagsFromHashField(String key, Object field, String... tags) {
        requireKey(key);
        requireField(field);
        tagIndex.removeTags(tagIndex.hashFieldEntry(key, field), tags);
    }

    @Override
    public void removeTagsFromSetMember(String key, Object member, String... tags) {
        requireKey(key);
        requireMember(member);
        for (TagEntry entry : memberEntries(key, member)) {
            tagIndex.removeTags(entry, tags);
        }
    }

    @Override
    public int invalidateKeysByTag(String... tags) {
        int removed = tagIndex.invalidateByTag(tags);
        logger.info("Invalidated {} entries by tags {}", removed, tags == null ? "[]" : Arrays.toString(tags));
        return removed;
    }

    private List<TagEntry> memberEntries(String key, Object member) {
        return Arrays.asList(tagIndex.setMemberEntry(key, member), tagIndex.sortedSetMemberEntry(key, member));
    }

    // ==================== STATISTICS ====================

    @Override
    public CacheStatistics getStatistics() {
        return statistics;
    }

    public TagIndexManager getTagIndex() {
        return tagIndex;
    }

    // ==================== INTERNALS ====================

    private <T> RBucket<T> bucket(String key) {
        return redissonClient.getBucket(key, codec);
    }

    private <T> RMap<Object, T> map(String key) {
        return redissonClient.getMap(key, codec);
    }

    private RHyperLogLog<Object> hyperLogLog(String key) {
        return redissonClient.getHyperLogLog(key, codec);
    }

    private boolean recordWrite(boolean written, String key, When when) {
        if (written) {
            statistics.incrementWrites();
        } else {
            statistics.incrementRejectedWrites();
            logger.debug("Write of {} rejected by condition {}", key, when);
        }
        return written;
    }

    private static void requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
    }

    private static void requireField(Object field) {
        if (field == null) {
            throw new IllegalArgumentException("Field cannot be null");
        }
    }

    private static void requireMember(Object member) {
        if (member == null) {
            throw new IllegalArgumentException("Member cannot be null");
        }
    }

    private static void requireValue(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
    }

    private static void requireProducer(Supplier<?> producer) {
        if (producer == null) {
            throw new IllegalArgumentException("Producer cannot be null");
        }
    }

    private static void requireTtl(Duration ttl) {
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new IllegalArgumentException("TTL must be positive");
        }
    }
}
