package ac.tagcache.tag;

import ac.tagcache.CacheStatistics;
import ac.tagcache.codec.HashFieldCodec;
import ac.tagcache.exception.StoreExceptionTranslator;
import ac.tagcache.scan.GlobPattern;
import ac.tagcache.scan.PatternScanner;
import org.redisson.api.BatchResult;
import org.redisson.api.RBatch;
import org.redisson.api.RSet;
import org.redisson.api.RSetAsync;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.ByteArrayCodec;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Secondary index grouping store entries under tag names.
 * <p>
 * Every tag owns a Redis set of {@link TagEntry} index members, and every tagged
 * entry owns a set recording its current tags so that a new association can
 * replace the previous one. Both are weak: removing or expiring an entry never
 * updates them. Queries verify that an entry is still alive before reporting it
 * and drop it from the index when it is not.
 */
public class TagIndexManager {
    private static final Logger logger = LoggerFactory.getLogger(TagIndexManager.class);

    private static final String TAG_SEGMENT = "tag:";
    private static final String ENTRY_SEGMENT = "entry:";
    private static final String WRONG_TYPE = "WRONGTYPE";

    private final RedissonClient redissonClient;
    private final HashFieldCodec codec;
    private final PatternScanner scanner;
    private final CacheStatistics statistics;
    private final String keyPrefix;

    public TagIndexManager(RedissonClient redissonClient, HashFieldCodec codec, PatternScanner scanner,
                           CacheStatistics statistics, String keyPrefix) {
        this.redissonClient = redissonClient;
        this.codec = codec;
        this.scanner = scanner;
        this.statistics = statistics;
        this.keyPrefix = keyPrefix != null ? keyPrefix : "";
    }

    // ==================== ENTRY REFERENCES ====================

    public TagEntry stringEntry(String key) {
        return TagEntry.stringKey(key);
    }

    public TagEntry hashFieldEntry(String key, Object field) {
        return TagEntry.hashField(key, codec.fieldBytes(field));
    }

    public TagEntry setMemberEntry(String key, Object member) {
        return TagEntry.setMember(key, codec.memberBytes(member));
    }

    public TagEntry sortedSetMemberEntry(String key, Object member) {
        return TagEntry.sortedSetMember(key, codec.memberBytes(member));
    }

    public String tagKey(String tag) {
        return keyPrefix + TAG_SEGMENT + tag;
    }

    public String entryTagsKey(TagEntry entry) {
        return keyPrefix + ENTRY_SEGMENT + entry.toIndexMember();
    }

    // ==================== ASSOCIATION ====================

    /**
     * Makes {@code tags} the complete tag set of {@code entry}: the entry joins
     * every listed tag and leaves any tag it had before that is not listed.
     * Not atomic with the value write it follows.
     */
    public void associateTags(TagEntry entry, Collection<String> tags) {
        Set<String> newTags = normalize(tags);
        String member = entry.toIndexMember();
        String recordKey = entryTagsKey(entry);

        StoreExceptionTranslator.run("associate tags " + newTags + " with " + entry, () -> {
            Set<String> previousTags = tagRecord(recordKey).readAll();

            RBatch batch = redissonClient.createBatch();
            for (String previous : previousTags) {
                if (!newTags.contains(previous)) {
                    batch.<String>getSet(tagKey(previous), StringCodec.INSTANCE).removeAsync(member);
                }
            }
            for (String tag : newTags) {
                batch.<String>getSet(tagKey(tag), StringCodec.INSTANCE).addAsync(member);
            }
            RSetAsync<String> record = batch.getSet(recordKey, StringCodec.INSTANCE);
            record.deleteAsync();
            if (!newTags.isEmpty()) {
                record.addAllAsync(newTags);
            }
            batch.execute();
        });

        statistics.incrementTagAssociations();
        logger.debug("Associated {} with tags {}", entry, newTags);
    }

    /**
     * Removes {@code entry} from the given tags without touching the entry itself.
     */
    public void removeTags(TagEntry entry, String... tags) {
        Set<String> removed = normalize(asList(tags));
        if (removed.isEmpty()) {
            return;
        }
        String member = entry.toIndexMember();
        StoreExceptionTranslator.run("remove tags " + removed + " from " + entry, () -> {
            RBatch batch = redissonClient.createBatch();
            for (String tag : removed) {
                batch.<String>getSet(tagKey(tag), StringCodec.INSTANCE).removeAsync(member);
            }
            batch.<String>getSet(entryTagsKey(entry), StringCodec.INSTANCE).removeAllAsync(removed);
            batch.execute();
        });
        logger.debug("Removed {} from tags {}", entry, removed);
    }

    /**
     * Tags currently recorded for {@code entry}. May include tags whose index
     * already lost the entry; the index is authoritative for membership.
     */
    public Set<String> getTags(TagEntry entry) {
        return StoreExceptionTranslator.execute("read tags of " + entry,
                () -> tagRecord(entryTagsKey(entry)).readAll());
    }

    // ==================== MEMBERSHIP ====================

    public boolean isInTag(TagEntry entry, String... tags) {
        return isAnyInTag(Collections.singletonList(entry), asList(tags));
    }

    /**
     * True when at least one of {@code candidates} is a live member of at least
     * one of {@code tags}. Candidates found dead are dropped from the index.
     */
    public boolean isAnyInTag(Collection<TagEntry> candidates, Collection<String> tags) {
        Set<String> tagNames = normalize(tags);
        if (tagNames.isEmpty() || candidates == null || candidates.isEmpty()) {
            return false;
        }
        for (TagEntry candidate : candidates) {
            String listingTag = firstTagListing(candidate, tagNames);
            if (listingTag == null) {
                continue;
            }
            if (isAlive(candidate)) {
                return true;
            }
            dropDangling(candidate, Collections.singleton(listingTag));
        }
        return false;
    }

    private String firstTagListing(TagEntry entry, Set<String> tagNames) {
        String member = entry.toIndexMember();
        return StoreExceptionTranslator.execute("check tags " + tagNames + " for " + entry, () -> {
            for (String tag : tagNames) {
                if (tagIndex(tag).contains(member)) {
                    return tag;
                }
            }
            return null;
        });
    }

    /**
     * Whether the store still holds what {@code entry} points at. A key of a
     * different type than the entry expects counts as gone.
     */
    public boolean isAlive(TagEntry entry) {
        String operation = "liveness of " + entry;
        try {
            switch (entry.getKind()) {
                case STRING:
                    return redissonClient.getKeys().countExists(entry.getKey()) > 0;
                case HASH_FIELD:
                    return redissonClient.<byte[], byte[]>getMap(entry.getKey(), ByteArrayCodec.INSTANCE)
                            .containsKey(entry.getMember());
                case SET_MEMBER:
                    return redissonClient.<byte[]>getSet(entry.getKey(), ByteArrayCodec.INSTANCE)
                            .contains(entry.getMember());
                case SORTED_SET_MEMBER:
                    return redissonClient.<byte[]>getScoredSortedSet(entry.getKey(), ByteArrayCodec.INSTANCE)
                            .contains(entry.getMember());
                default:
                    throw new IllegalStateException("Unsupported structure kind: " + entry.getKind());
            }
        } catch (RedisException e) {
            if (e.getMessage() != null && e.getMessage().contains(WRONG_TYPE)) {
                logger.debug("Key {} holds another type, treating {} as gone", entry.getKey(), entry);
                return false;
            }
            throw StoreExceptionTranslator.translate(operation, e);
        }
    }

    // ==================== DISCOVERY ====================

    /**
     * Live entries belonging to any of {@code tags}. Dead and unreadable index
     * members are dropped on the way.
     */
    public Set<TagEntry> getEntriesByTag(String... tags) {
        Set<String> tagNames = normalize(asList(tags));
        Map<TagEntry, Set<String>> listed = readIndexes(tagNames);

        Set<TagEntry> live = new LinkedHashSet<>();
        for (Map.Entry<TagEntry, Set<String>> candidate : listed.entrySet()) {
            if (isAlive(candidate.getKey())) {
                live.add(candidate.getKey());
            } else {
                dropDangling(candidate.getKey(), candidate.getValue());
            }
        }
        return live;
    }

    /**
     * Distinct top-level keys of the live entries belonging to any of {@code tags}.
     */
    public Set<String> getKeysByTag(String... tags) {
        Set<String> keys = new LinkedHashSet<>();
        for (TagEntry entry : getEntriesByTag(tags)) {
            keys.add(entry.getKey());
        }
        return keys;
    }

    /**
     * Names of every tag that currently has an index.
     */
    public Set<String> getAllTags() {
        String prefix = keyPrefix + TAG_SEGMENT;
        Set<String> tags = new LinkedHashSet<>();
        for (String key : scanner.scanKeys(GlobPattern.escape(prefix) + "*")) {
            tags.add(key.substring(prefix.length()));
        }
        return tags;
    }

    // ==================== INVALIDATION ====================

    /**
     * Removes every key, hash field or set member referenced by {@code tags},
     * then the tag indexes themselves. Entries referenced by other tags stay
     * listed there and are dropped lazily.
     *
     * @return the number of distinct entries removed; entries the tags still
     * listed but that were already gone are not counted
     */
    public int invalidateByTag(String... tags) {
        Set<String> tagNames = normalize(asList(tags));
        if (tagNames.isEmpty()) {
            return 0;
        }
        Map<TagEntry, Set<String>> listed = readIndexes(tagNames);

        BatchResult<?> result = StoreExceptionTranslator.execute("invalidate tags " + tagNames, () -> {
            RBatch batch = redissonClient.createBatch();
            for (TagEntry entry : listed.keySet()) {
                removeUnderlying(batch, entry);
                batch.getSet(entryTagsKey(entry), StringCodec.INSTANCE).deleteAsync();
            }
            for (String tag : tagNames) {
                batch.getSet(tagKey(tag), StringCodec.INSTANCE).deleteAsync();
            }
            return batch.execute();
        });

        int removed = countRemoved(result.getResponses(), listed.size());
        logger.debug("Invalidated {} of {} entries listed by tags {}", removed, listed.size(), tagNames);
        return removed;
    }

    // responses come in pairs per entry: the underlying removal, then the record delete
    static int countRemoved(List<?> responses, int entries) {
        int removed = 0;
        for (int i = 0; i < entries && 2 * i < responses.size(); i++) {
            Object response = responses.get(2 * i);
            if (Boolean.TRUE.equals(response)
                    || (response instanceof Number && ((Number) response).longValue() > 0)) {
                removed++;
            }
        }
        return removed;
    }

    private void removeUnderlying(RBatch batch, TagEntry entry) {
        switch (entry.getKind()) {
            case STRING:
                batch.getBucket(entry.getKey()).deleteAsync();
                break;
            case HASH_FIELD:
                batch.<byte[], byte[]>getMap(entry.getKey(), ByteArrayCodec.INSTANCE)
                        .fastRemoveAsync(entry.getMember());
                break;
            case SET_MEMBER:
                batch.<byte[]>getSet(entry.getKey(), ByteArrayCodec.INSTANCE).removeAsync(entry.getMember());
                break;
            case SORTED_SET_MEMBER:
                batch.<byte[]>getScoredSortedSet(entry.getKey(), ByteArrayCodec.INSTANCE)
                        .removeAsync(entry.getMember());
                break;
            default:
                throw new IllegalStateException("Unsupported structure kind: " + entry.getKind());
        }
    }

    // ==================== INTERNALS ====================

    // entry -> tags (among tagNames) whose index lists it
    private Map<TagEntry, Set<String>> readIndexes(Set<String> tagNames) {
        Map<TagEntry, Set<String>> listed = new LinkedHashMap<>();
        for (String tag : tagNames) {
            Set<String> members = StoreExceptionTranslator.execute("read tag " + tag,
                    () -> tagIndex(tag).readAll());
            for (String member : members) {
                TagEntry entry;
                try {
                    entry = TagEntry.parse(member);
                } catch (IllegalArgumentException e) {
                    logger.warn("Dropping unreadable member '{}' from tag {}: {}", member, tag, e.getMessage());
                    StoreExceptionTranslator.execute("drop member of tag " + tag, () -> tagIndex(tag).remove(member));
                    continue;
                }
                listed.computeIfAbsent(entry, k -> new LinkedHashSet<>()).add(tag);
            }
        }
        return listed;
    }

    private void dropDangling(TagEntry entry, Collection<String> knownTags) {
        String member = entry.toIndexMember();
        String recordKey = entryTagsKey(entry);
        Set<String> tags = new LinkedHashSet<>(knownTags);

        StoreExceptionTranslator.run("drop dangling " + entry, () -> {
            tags.addAll(tagRecord(recordKey).readAll());
            RBatch batch = redissonClient.createBatch();
            for (String tag : tags) {
                batch.<String>getSet(tagKey(tag), StringCodec.INSTANCE).removeAsync(member);
            }
            batch.getSet(recordKey, StringCodec.INSTANCE).deleteAsync();
            batch.execute();
        });

        statistics.addDanglingTagEntriesDropped(1);
        logger.debug("Dropped dangling {} from tags {}", entry, tags);
    }

    private RSet<String> tagIndex(String tag) {
        return redissonClient.getSet(tagKey(tag), StringCodec.INSTANCE);
    }

    private RSet<String> tagRecord(String recordKey) {
        return redissonClient.getSet(recordKey, StringCodec.INSTANCE);
    }

    static Set<String> normalize(Collection<String> tags) {
        if (tags == null) {
            return Collections.emptySet();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String tag : tags) {
            if (tag != null && !tag.isEmpty()) {
                normalized.add(tag);
            }
        }
        return normalized;
    }

    static List<String> asList(String... tags) {
        return tags == null ? Collections.emptyList() : Arrays.asList(tags);
    }
}
