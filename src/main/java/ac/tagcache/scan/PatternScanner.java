package ac.tagcache.scan;

import ac.tagcache.exception.StoreExceptionTranslator;
import org.redisson.api.RMap;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.api.redisnode.RedisNode;
import org.redisson.api.redisnode.RedisNodes;
import org.redisson.client.RedisException;
import org.redisson.client.codec.Codec;
import org.redisson.client.codec.StringCodec;
import org.redisson.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Glob enumeration of the key space or of one hash's field names.
 * <p>
 * Results are lazy and every {@code iterator()} call starts over. Order is not
 * defined, and under concurrent writes an enumeration may repeat or miss keys
 * that change while it runs.
 */
public class PatternScanner {
    private static final Logger logger = LoggerFactory.getLogger(PatternScanner.class);

    private static final String KEYS_SCRIPT = "return redis.call('keys', ARGV[1])";
    private static final int[] FIRST_SCAN_VERSION = {2, 8};
    // KEYS runs inside EVAL, so a renamed or forbidden KEYS surfaces with the script wording
    private static final String[] REJECTION_MARKERS = {
            "unknown command",
            "unknown redis command",
            "noperm",
            "not allowed",
            "can't run this command",
            "no permissions to run"
    };

    private final RedissonClient redissonClient;
    private final ScanStrategy requestedStrategy;
    private final int pageSize;
    private volatile ScanStrategy resolvedStrategy;

    public PatternScanner(RedissonClient redissonClient, ScanStrategy strategy, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive");
        }
        this.redissonClient = redissonClient;
        this.requestedStrategy = strategy != null ? strategy : ScanStrategy.AUTO;
        this.pageSize = pageSize;
    }

    // ==================== KEY SPACE ====================

    public Iterable<String> scanKeys(String pattern) {
        requirePattern(pattern);
        return () -> openKeyIterator(pattern);
    }

    private Iterator<String> openKeyIterator(String pattern) {
        if (effectiveStrategy() == ScanStrategy.KEYS) {
            try {
                return listKeys(pattern).iterator();
            } catch (RedisException e) {
                if (!isRejectedCommand(e)) {
                    throw StoreExceptionTranslator.translate("KEYS " + pattern, e);
                }
                logger.warn("KEYS rejected by the server ({}), switching to SCAN", e.getMessage());
                resolvedStrategy = ScanStrategy.SCAN;
            }
        }
        logger.debug("Scanning keys matching {} with page size {}", pattern, pageSize);
        Iterator<String> cursor = StoreExceptionTranslator.execute("SCAN " + pattern,
                () -> redissonClient.getKeys().getKeysByPattern(pattern, pageSize).iterator());
        return new TranslatingIterator<>(cursor, "SCAN " + pattern);
    }

    private List<String> listKeys(String pattern) {
        logger.debug("Listing keys matching {}", pattern);
        RScript script = redissonClient.getScript(StringCodec.INSTANCE);
        List<Object> keys = script.eval(RScript.Mode.READ_ONLY, KEYS_SCRIPT, RScript.ReturnType.MULTI,
                Collections.emptyList(), pattern);
        if (keys == null) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>(keys.size());
        for (Object key : keys) {
            result.add(String.valueOf(key));
        }
        return result;
    }

    // ==================== HASH FIELDS ====================

    /**
     * Entries of the hash at {@code key} whose field name matches {@code pattern}.
     * The codec must decode hash fields as strings.
     */
    public <V> Iterable<Map.Entry<String, V>> scanHashFields(String key, String pattern, Codec codec) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
        requirePattern(pattern);
        return () -> openFieldIterator(key, pattern, codec);
    }

    private <V> Iterator<Map.Entry<String, V>> openFieldIterator(String key, String pattern, Codec codec) {
        RMap<String, V> map = redissonClient.getMap(key, codec);
        String operation = "HSCAN " + key + " " + pattern;
        if (effectiveStrategy() == ScanStrategy.KEYS) {
            GlobPattern glob = GlobPattern.compile(pattern);
            Map<String, V> all = StoreExceptionTranslator.execute("HGETALL " + key, map::readAllMap);
            return all.entrySet().stream()
                    .filter(entry -> glob.matches(entry.getKey()))
                    .collect(Collectors.toList())
                    .iterator();
        }
        Iterator<Map.Entry<String, V>> cursor = StoreExceptionTranslator.execute(operation,
                () -> map.entrySet(pattern, pageSize).iterator());
        return new TranslatingIterator<>(cursor, operation);
    }

    // ==================== STRATEGY ====================

    public ScanStrategy getRequestedStrategy() {
        return requestedStrategy;
    }

    /**
     * Strategy actually used, resolved once from topology and server version.
     */
    public ScanStrategy effectiveStrategy() {
        ScanStrategy current = resolvedStrategy;
        if (current == null) {
            current = resolveStrategy();
            resolvedStrategy = current;
        }
        return current;
    }

    private ScanStrategy resolveStrategy() {
        if (isClusterTopology()) {
            if (requestedStrategy == ScanStrategy.KEYS) {
                logger.warn("KEYS listing is not supported on a cluster topology, using SCAN");
            }
            return ScanStrategy.SCAN;
        }
        if (requestedStrategy != ScanStrategy.AUTO) {
            return requestedStrategy;
        }
        String version = readServerVersion();
        if (version != null && isOlderThan(version, FIRST_SCAN_VERSION)) {
            logger.info("Redis {} has no SCAN support, using KEYS listings", version);
            return ScanStrategy.KEYS;
        }
        return ScanStrategy.SCAN;
    }

    private boolean isClusterTopology() {
        Config config = redissonClient.getConfig();
        return config != null && config.isClusterConfig();
    }

    private String readServerVersion() {
        Config config = redissonClient.getConfig();
        if (config == null || config.isSentinelConfig()) {
            return null;
        }
        try {
            Map<String, String> info = redissonClient.getRedisNodes(RedisNodes.SINGLE)
                    .getInstance()
                    .info(RedisNode.InfoSection.SERVER);
            return info != null ? info.get("redis_version") : null;
        } catch (RuntimeException e) {
            logger.warn("Could not read the Redis server version, using SCAN: {}", e.getMessage());
            return null;
        }
    }

    static boolean isOlderThan(String version, int[] reference) {
        String[] parts = version.split("\\.");
        for (int i = 0; i < reference.length; i++) {
            int part = 0;
            if (i < parts.length) {
                try {
                    part = Integer.parseInt(parts[i].replaceAll("[^0-9].*$", ""));
                } catch (NumberFormatException e) {
                    return false;
                }
            }
            if (part != reference[i]) {
                return part < reference[i];
            }
        }
        return false;
    }

    static boolean isRejectedCommand(RedisException e) {
        String message = e.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String marker : REJECTION_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static void requirePattern(String pattern) {
        if (pattern == null) {
            throw new IllegalArgumentException("Pattern cannot be null");
        }
    }

    /**
     * Maps failures of a lazily fetching store iterator like any other store command.
     */
    private static final class TranslatingIterator<T> implements Iterator<T> {
        private final Iterator<T> delegate;
        private final String operation;

        private TranslatingIterator(Iterator<T> delegate, String operation) {
            this.delegate = delegate;
            this.operation = operation;
        }

        @Override
        public boolean hasNext() {
            return StoreExceptionTranslator.execute(operation, delegate::hasNext);
        }

        @Override
        public T next() {
            return StoreExceptionTranslator.execute(operation, delegate::next);
        }
    }
}
