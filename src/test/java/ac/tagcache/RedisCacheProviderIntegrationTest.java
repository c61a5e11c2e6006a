package ac.tagcache;

import ac.tagcache.codec.HashFieldCodec;
import ac.tagcache.scan.PatternScanner;
import ac.tagcache.scan.ScanStrategy;
import ac.tagcache.tag.StructureKind;
import ac.tagcache.tag.TagEntry;
import ac.tagcache.tag.TagIndexManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.codec.Kryo5Codec;
import org.redisson.config.Config;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class RedisCacheProviderIntegrationTest {

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private RedissonClient redissonClient;
    private RedisCacheProvider cacheProvider;

    @BeforeEach
    void setUp() {
        String redisUrl = String.format("redis://%s:%d",
            redis.getHost(),
            redis.getMappedPort(6379));

        Config config = new Config();
        config.useSingleServer().setAddress(redisUrl);

        redissonClient = Redisson.create(config);
        cacheProvider = new RedisCacheProvider(redissonClient, new Kryo5Codec());
        cacheProvider.flushAll();
    }

    @AfterEach
    void tearDown() {
        if (redissonClient != null) {
            redissonClient.shutdown();
        }
    }

    // ==================== STRINGS AND FETCH ====================

    @Test
    void testUnknownKeyIsAMiss() {
        assertNull(cacheProvider.getObject("nope"));
        assertFalse(cacheProvider.tryGetObject("nope").isPresent());
        assertFalse(cacheProvider.keyExists("nope"));
        assertFalse(cacheProvider.keyTimeToLive("nope").isPresent());
        assertNull(cacheProvider.getHashed("nope", "field"));
        assertTrue(cacheProvider.getHashedAll("nope").isEmpty());
        assertEquals(0, cacheProvider.hyperLogLogCount("nope"));
    }

    @Test
    void testFetchObjectRunsProducerOnlyOnMiss() {
        // Arrange
        AtomicInteger calls = new AtomicInteger();

        // Act
        String first = cacheProvider.fetchObject("product:1", () -> {
            calls.incrementAndGet();
            return "iPhone 17s";
        }, Duration.ofMinutes(5));
        String second = cacheProvider.fetchObject("product:1", () -> {
            calls.incrementAndGet();
            return "something else";
        }, Duration.ofMinutes(5));

        // Assert
        assertEquals("iPhone 17s", first);
        assertEquals("iPhone 17s", second);
        assertEquals(1, calls.get());
        assertEquals(1, cacheProvider.getStatistics().getHits());
        assertEquals(1, cacheProvider.getStatistics().getMisses());
    }

    @Test
    void testFetchObjectTagsTheProducedValue() {
        Product phone = new Product("sku:42", "phone", true);
        TagBuilder<Product> byPromotion = value ->
                value.onSale ? Arrays.asList("sale", "catalog") : Collections.singletonList("catalog");

        cacheProvider.fetchObject("sku:42", () -> phone, byPromotion, null);

        assertTrue(cacheProvider.isStringKeyInTag("sku:42", "sale"));
        assertEquals(phone, cacheProvider.getObject("sku:42"));
    }

    @Test
    void testProducerExceptionLeavesNothingBehind() {
        IllegalStateException failure = new IllegalStateException("catalog down");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> cacheProvider.fetchObject("sku:42", () -> {
                    throw failure;
                }, TagBuilder.of("sale"), Duration.ofMinutes(1)));

        assertSame(failure, thrown);
        assertFalse(cacheProvider.keyExists("sku:42"));
        assertFalse(cacheProvider.isStringKeyInTag("sku:42", "sale"));
    }

    @Test
    void testSetObjectWithTags() {
        cacheProvider.setObject("k", "v", Collections.singletonList("t1"), null, When.ALWAYS);

        assertTrue(cacheProvider.isStringKeyInTag("k", "t1"));
        assertFalse(cacheProvider.isStringKeyInTag("k", "t2"));
        assertTrue(cacheProvider.isStringKeyInTag("k", "t2", "t1"));
    }

    @Test
    void testConditionalWrites() {
        assertTrue(cacheProvider.setObject("k", "first", Collections.singletonList("a"), null, When.IF_NOT_EXISTS));
        assertFalse(cacheProvider.setObject("k", "second", Collections.singletonList("b"), null, When.IF_NOT_EXISTS));
        assertEquals("first", cacheProvider.getObject("k"));
        assertFalse(cacheProvider.isStringKeyInTag("k", "b"));

        assertFalse(cacheProvider.setObject("other", "v", Duration.ofMinutes(1), When.IF_EXISTS));
        assertFalse(cacheProvider.keyExists("other"));
        assertTrue(cacheProvider.setObject("k", "third", Duration.ofMinutes(1), When.IF_EXISTS));
        assertEquals("third", cacheProvider.getObject("k"));
    }

    @Test
    void testGetSetObject() {
        cacheProvider.setObject("k", "old");

        String previous = cacheProvider.getSetObject("k", "new");

        assertEquals("old", previous);
        assertEquals("new", cacheProvider.getObject("k"));
        assertNull(cacheProvider.getSetObject("fresh", "value"));
    }

    @Test
    void testExpirationCommands() {
        cacheProvider.setObject("k", "v");
        assertFalse(cacheProvider.keyTimeToLive("k").isPresent());

        assertTrue(cacheProvider.keyTimeToLive("k", Duration.ofSeconds(30)));
        Optional<Duration> ttl = cacheProvider.keyTimeToLive("k");
        assertTrue(ttl.isPresent());
        assertTrue(ttl.get().compareTo(Duration.ofSeconds(30)) <= 0);

        assertTrue(cacheProvider.keyPersist("k"));
        assertFalse(cacheProvider.keyTimeToLive("k").isPresent());

        assertTrue(cacheProvider.keyExpire("k", Instant.now().plusSeconds(60)));
        assertTrue(cacheProvider.keyTimeToLive("k").isPresent());
    }

    @Test
    void testRemove() {
        cacheProvider.setObject("a", 1);
        cacheProvider.setObject("b", 2);

        assertEquals(2, cacheProvider.remove("a", "b", "c"));
        assertFalse(cacheProvider.remove("a"));
    }

    // ==================== HASHES ====================

    @Test
    void testHashTtlAppliesToWholeKey() {
        // Act
        cacheProvider.setHashed("h", "f1", "one", Duration.ofSeconds(60), When.ALWAYS);
        cacheProvider.setHashed("h", "f2", "two");

        // Assert
        Optional<Duration> ttl = cacheProvider.keyTimeToLive("h");
        assertTrue(ttl.isPresent());
        assertTrue(ttl.get().compareTo(Duration.ZERO) > 0);
        assertTrue(ttl.get().compareTo(Duration.ofSeconds(60)) <= 0);

        assertTrue(cacheProvider.removeHashed("h", "f1"));
        assertNull(cacheProvider.getHashed("h", "f1"));
        assertEquals("two", cacheProvider.getHashed("h", "f2"));
    }

    @Test
    void testMultiFieldReadsAndWrites() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", "phone");
        fields.put("price", 19.99);
        assertEquals(2, cacheProvider.setHashed("product:1", fields, null, When.ALWAYS));

        List<Object> values = cacheProvider.getHashed("product:1", Arrays.asList("price", "missing", "name"));
        assertEquals(Arrays.asList(19.99, null, "phone"), values);

        Map<String, Object> all = cacheProvider.getHashedAll("product:1");
        assertEquals(2, all.size());
        assertEquals("phone", all.get("name"));
    }

    @Test
    void testHashFieldTagsWithNonStringFields() {
        cacheProvider.setHashed("orders", 1001L, "pending", Collections.singletonList("open"), null, When.ALWAYS);

        assertTrue(cacheProvider.isHashFieldInTag("orders", 1001L, "open"));
        assertFalse(cacheProvider.isHashFieldInTag("orders", 1002L, "open"));
        assertEquals("pending", cacheProvider.getHashed("orders", 1001L));

        cacheProvider.removeHashed("orders", 1001L);
        assertFalse(cacheProvider.isHashFieldInTag("orders", 1001L, "open"));
    }

    @Test
    void testFetchHashed() {
        AtomicInteger calls = new AtomicInteger();

        Double first = cacheProvider.fetchHashed("prices", "sku:42", () -> {
            calls.incrementAndGet();
            return 19.99;
        }, TagBuilder.of("sale"), Duration.ofMinutes(5));
        Double second = cacheProvider.fetchHashed("prices", "sku:42", () -> {
            calls.incrementAndGet();
            return 0.0;
        });

        assertEquals(19.99, first);
        assertEquals(19.99, second);
        assertEquals(1, calls.get());
        assertTrue(cacheProvider.isHashFieldInTag("prices", "sku:42", "sale"));
        assertTrue(cacheProvider.keyTimeToLive("prices").isPresent());
    }

    @Test
    void testScanHashed() {
        cacheProvider.setHashed("product:1", "price", 10);
        cacheProvider.setHashed("product:1", "priority", 1);
        cacheProvider.setHashed("product:1", "name", "phone");

        Set<String> fields = new HashSet<>();
        for (Map.Entry<String, Object> entry : cacheProvider.<Object>scanHashed("product:1", "pri*")) {
            fields.add(entry.getKey());
        }

        assertEquals(new HashSet<>(Arrays.asList("price", "priority")), fields);
    }

    // ==================== SETS ====================

    @Test
    void testCartScenario() {
        // Arrange
        cacheProvider.addToSet("cart:1", "sku:42", Collections.singletonList("sale"), Duration.ofHours(1));
        cacheProvider.addToSet("cart:1", "sku:43");

        // Assert
        assertTrue(cacheProvider.isSetMemberInTag("cart:1", "sku:42", "sale"));
        assertFalse(cacheProvider.isSetMemberInTag("cart:1", "sku:43", "sale"));

        // Act
        assertTrue(cacheProvider.remove("cart:1"));

        // Assert
        assertFalse(cacheProvider.isSetMemberInTag("cart:1", "sku:42", "sale"));
        assertTrue(cacheProvider.getKeysByTag("sale").isEmpty());
    }

    @Test
    void testSortedSetMembersAreTagged() {
        cacheProvider.addToSortedSet("leaderboard", 10.0, "alice", Collections.singletonList("vip"), null);
        cacheProvider.addToSortedSet("leaderboard", 5.0, "bob");

        assertTrue(cacheProvider.isSetMemberInTag("leaderboard", "alice", "vip"));
        assertFalse(cacheProvider.isSetMemberInTag("leaderboard", "bob", "vip"));

        assertTrue(cacheProvider.removeFromSortedSet("leaderboard", "alice"));
        assertFalse(cacheProvider.isSetMemberInTag("leaderboard", "alice", "vip"));
    }

    @Test
    void testRemoveFromSet() {
        cacheProvider.addToSet("s", "a");

        assertTrue(cacheProvider.removeFromSet("s", "a"));
        assertFalse(cacheProvider.removeFromSet("s", "a"));
    }

    // ==================== HYPERLOGLOG ====================

    @Test
    void testHyperLogLogCountIsApproximate() {
        List<String> visitors = new ArrayList<>();
        for (int i = 0; i < 10_000; i++) {
            visitors.add("visitor-" + i);
        }

        assertTrue(cacheProvider.hyperLogLogAdd("visitors", visitors));
        cacheProvider.hyperLogLogAdd("visitors", "visitor-1");

        long count = cacheProvider.hyperLogLogCount("visitors");
        assertTrue(Math.abs(count - 10_000) <= 500, "count was " + count);
    }

    // ==================== TAGS ====================

    @Test
    void testTagsAreReplacedByTheLastWriter() {
        cacheProvider.setObject("k", "v1", Arrays.asList("a", "b"), null, When.ALWAYS);
        cacheProvider.setObject("k", "v2", Collections.singletonList("c"), null, When.ALWAYS);

        assertFalse(cacheProvider.isStringKeyInTag("k", "a", "b"));
        assertTrue(cacheProvider.isStringKeyInTag("k", "c"));
        assertTrue(cacheProvider.getKeysByTag("a").isEmpty());
    }

    @Test
    void testWriteWithoutTagsKeepsExistingTags() {
        cacheProvider.setObject("k", "v1", Collections.singletonList("a"), null, When.ALWAYS);
        cacheProvider.setObject("k", "v2");

        assertTrue(cacheProvider.isStringKeyInTag("k", "a"));

        cacheProvider.setObject("k", "v3", Collections.emptyList(), null, When.ALWAYS);
        assertFalse(cacheProvider.isStringKeyInTag("k", "a"));
    }

    @Test
    void testDiscoveryByTag() {
        cacheProvider.setObject("sku:42", "phone", Collections.singletonList("sale"), null, When.ALWAYS);
        cacheProvider.setObject("sku:43", "tablet", Arrays.asList("sale", "new"), null, When.ALWAYS);
        cacheProvider.setHashed("prices", "sku:42", 19.99, Collections.singletonList("sale"), null, When.ALWAYS);

        assertEquals(new HashSet<>(Arrays.asList("sku:42", "sku:43", "prices")), cacheProvider.getKeysByTag("sale"));
        assertEquals(new HashSet<>(Arrays.asList("phone", "tablet")),
                new HashSet<>(cacheProvider.<String>getObjectsByTag("sale")));
        assertEquals(new HashSet<>(Arrays.asList("sale", "new")), cacheProvider.getAllTags());

        Set<TagEntry> entries = cacheProvider.getEntriesByTag("new");
        assertEquals(1, entries.size());
        TagEntry entry = entries.iterator().next();
        assertEquals(StructureKind.STRING, entry.getKind());
        assertEquals("sku:43", entry.getKey());
    }

    @Test
    void testDanglingEntriesAreDroppedOnDiscovery() {
        cacheProvider.setObject("sku:42", "phone", Collections.singletonList("sale"), null, When.ALWAYS);
        cacheProvider.setObject("sku:43", "tablet", Collections.singletonList("sale"), null, When.ALWAYS);
        cacheProvider.remove("sku:42");

        assertEquals(Collections.singleton("sku:43"), cacheProvider.getKeysByTag("sale"));
        assertEquals(1, cacheProvider.getStatistics().getDanglingTagEntriesDropped());
    }

    @Test
    void testRemoveTagsLeavesValues() {
        cacheProvider.setObject("k", "v", Arrays.asList("a", "b"), null, When.ALWAYS);
        cacheProvider.addToSet("s", "m", Collections.singletonList("a"), null);
        cacheProvider.setHashed("h", "f", "v", Collections.singletonList("a"), null, When.ALWAYS);

        cacheProvider.removeTagsFromKey("k", "a");
        cacheProvider.removeTagsFromSetMember("s", "m", "a");
        cacheProvider.removeTagsFromHashField("h", "f", "a");

        assertFalse(cacheProvider.isStringKeyInTag("k", "a"));
        assertTrue(cacheProvider.isStringKeyInTag("k", "b"));
        assertFalse(cacheProvider.isSetMemberInTag("s", "m", "a"));
        assertFalse(cacheProvider.isHashFieldInTag("h", "f", "a"));
        assertEquals("v", cacheProvider.getObject("k"));
        assertEquals("v", cacheProvider.getHashed("h", "f"));
    }

    @Test
    void testInvalidateKeysByTag() {
        cacheProvider.setObject("sku:42", "phone", Collections.singletonList("sale"), null, When.ALWAYS);
        cacheProvider.setHashed("prices", "sku:42", 19.99, Collections.singletonList("sale"), null, When.ALWAYS);
        cacheProvider.setHashed("prices", "sku:43", 29.99);
        cacheProvider.addToSet("cart:1", "sku:42", Collections.singletonList("sale"), null);
        cacheProvider.setObject("sku:44", "watch", Collections.singletonList("new"), null, When.ALWAYS);

        assertEquals(3, cacheProvider.invalidateKeysByTag("sale"));

        assertFalse(cacheProvider.keyExists("sku:42"));
        assertNull(cacheProvider.getHashed("prices", "sku:42"));
        assertEquals(29.99, (Double) cacheProvider.getHashed("prices", "sku:43"));
        assertFalse(cacheProvider.keyExists("cart:1"));
        assertEquals("watch", cacheProvider.getObject("sku:44"));
        assertFalse(cacheProvider.getAllTags().contains("sale"));
    }

    // ==================== PATTERNS ====================

    @ParameterizedTest
    @EnumSource(value = ScanStrategy.class, names = {"SCAN", "KEYS", "AUTO"})
    void testKeysByPatternUnderEveryStrategy(ScanStrategy strategy) {
        CacheStatistics statistics = new CacheStatistics();
        HashFieldCodec codec = new HashFieldCodec(new Kryo5Codec());
        PatternScanner scanner = new PatternScanner(redissonClient, strategy, 2);
        TagIndexManager tagIndex = new TagIndexManager(redissonClient, codec, scanner, statistics, "tagcache:");
        CacheProvider provider = new RedisCacheProvider(redissonClient, codec, tagIndex, scanner,
                SingleFlight.disabled(statistics), statistics);

        provider.setObject("cart:1", "a");
        provider.setObject("cart:2", "b");
        provider.addToSet("cart:3", "c");
        provider.setObject("wishlist:1", "d");

        Set<String> keys = new HashSet<>();
        provider.getKeysByPattern("cart:*").forEach(keys::add);

        assertEquals(new HashSet<>(Arrays.asList("cart:1", "cart:2", "cart:3")), keys);
        assertFalse(provider.getKeysByPattern("nothing:*").iterator().hasNext());
    }

    static final class Product implements Serializable {
        private String sku;
        private String name;
        private boolean onSale;

        Product() {
        }

        Product(String sku, String name, boolean onSale) {
            this.sku = sku;
            this.name = name;
            this.onSale = onSale;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Product)) return false;
            Product other = (Product) o;
            return onSale == other.onSale && sku.equals(other.sku) && name.equals(other.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(sku, name, onSale);
        }
    }
}
