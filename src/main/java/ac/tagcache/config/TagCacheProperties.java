package ac.tagcache.config;

import ac.tagcache.codec.CodecType;
import ac.tagcache.scan.ScanStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "tagcache")
public class TagCacheProperties {

    @NestedConfigurationProperty
    private RedisProperties redis = new RedisProperties();

    @NestedConfigurationProperty
    private CodecProperties codec = new CodecProperties();

    @NestedConfigurationProperty
    private TagProperties tags = new TagProperties();

    @NestedConfigurationProperty
    private ScanProperties scan = new ScanProperties();

    @NestedConfigurationProperty
    private FetchProperties fetch = new FetchProperties();

    // Getters and setters
    public RedisProperties getRedis() { return redis; }
    public void setRedis(RedisProperties redis) { this.redis = redis; }

    public CodecProperties getCodec() { return codec; }
    public void setCodec(CodecProperties codec) { this.codec = codec; }

    public TagProperties getTags() { return tags; }
    public void setTags(TagProperties tags) { this.tags = tags; }

    public ScanProperties getScan() { return scan; }
    public void setScan(ScanProperties scan) { this.scan = scan; }

    public FetchProperties getFetch() { return fetch; }
    public void setFetch(FetchProperties fetch) { this.fetch = fetch; }

    public static class RedisProperties {
        private String address = "redis://localhost:6379";
        private String password;
        private int connectionPoolSize = 64;
        private int connectionMinimumIdleSize = 10;
        private int timeout = 3000;
        /** Cluster node addresses; when set, a cluster client is built and {@code address} is ignored. */
        private List<String> clusterNodes = new ArrayList<>();

        // Getters and setters
        public String getAddress() { return address; }
        public void setAddress(String address) { this.address = address; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public int getConnectionPoolSize() { return connectionPoolSize; }
        public void setConnectionPoolSize(int connectionPoolSize) { this.connectionPoolSize = connectionPoolSize; }

        public int getConnectionMinimumIdleSize() { return connectionMinimumIdleSize; }
        public void setConnectionMinimumIdleSize(int connectionMinimumIdleSize) { this.connectionMinimumIdleSize = connectionMinimumIdleSize; }

        public int getTimeout() { return timeout; }
        public void setTimeout(int timeout) { this.timeout = timeout; }

        public List<String> getClusterNodes() { return clusterNodes; }
        public void setClusterNodes(List<String> clusterNodes) { this.clusterNodes = clusterNodes; }
    }

    public static class CodecProperties {
        private CodecType type = CodecType.KRYO5;

        public CodecType getType() { return type; }
        public void setType(CodecType type) { this.type = type; }
    }

    public static class TagProperties {
        /** Prefix of the tag index and entry tag record keys. */
        private String keyPrefix = "tagcache:";

        public String getKeyPrefix() { return keyPrefix; }
        public void setKeyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; }
    }

    public static class ScanProperties {
        private ScanStrategy strategy = ScanStrategy.AUTO;
        private int pageSize = 250;

        public ScanStrategy getStrategy() { return strategy; }
        public void setStrategy(ScanStrategy strategy) { this.strategy = strategy; }

        public int getPageSize() { return pageSize; }
        public void setPageSize(int pageSize) { this.pageSize = pageSize; }
    }

    public static class FetchProperties {
        private boolean singleFlight = false;
        private Duration singleFlightTimeout = Duration.ofSeconds(30);

        public boolean isSingleFlight() { return singleFlight; }
        public void setSingleFlight(boolean singleFlight) { this.singleFlight = singleFlight; }

        public Duration getSingleFlightTimeout() { return singleFlightTimeout; }
        public void setSingleFlightTimeout(Duration singleFlightTimeout) { this.singleFlightTimeout = singleFlightTimeout; }
    }
}
