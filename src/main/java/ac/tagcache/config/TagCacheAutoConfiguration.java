package ac.tagcache.config;

import ac.tagcache.CacheProvider;
import ac.tagcache.CacheStatistics;
import ac.tagcache.RedisCacheProvider;
import ac.tagcache.SingleFlight;
import ac.tagcache.codec.CodecFactory;
import ac.tagcache.codec.HashFieldCodec;
import ac.tagcache.scan.PatternScanner;
import ac.tagcache.tag.TagIndexManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.Codec;
import org.redisson.config.ClusterServersConfig;
import org.redisson.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@ConditionalOnClass(RedissonClient.class)
@EnableConfigurationProperties(TagCacheProperties.class)
public class TagCacheAutoConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(TagCacheAutoConfiguration.class);

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public RedissonClient redissonClient(TagCacheProperties properties) {
        TagCacheProperties.RedisProperties redis = properties.getRedis();
        Config config = new Config();
        if (!redis.getClusterNodes().isEmpty()) {
            ClusterServersConfig cluster = config.useClusterServers()
                    .setPassword(redis.getPassword())
                    .setMasterConnectionPoolSize(redis.getConnectionPoolSize())
                    .setMasterConnectionMinimumIdleSize(redis.getConnectionMinimumIdleSize())
                    .setTimeout(redis.getTimeout());
            redis.getClusterNodes().forEach(cluster::addNodeAddress);
            logger.info("Connecting to Redis cluster {}", redis.getClusterNodes());
        } else {
            config.useSingleServer()
                    .setAddress(redis.getAddress())
                    .setPassword(redis.getPassword())
                    .setConnectionPoolSize(redis.getConnectionPoolSize())
                    .setConnectionMinimumIdleSize(redis.getConnectionMinimumIdleSize())
                    .setTimeout(redis.getTimeout());
            logger.info("Connecting to Redis at {}", redis.getAddress());
        }
        return Redisson.create(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public Codec tagCacheCodec(TagCacheProperties properties, ObjectProvider<ObjectMapper> objectMapper) {
        return CodecFactory.create(properties.getCodec().getType(), objectMapper.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheStatistics tagCacheStatistics() {
        return new CacheStatistics();
    }

    @Bean
    @ConditionalOnMissingBean
    public PatternScanner patternScanner(RedissonClient redissonClient, TagCacheProperties properties) {
        return new PatternScanner(redissonClient, properties.getScan().getStrategy(),
                properties.getScan().getPageSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public TagIndexManager tagIndexManager(RedissonClient redissonClient, Codec tagCacheCodec,
                                           PatternScanner patternScanner, CacheStatistics statistics,
                                           TagCacheProperties properties) {
        return new TagIndexManager(redissonClient, new HashFieldCodec(tagCacheCodec), patternScanner, statistics,
                properties.getTags().getKeyPrefix());
    }

    @Bean
    @ConditionalOnMissingBean
    public SingleFlight singleFlight(TagCacheProperties properties, CacheStatistics statistics) {
        TagCacheProperties.FetchProperties fetch = properties.getFetch();
        return new SingleFlight(fetch.isSingleFlight(), fetch.getSingleFlightTimeout(), statistics);
    }

    @Bean
    @ConditionalOnMissingBean(CacheProvider.class)
    public RedisCacheProvider cacheProvider(RedissonClient redissonClient, Codec tagCacheCodec,
                                            TagIndexManager tagIndexManager, PatternScanner patternScanner,
                                            SingleFlight singleFlight, CacheStatistics statistics) {
        return new RedisCacheProvider(redissonClient, new HashFieldCodec(tagCacheCodec), tagIndexManager,
                patternScanner, singleFlight, statistics);
    }
}
