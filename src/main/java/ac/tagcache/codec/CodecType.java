package ac.tagcache.codec;

/**
 * Value codecs the provider can be configured with.
 */
public enum CodecType {
    /** Redisson {@code Kryo5Codec}: compact binary, any class. */
    KRYO5,
    /** Redisson {@code JsonJacksonCodec}: JSON with type information. */
    JSON
}
