package ac.tagcache.codec;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.redisson.client.codec.Codec;
import org.redisson.codec.JsonJacksonCodec;
import org.redisson.codec.Kryo5Codec;

/**
 * Builds the value codec the provider encodes values, fields and members with.
 */
public final class CodecFactory {

    private CodecFactory() {
    }

    public static Codec create(CodecType type) {
        return create(type, null);
    }

    public static Codec create(CodecType type, ObjectMapper objectMapper) {
        if (type == null) {
            throw new IllegalArgumentException("Codec type cannot be null");
        }
        switch (type) {
            case JSON:
                ObjectMapper mapper = objectMapper != null ? objectMapper.copy() : new ObjectMapper();
                mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
                return new JsonJacksonCodec(mapper);
            case KRYO5:
            default:
                return new Kryo5Codec();
        }
    }
}
