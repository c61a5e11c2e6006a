package ac.tagcache.codec;

import ac.tagcache.exception.SerializationException;
import ac.tagcache.exception.StoreExceptionTranslator;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import org.redisson.client.codec.BaseCodec;
import org.redisson.client.codec.Codec;
import org.redisson.client.codec.StringCodec;
import org.redisson.client.protocol.Decoder;
import org.redisson.client.protocol.Encoder;

import java.io.IOException;

/**
 * Codec for hashes, sets and sorted sets. String hash fields are written as raw
 * UTF-8 so that field names stay glob-matchable; every other field type and
 * every value or member goes through the configured value codec.
 * <p>
 * Also exposes the exact bytes the store holds for a field or member, which the
 * tag index uses to reference entries independently of their Java type.
 */
public class HashFieldCodec extends BaseCodec {

    private final Codec valueCodec;

    private final Encoder fieldEncoder = new Encoder() {
        @Override
        public ByteBuf encode(Object in) throws IOException {
            if (in instanceof String) {
                return StringCodec.INSTANCE.getValueEncoder().encode(in);
            }
            return valueCodec.getValueEncoder().encode(in);
        }
    };

    public HashFieldCodec(Codec valueCodec) {
        if (valueCodec == null) {
            throw new IllegalArgumentException("Value codec cannot be null");
        }
        this.valueCodec = valueCodec;
    }

    public HashFieldCodec(ClassLoader classLoader, HashFieldCodec codec) throws ReflectiveOperationException {
        this(copy(classLoader, codec.valueCodec));
    }

    public Codec getValueCodec() {
        return valueCodec;
    }

    @Override
    public Decoder<Object> getValueDecoder() {
        return valueCodec.getValueDecoder();
    }

    @Override
    public Encoder getValueEncoder() {
        return valueCodec.getValueEncoder();
    }

    @Override
    public Decoder<Object> getMapValueDecoder() {
        return valueCodec.getMapValueDecoder();
    }

    @Override
    public Encoder getMapValueEncoder() {
        return valueCodec.getMapValueEncoder();
    }

    /**
     * Field names always decode as UTF-8 text. A field written through the value
     * codec cannot be told apart from text by its bytes, so it comes back as its
     * encoded form read as UTF-8.
     */
    @Override
    public Decoder<Object> getMapKeyDecoder() {
        return StringCodec.INSTANCE.getMapKeyDecoder();
    }

    @Override
    public Encoder getMapKeyEncoder() {
        return fieldEncoder;
    }

    @Override
    public ClassLoader getClassLoader() {
        return valueCodec.getClassLoader();
    }

    /**
     * Bytes stored for {@code field} inside a hash.
     */
    public byte[] fieldBytes(Object field) {
        return toBytes(fieldEncoder, field);
    }

    /**
     * Bytes stored for {@code member} inside a set or sorted set.
     */
    public byte[] memberBytes(Object member) {
        return toBytes(valueCodec.getValueEncoder(), member);
    }

    private static byte[] toBytes(Encoder encoder, Object in) {
        ByteBuf buf;
        try {
            buf = encoder.encode(in);
        } catch (IOException e) {
            throw new SerializationException("Cannot encode " + in.getClass().getName(), e);
        } catch (RuntimeException e) {
            throw StoreExceptionTranslator.translate("encode " + in.getClass().getName(), e);
        }
        try {
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    @Override
    public String toString() {
        return "HashFieldCodec{" + valueCodec.getClass().getSimpleName() + "}";
    }
}
