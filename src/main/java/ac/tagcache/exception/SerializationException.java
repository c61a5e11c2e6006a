package ac.tagcache.exception;

/**
 * A value, hash field or set member could not be encoded or decoded by the
 * configured codec.
 */
public class SerializationException extends CacheException {

    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
