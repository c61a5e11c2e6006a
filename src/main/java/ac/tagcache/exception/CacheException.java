package ac.tagcache.exception;

/**
 * Base class of the failures raised by the cache provider.
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
