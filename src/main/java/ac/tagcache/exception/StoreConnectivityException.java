package ac.tagcache.exception;

/**
 * The backing store could not be reached, or a command failed at the
 * transport or protocol level. Never retried by the provider.
 */
public class StoreConnectivityException extends CacheException {

    public StoreConnectivityException(String message) {
        super(message);
    }

    public StoreConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
