package ac.tagcache.exception;

import org.redisson.client.RedisConnectionException;
import org.redisson.client.RedisException;
import org.redisson.client.RedisTimeoutException;

import java.io.IOException;
import java.util.function.Supplier;

/**
 * Runs store commands and maps Redisson and codec failures onto the
 * {@link CacheException} hierarchy. Anything else is rethrown unchanged.
 */
public final class StoreExceptionTranslator {

    private static final String KRYO_EXCEPTION = "KryoException";

    private StoreExceptionTranslator() {
    }

    public static <R> R execute(String operation, Supplier<R> command) {
        try {
            return command.get();
        } catch (CacheException e) {
            throw e;
        } catch (RuntimeException e) {
            throw translate(operation, e);
        }
    }

    public static void run(String operation, Runnable command) {
        execute(operation, () -> {
            command.run();
            return null;
        });
    }

    public static RuntimeException translate(String operation, RuntimeException error) {
        if (error instanceof CacheException) {
            return error;
        }
        if (error instanceof RedisConnectionException || error instanceof RedisTimeoutException) {
            return new StoreConnectivityException("Store unreachable during " + operation + ": " + error.getMessage(), error);
        }
        if (isCodecFailure(error)) {
            return new SerializationException("Codec failure during " + operation + ": " + error.getMessage(), error);
        }
        if (error instanceof RedisException) {
            return new StoreConnectivityException("Store command failed during " + operation + ": " + error.getMessage(), error);
        }
        return error;
    }

    /**
     * Redisson reports encode failures as {@link IllegalArgumentException} wrapping an
     * {@link IOException}; decode failures arrive wrapped in a {@link RedisException}.
     */
    static boolean isCodecFailure(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if ((current instanceof IOException && !isTransportFailure(current))
                    || current.getClass().getSimpleName().equals(KRYO_EXCEPTION)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean isTransportFailure(Throwable error) {
        String name = error.getClass().getName();
        return name.startsWith("java.net.") || name.startsWith("javax.net.") || name.startsWith("io.netty.");
    }
}
