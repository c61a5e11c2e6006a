package ac.tagcache;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Derives the tags of a cache entry from the value that was just produced.
 * A fixed tag list is a builder that ignores its input, see {@link #of(String...)}.
 *
 * @param <T> the value type
 */
@FunctionalInterface
public interface TagBuilder<T> {

    Collection<String> tagsFor(T value);

    static <T> TagBuilder<T> of(String... tags) {
        List<String> fixed = tags == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(Arrays.asList(tags)));
        return value -> fixed;
    }

    static <T> TagBuilder<T> of(Collection<String> tags) {
        List<String> fixed = tags == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(tags));
        return value -> fixed;
    }
}
