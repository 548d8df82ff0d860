package io.esub.client;

import io.esub.core.PublishItem;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Produces the items of one publish session, finite or unbounded.
 *
 * <p>{@link #items()} is called once per session and the iterator is consumed lazily, one item per
 * frame.
 */
@FunctionalInterface
public interface PublishSource {

    Iterator<PublishItem> items() throws Exception;

    /**
     * Publishes each value in order under the session key, token and flag.
     *
     * @throws IllegalArgumentException if {@code data} is empty
     */
    static PublishSource of(List<String> data) {
        Objects.requireNonNull(data, "data");
        if (data.isEmpty()) {
            throw new IllegalArgumentException("data must not be empty");
        }
        List<PublishItem> items = data.stream().map(PublishItem::of).toList();
        return items::iterator;
    }

    static PublishSource of(String... data) {
        return of(List.of(data));
    }

    /**
     * Publishes every line read from {@code reader} until end of input. Lines are read only as the
     * session asks for them.
     */
    static PublishSource lines(BufferedReader reader) {
        Objects.requireNonNull(reader, "reader");
        return () -> new Iterator<>() {
            private String next;
            private boolean done;

            @Override
            public boolean hasNext() {
                if (next != null) return true;
                if (done) return false;
                try {
                    next = reader.readLine();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                done = next == null;
                return !done;
            }

            @Override
            public PublishItem next() {
                if (!hasNext()) throw new NoSuchElementException();
                String line = next;
                next = null;
                return PublishItem.of(line);
            }
        };
    }
}
