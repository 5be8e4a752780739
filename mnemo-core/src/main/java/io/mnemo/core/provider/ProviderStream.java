package io.mnemo.core.provider;

import java.util.Iterator;
import java.util.List;

/**
 * Lazy, finite, single-pass sequence of stream events. Closing releases the underlying
 * connection; a stream that ends without a {@code STOP} event was cut off.
 */
public interface ProviderStream extends Iterator<StreamEvent>, AutoCloseable {

    @Override
    void close();

    static ProviderStream of(List<StreamEvent> events) {
        Iterator<StreamEvent> iterator = List.copyOf(events).iterator();
        return new ProviderStream() {
            @Override
            public boolean hasNext() {
                return iterator.hasNext();
            }

            @Override
            public StreamEvent next() {
                return iterator.next();
            }

            @Override
            public void close() {
            }
        };
    }
}
