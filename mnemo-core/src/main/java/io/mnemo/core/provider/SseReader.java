package io.mnemo.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mnemo.core.retry.ErrorKind;
import io.mnemo.core.time.CancellationToken;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.NoSuchElementException;
import java.util.concurrent.CancellationException;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;

/**
 * Reads {@code data:} lines from a server-sent-events body on demand. Reading stops after a
 * {@code STOP} or {@code ERROR} event, on {@code [DONE]} or at end of body.
 */
final class SseReader implements ProviderStream {
    private final String provider;
    private final Response response;
    private final BufferedSource source;
    private final ObjectMapper mapper;
    private final SsePayloadMapper payloadMapper;
    private final CancellationToken token;
    private final CancellationToken.Registration registration;
    private final Deque<StreamEvent> pending = new ArrayDeque<>();
    private boolean finished;
    private boolean closed;

    SseReader(
        String provider,
        Response response,
        ObjectMapper mapper,
        SsePayloadMapper payloadMapper,
        CancellationToken token,
        CancellationToken.Registration registration
    ) {
        this.provider = provider;
        this.response = response;
        ResponseBody body = response.body();
        this.source = body == null ? null : body.source();
        this.mapper = mapper;
        this.payloadMapper = payloadMapper;
        this.token = token;
        this.registration = registration;
        this.finished = source == null;
    }

    @Override
    public boolean hasNext() {
        fill();
        return !pending.isEmpty();
    }

    @Override
    public StreamEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("stream exhausted");
        }
        return pending.poll();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        finished = true;
        registration.close();
        response.close();
    }

    private void fill() {
        while (pending.isEmpty() && !finished) {
            String line;
            try {
                line = source.exhausted() ? null : source.readUtf8Line();
            } catch (IOException ioe) {
                close();
                if (token.isCancelled()) {
                    throw new CancellationException("Stream from " + provider + " cancelled");
                }
                pending.add(StreamEvent.error(HttpErrorClassifier.fromIOException(provider, ioe)));
                return;
            }
            if (line == null) {
                close();
                return;
            }
            if (!line.startsWith("data:")) {
                continue;
            }
            String payload = line.substring(5).trim();
            if (payload.isEmpty()) {
                continue;
            }
            if ("[DONE]".equals(payload)) {
                pending.addAll(payloadMapper.done());
                close();
                return;
            }
            try {
                for (StreamEvent event : payloadMapper.map(mapper.readTree(payload))) {
                    pending.add(event);
                    if (event.type() == StreamEventType.STOP || event.type() == StreamEventType.ERROR) {
                        close();
                        return;
                    }
                }
            } catch (JsonProcessingException e) {
                pending.add(StreamEvent.error(new ProviderException(
                    ErrorKind.UNKNOWN,
                    "Malformed stream payload from " + provider + ": " + e.getOriginalMessage(),
                    e
                )));
                close();
                return;
            }
        }
    }
}
