package io.mnemo.core.assembly;

import io.mnemo.core.model.TokenUsage;
import io.mnemo.core.provider.ProviderException;
import io.mnemo.core.provider.ProviderStream;
import io.mnemo.core.provider.StreamEvent;
import io.mnemo.core.retry.ErrorKind;

/**
 * Collects streamed deltas into one buffer while tracking brace depth and string state.
 * {@code COLLECTING -> COMPLETE | TRUNCATED | ERRORED}; the terminal states accept no more events.
 */
public final class ResponseAssembler {
    public static final int DEFAULT_MAX_BUFFER = 100_000;

    private final int maxBuffer;
    private final StringBuilder buffer = new StringBuilder();
    private AssemblyState state = AssemblyState.COLLECTING;
    private TokenUsage usage = TokenUsage.empty();
    private String finishReason = "";
    private ProviderException error;

    private int depth;
    private boolean inString;
    private boolean escaped;
    private boolean sawStructure;

    public ResponseAssembler() {
        this(DEFAULT_MAX_BUFFER);
    }

    public ResponseAssembler(int maxBuffer) {
        this.maxBuffer = Math.max(1, maxBuffer);
    }

    /**
     * Drains {@code stream} and closes it.
     */
    public static AssembledResponse assemble(ProviderStream stream) {
        return assemble(stream, DEFAULT_MAX_BUFFER);
    }

    public static AssembledResponse assemble(ProviderStream stream, int maxBuffer) {
        ResponseAssembler assembler = new ResponseAssembler(maxBuffer);
        try (stream) {
            while (assembler.state() == AssemblyState.COLLECTING && stream.hasNext()) {
                assembler.accept(stream.next());
            }
        }
        return assembler.finish();
    }

    public void accept(StreamEvent event) {
        if (state != AssemblyState.COLLECTING) {
            throw new IllegalStateException("assembler already " + state);
        }
        switch (event.type()) {
            case START -> usage = event.usage();
            case DELTA -> append(event.text());
            case STOP -> {
                if (event.usage().reported()) {
                    usage = event.usage();
                }
                finishReason = event.finishReason();
                state = AssemblyState.COMPLETE;
            }
            case ERROR -> {
                error = event.error();
                state = AssemblyState.ERRORED;
            }
        }
    }

    /**
     * Ends assembly. A stream that never sent {@code STOP} is truncated.
     */
    public AssembledResponse finish() {
        if (state == AssemblyState.COLLECTING) {
            state = AssemblyState.TRUNCATED;
        }
        return new AssembledResponse(state, buffer.toString(), usage, finishReason, balanced(), error);
    }

    public AssemblyState state() {
        return state;
    }

    /**
     * True once at least one object or array was opened and every one has been closed.
     */
    public boolean balanced() {
        return sawStructure && depth == 0 && !inString;
    }

    private void append(String text) {
        if (buffer.length() + text.length() > maxBuffer) {
            error = new ProviderException(
                ErrorKind.PARSING,
                "Streamed response exceeded " + maxBuffer + " characters"
            );
            state = AssemblyState.ERRORED;
            return;
        }
        buffer.append(text);
        for (int i = 0; i < text.length(); i++) {
            track(text.charAt(i));
        }
    }

    private void track(char c) {
        if (inString) {
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '"') {
                inString = false;
            }
            return;
        }
        if (c == '"') {
            inString = true;
        } else if (c == '{' || c == '[') {
            depth++;
            sawStructure = true;
        } else if ((c == '}' || c == ']') && depth > 0) {
            depth--;
        }
    }
}
