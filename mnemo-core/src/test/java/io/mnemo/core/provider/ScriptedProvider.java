package io.mnemo.core.provider;

import io.mnemo.core.model.TokenUsage;
import io.mnemo.core.time.CancellationToken;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Replays a queue of scripted replies and records every request it receives.
 */
public final class ScriptedProvider implements ProviderClient {
    private final String name;
    private final String model;
    private final double costPerToken;
    private final Deque<Supplier<ProviderResponse>> script = new ArrayDeque<>();
    private final Deque<List<StreamEvent>> streams = new ArrayDeque<>();
    private final List<ProviderRequest> requests = new ArrayList<>();
    private Runnable beforeCall = () -> {
    };

    public ScriptedProvider(String name) {
        this(name, 0.0);
    }

    public ScriptedProvider(String name, double costPerToken) {
        this.name = name;
        this.model = name + "-model";
        this.costPerToken = costPerToken;
    }

    public ScriptedProvider reply(String content) {
        script.addLast(() -> new ProviderResponse(content, new TokenUsage(100, 50), model, "stop"));
        return this;
    }

    public ScriptedProvider streamReply(List<StreamEvent> events) {
        streams.addLast(List.copyOf(events));
        return this;
    }

    public ScriptedProvider fail(ProviderException failure) {
        script.addLast(() -> {
            throw failure;
        });
        return this;
    }

    public ScriptedProvider failTimes(int times, ProviderException failure) {
        for (int i = 0; i < times; i++) {
            fail(failure);
        }
        return this;
    }

    public ScriptedProvider beforeCall(Runnable action) {
        this.beforeCall = action;
        return this;
    }

    public synchronized List<ProviderRequest> requests() {
        return List.copyOf(requests);
    }

    public synchronized int calls() {
        return requests.size();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public synchronized ProviderResponse send(ProviderRequest request, CancellationToken token) {
        requests.add(request);
        beforeCall.run();
        Supplier<ProviderResponse> next = script.pollFirst();
        if (next == null) {
            throw new IllegalStateException("No scripted reply left for " + name);
        }
        return next.get();
    }

    @Override
    public synchronized ProviderStream stream(ProviderRequest request, CancellationToken token) {
        requests.add(request);
        beforeCall.run();
        List<StreamEvent> next = streams.pollFirst();
        if (next == null) {
            throw new IllegalStateException("No scripted stream left for " + name);
        }
        return ProviderStream.of(next);
    }

    @Override
    public int estimateTokens(String text) {
        return text == null ? 0 : (int) Math.ceil(text.length() / 4.0);
    }

    @Override
    public ProviderCapabilities capabilities() {
        return new ProviderCapabilities(100_000, 4096, true, false, List.of(model));
    }

    @Override
    public double estimateCost(int inputTokens, int outputTokens) {
        return (inputTokens + outputTokens) * costPerToken;
    }

    @Override
    public void validateConfig() {
    }
}
