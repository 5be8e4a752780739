package io.mnemo.core.provider;

public final class UnknownProviderException extends IllegalArgumentException {
    private final String providerName;

    public UnknownProviderException(String providerName) {
        super("Unknown provider: " + providerName);
        this.providerName = providerName;
    }

    public String providerName() {
        return providerName;
    }
}
