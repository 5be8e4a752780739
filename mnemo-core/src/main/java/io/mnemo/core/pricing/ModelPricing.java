package io.mnemo.core.pricing;

public record ModelPricing(double inputPerThousand, double outputPerThousand, double flatPerRequest) {
    public ModelPricing {
        inputPerThousand = Math.max(0.0, inputPerThousand);
        outputPerThousand = Math.max(0.0, outputPerThousand);
        flatPerRequest = Math.max(0.0, flatPerRequest);
    }

    public ModelPricing(double inputPerThousand, double outputPerThousand) {
        this(inputPerThousand, outputPerThousand, 0.0);
    }

    public double cost(int inputTokens, int outputTokens) {
        return (inputTokens / 1000.0) * inputPerThousand
            + (outputTokens / 1000.0) * outputPerThousand
            + flatPerRequest;
    }
}
