package ai.agentcap.router.model;

import java.util.List;

public record PaymentSignalConfig(boolean enabled, boolean settlementOptional, List<String> paymentMethods) {

    public PaymentSignalConfig {
        paymentMethods = paymentMethods == null ? List.of() : List.copyOf(paymentMethods);
    }
}
