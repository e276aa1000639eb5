package ai.agentcap.router.orch.economics;

import java.util.List;

/**
 * x402-style payment hint. Purely informational: the router never settles anything itself.
 */
public record PaymentSignalHint(String version,
                                String paymentType,
                                String ephemeralPayer,
                                double suggestedAmount,
                                String currency,
                                boolean settlementOptional,
                                List<String> paymentMethods,
                                String hintId,
                                long timestamp) {

    public PaymentSignalHint {
        paymentMethods = paymentMethods == null ? List.of() : List.copyOf(paymentMethods);
    }
}
