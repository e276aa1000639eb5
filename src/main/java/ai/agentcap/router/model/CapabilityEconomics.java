package ai.agentcap.router.model;

/**
 * Declared economics of a capability.
 *
 * @param costHint              nominal cost per call, used when the executor reports none
 * @param currency              settlement currency
 * @param paymentSignal         x402-style payment signal settings, null when not offered
 * @param privacyCashCompatible whether confidential runs may settle through privacy cash notes
 */
public record CapabilityEconomics(double costHint,
                                  String currency,
                                  PaymentSignalConfig paymentSignal,
                                  boolean privacyCashCompatible) {

    public static CapabilityEconomics free() {
        return new CapabilityEconomics(0d, "USD", null, false);
    }

    public boolean paymentSignalEnabled() {
        return paymentSignal != null && paymentSignal.enabled();
    }
}
