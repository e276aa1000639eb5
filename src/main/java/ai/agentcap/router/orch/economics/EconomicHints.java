package ai.agentcap.router.orch.economics;

/**
 * Payment hints attached to an invocation result; either part may be null.
 */
public record EconomicHints(PaymentSignalHint paymentSignal, PrivacyPaymentNote privacyNote) {

    private static final EconomicHints NONE = new EconomicHints(null, null);

    public static EconomicHints none() {
        return NONE;
    }

    public boolean isEmpty() {
        return paymentSignal == null && privacyNote == null;
    }
}
