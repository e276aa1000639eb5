package ai.agentcap.router.orch.economics;

import ai.agentcap.router.model.CapabilityDescriptor;
import ai.agentcap.router.model.CapabilityEconomics;
import ai.agentcap.router.model.ExecutionMetadata;
import ai.agentcap.router.orch.trace.CapDigest;
import org.apache.commons.codec.binary.Hex;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Derives {@link EconomicHints} from a capability's declared economics and the cost reported
 * for one execution.
 */
public class EconomicHintFactory {

    static final String HINT_VERSION = "0.1.0";
    static final String X402 = "x402";
    static final String PRIVACY_CASH = "privacy-cash";
    static final String NON_CUSTODIAL = "non-custodial";

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public EconomicHintFactory(Clock clock) {
        this.clock = clock;
    }

    public EconomicHints build(CapabilityDescriptor capability, ExecutionMetadata execution) {
        CapabilityEconomics eco = capability.economics();
        double amount = (execution != null && execution.costActual() != null)
                ? execution.costActual()
                : eco.costHint();
        String currency = (execution != null && execution.currency() != null) ? execution.currency() : eco.currency();
        long now = clock.millis();

        PaymentSignalHint hint = null;
        if (eco.paymentSignalEnabled()) {
            hint = new PaymentSignalHint(
                    HINT_VERSION,
                    X402,
                    "ephemeral_" + randomHex(8),
                    amount,
                    currency,
                    eco.paymentSignal().settlementOptional(),
                    eco.paymentSignal().paymentMethods(),
                    "hint_" + randomHex(8),
                    now);
        }

        PrivacyPaymentNote note = null;
        if (eco.privacyCashCompatible() && capability.confidential()) {
            String noteId = "note_" + randomHex(8);
            note = new PrivacyPaymentNote(
                    HINT_VERSION,
                    PRIVACY_CASH,
                    "privacy_note_" + noteId,
                    CapDigest.sha256Hex(amount + ":" + currency + ":" + noteId),
                    CapDigest.sha256Hex(noteId + ":" + now),
                    noteId,
                    now,
                    NON_CUSTODIAL);
        }
        return (hint == null && note == null) ? EconomicHints.none() : new EconomicHints(hint, note);
    }

    /** 2 for confidential capabilities, 0 otherwise. */
    public static int privacyLevel(CapabilityDescriptor capability) {
        return capability.confidential() ? 2 : 0;
    }

    private String randomHex(int bytes) {
        byte[] b = new byte[bytes];
        random.nextBytes(b);
        return Hex.encodeHexString(b);
    }
}
