package ai.agentcap.router.signal;

import ai.agentcap.router.orch.trace.CapDigest;
import ai.agentcap.router.spi.SettlementSignal;
import ai.agentcap.router.spi.SettlementSignalEmitter;
import ai.agentcap.router.spi.UsageRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Default emitter: builds a usage commitment (SHA-256 over the canonical usage record) without
 * contacting any network. Real deployments replace this bean with one that publishes the signal.
 */
@Slf4j
public class CommitmentSignalEmitter implements SettlementSignalEmitter {

    public static final String DEFAULT_NETWORK = "solana-devnet";
    static final String VERSION = "0.1.0";
    static final String SIGNAL_TYPE = "usage-commitment";

    private final String network;

    public CommitmentSignalEmitter() {
        this(DEFAULT_NETWORK);
    }

    public CommitmentSignalEmitter(String network) {
        this.network = network;
    }

    @Override
    public SettlementSignal emit(UsageRecord usage) {
        SettlementSignal signal = new SettlementSignal(
                "sig_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16),
                commitment(usage),
                network,
                VERSION,
                SIGNAL_TYPE,
                true,
                false);
        log.debug("[signal] {} for {} ({})", signal.signalId(), usage.capabilityId(), usage.requestId());
        return signal;
    }

    /** Hash over the fields a verifier can recompute from the usage record. */
    public static String commitment(UsageRecord usage) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("capability_id", usage.capabilityId());
        body.put("request_id", usage.requestId());
        body.put("timestamp", usage.timestamp());
        body.put("success", usage.success());
        body.put("cost", usage.cost());
        return CapDigest.sha256Canonical(body);
    }
}
