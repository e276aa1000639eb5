package ai.agentcap.router.spi;

/**
 * Acknowledgement returned by a {@link SettlementSignalEmitter}.
 *
 * @param signalId        emitter-assigned id
 * @param commitmentHash  hash committing to the usage record
 * @param network         target settlement network
 * @param version         signal format version
 * @param signalType      kind of signal, e.g. {@code usage-commitment}
 * @param verifiable      whether the commitment can be checked against the usage record
 * @param settlementReady whether the signal can be settled as-is
 */
public record SettlementSignal(String signalId,
                               String commitmentHash,
                               String network,
                               String version,
                               String signalType,
                               boolean verifiable,
                               boolean settlementReady) {
}
