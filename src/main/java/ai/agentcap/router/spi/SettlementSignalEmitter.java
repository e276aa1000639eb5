package ai.agentcap.router.spi;

/**
 * Emits a settlement/telemetry signal for a finished invocation. Awaited by the router;
 * a thrown exception leaves the invocation result intact with no signal attached.
 */
@FunctionalInterface
public interface SettlementSignalEmitter {

    SettlementSignal emit(UsageRecord usage) throws Exception;
}
