package ai.agentcap.router.orch.economics;

/**
 * Privacy-cash note for confidential runs. Commits to the amount without revealing it.
 */
public record PrivacyPaymentNote(String version,
                                 String paymentType,
                                 String noteReference,
                                 String amountCommitment,
                                 String nullifierHint,
                                 String noteId,
                                 long timestamp,
                                 String custody) {
}
