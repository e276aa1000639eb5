package ai.agentcap.router.orch.policy;

import java.util.Locale;

public enum PrivacyTier {
    NONE(0),
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private final int level;

    PrivacyTier(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public boolean atLeast(PrivacyTier floor) {
        return floor == null || level >= floor.level;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
