package io.tiller.core.dependency;

import java.io.Serial;

/// Failure of one installation tier.
///
/// Earlier tiers stay installed; later tiers were never started.
public class TierInstallException extends InstallException {

    @Serial private static final long serialVersionUID = -7421106583049921378L;

    private final int tierIndex;

    public TierInstallException(String chartName, int tierIndex, Throwable cause) {
        super(
                chartName,
                "tier " + tierIndex + " of chart " + chartName + " failed: " + cause.getMessage(),
                cause);
        this.tierIndex = tierIndex;
    }

    /// @return zero-based index of the failing tier; the final tier holding the
    ///     chart's own resources has index equal to the number of dependency tiers
    public int getTierIndex() {
        return tierIndex;
    }
}
