package com.factorbot.factor;

import com.factorbot.align.AlignedValue;
import com.factorbot.model.QualityFlag;
import com.factorbot.model.QualityVerdict;
import com.factorbot.quality.StalenessPolicy;

import java.util.EnumSet;
import java.util.Set;

final class FinancialRules {

    private FinancialRules() {
    }

    /**
     * Expired inputs drop the row with {@code data_expired}; null when the row
     * may proceed to its business checks.
     */
    static QualityVerdict expiryVerdict(StalenessPolicy.Tier tier) {
        if (tier == StalenessPolicy.Tier.EXPIRED) {
            return QualityVerdict.drop(DropReasons.DATA_EXPIRED, EnumSet.of(QualityFlag.DATA_EXPIRED));
        }
        return null;
    }

    static Set<QualityFlag> staleFlags(StalenessPolicy.Tier tier) {
        return tier == StalenessPolicy.Tier.STALE ? EnumSet.of(QualityFlag.FINANCIAL_STALE) : EnumSet.noneOf(QualityFlag.class);
    }

    static StalenessPolicy.Tier tier(StalenessPolicy policy, AlignedValue... inputs) {
        return policy.financialTier(inputs);
    }
}
