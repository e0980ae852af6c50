package com.factorbot.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Keep/drop decision for one candidate factor row. Never persisted on its own;
 * flags fold into {@link FactorObservation#qualityFlags}.
 */
public final class QualityVerdict {
    public final boolean keep;
    public final Set<QualityFlag> flags;
    public final String reason;

    private QualityVerdict(boolean keep, Set<QualityFlag> flags, String reason) {
        this.keep = keep;
        EnumSet<QualityFlag> copy = EnumSet.noneOf(QualityFlag.class);
        if (flags != null) {
            copy.addAll(flags);
        }
        this.flags = Collections.unmodifiableSet(copy);
        this.reason = reason == null ? "" : reason;
    }

    public static QualityVerdict keep() {
        return new QualityVerdict(true, Set.of(), "");
    }

    public static QualityVerdict keep(Set<QualityFlag> flags) {
        return new QualityVerdict(true, flags, "");
    }

    public static QualityVerdict drop(String reason) {
        return new QualityVerdict(false, Set.of(), reason);
    }

    public static QualityVerdict drop(String reason, Set<QualityFlag> flags) {
        return new QualityVerdict(false, flags, reason);
    }

    @Override
    public String toString() {
        return keep ? "keep" + flags : "drop(" + reason + ")" + flags;
    }
}
