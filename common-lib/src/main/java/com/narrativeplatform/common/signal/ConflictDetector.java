package com.narrativeplatform.common.signal;

import com.narrativeplatform.common.model.NormalizedSignals;

/**
 * Flags disagreement between signal directions.
 *
 * <p>Each signal votes with its sign; a signal of exactly 0.0 abstains. Among
 * the voters, {@code aligned} is the size of the majority and {@code opposing}
 * the size of the minority:
 * <pre>
 *   no voters             → not conflicting
 *   opposing &gt;= aligned  → conflicting (ties count as conflict)
 *   otherwise             → not conflicting
 * </pre>
 */
public final class ConflictDetector {

    private ConflictDetector() {}

    public static boolean detect(NormalizedSignals signals) {
        int positive = 0;
        int negative = 0;
        for (double value : signals.values()) {
            if (value > 0.0)      positive++;
            else if (value < 0.0) negative++;
        }
        if (positive + negative == 0) {
            return false;
        }
        int aligned  = Math.max(positive, negative);
        int opposing = Math.min(positive, negative);
        return opposing >= aligned;
    }
}
