package com.tracker.core.pnl;

/**
 * Best and worst PnL percentages observed over a position's continuous presence.
 */
public record PositionExtremes(double maxProfitPct, double maxDrawdownPct) {

    public static PositionExtremes initial(double pnlPercent) {
        return new PositionExtremes(pnlPercent, pnlPercent);
    }

    /**
     * Returns new PositionExtremes widened to include the reading.
     */
    public PositionExtremes observe(double pnlPercent) {
        return new PositionExtremes(
            Math.max(maxProfitPct, pnlPercent),
            Math.min(maxDrawdownPct, pnlPercent)
        );
    }
}
