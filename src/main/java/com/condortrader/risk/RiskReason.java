package com.condortrader.risk;

/**
 * Reasons attached to a forced exit. Not every reason closes the position: a stale feed and
 * the position cap only restrict new risk, because closing requires a tradable market and the
 * cap only concerns new entries.
 */
public enum RiskReason {
    STOP_LOSS_BREACHED(true, true, true),
    MAX_LOSS_BREACHED(true, true, true),
    ORDER_REJECTED(true, true, true),
    MAX_POSITIONS_EXCEEDED(false, true, false),
    FEED_STALE(false, true, true);

    private final boolean closesPosition;
    private final boolean blocksEntries;
    private final boolean blocksHedges;

    RiskReason(boolean closesPosition, boolean blocksEntries, boolean blocksHedges) {
        this.closesPosition = closesPosition;
        this.blocksEntries = blocksEntries;
        this.blocksHedges = blocksHedges;
    }

    public boolean closesPosition() {
        return closesPosition;
    }

    public boolean blocksEntries() {
        return blocksEntries;
    }

    public boolean blocksHedges() {
        return blocksHedges;
    }
}
