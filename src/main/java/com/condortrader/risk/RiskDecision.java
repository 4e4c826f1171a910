package com.condortrader.risk;

import com.condortrader.domain.enums.LegRole;
import java.math.BigDecimal;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a risk evaluation: Continue, Hedge(leg) or ForceExit(reason). Immutable.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RiskDecision {

    public enum Type {
        CONTINUE,
        HEDGE,
        FORCE_EXIT
    }

    private static final RiskDecision CONTINUE = new RiskDecision(Type.CONTINUE, null, null, null, null);

    Type type;

    /** Leg to hedge (HEDGE only). */
    String legId;

    LegRole role;

    /** How far |delta| exceeds the trigger (HEDGE only). */
    BigDecimal breach;

    RiskReason reason;

    public static RiskDecision continueTrading() {
        return CONTINUE;
    }

    public static RiskDecision hedge(String legId, LegRole role, BigDecimal breach) {
        return new RiskDecision(Type.HEDGE, legId, role, breach, null);
    }

    public static RiskDecision forceExit(RiskReason reason) {
        return new RiskDecision(Type.FORCE_EXIT, null, null, null, reason);
    }

    /** A forced exit that must close the position. */
    public boolean requiresClose() {
        return type == Type.FORCE_EXIT && reason.closesPosition();
    }

    public boolean blocksHedges() {
        return type == Type.FORCE_EXIT && reason.blocksHedges();
    }

    public boolean blocksEntries() {
        return type == Type.FORCE_EXIT && reason.blocksEntries();
    }

    @Override
    public String toString() {
        return switch (type) {
            case CONTINUE -> "Continue";
            case HEDGE -> "Hedge(" + role + ", breach=" + breach + ")";
            case FORCE_EXIT -> "ForceExit(" + reason + ")";
        };
    }
}
