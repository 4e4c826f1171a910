package com.condortrader.support;

import static com.condortrader.support.ChainFixtures.LOT_SIZE;
import static com.condortrader.support.ChainFixtures.T0;
import static com.condortrader.support.ChainFixtures.contract;

import com.condortrader.domain.enums.IndexName;
import com.condortrader.domain.enums.LegRole;
import com.condortrader.domain.enums.OptionType;
import com.condortrader.domain.enums.PositionState;
import com.condortrader.domain.model.OptionLeg;
import com.condortrader.domain.model.Position;
import java.math.BigDecimal;
import java.util.List;

/**
 * Builds the standard test condor: 21500P / 21700P / 22300C / 22500C, one lot per leg.
 */
public final class PositionFixtures {

    public static final String POSITION_ID = "NIFTY-240115-1";

    private PositionFixtures() {}

    /** Entered condor with fills at the given prices: short call, long call, short put, long put. */
    public static Position enteredCondor(String shortCall, String longCall, String shortPut, String longPut) {
        Position position = Position.open(
                POSITION_ID,
                "IRON_CONDOR",
                IndexName.NIFTY,
                List.of(
                        leg(LegRole.SHORT_CALL, 22300, OptionType.CE),
                        leg(LegRole.LONG_CALL, 22500, OptionType.CE),
                        leg(LegRole.SHORT_PUT, 21700, OptionType.PE),
                        leg(LegRole.LONG_PUT, 21500, OptionType.PE)),
                T0);
        position.leg(LegRole.SHORT_CALL).applyOpenFill(LOT_SIZE, new BigDecimal(shortCall));
        position.leg(LegRole.LONG_CALL).applyOpenFill(LOT_SIZE, new BigDecimal(longCall));
        position.leg(LegRole.SHORT_PUT).applyOpenFill(LOT_SIZE, new BigDecimal(shortPut));
        position.leg(LegRole.LONG_PUT).applyOpenFill(LOT_SIZE, new BigDecimal(longPut));
        position.setState(PositionState.ENTERED);
        return position;
    }

    public static Position enteredCondor() {
        return enteredCondor("50", "20", "45", "18");
    }

    /** Condor awaiting its entry fills, one lot per leg at the given strikes. */
    public static Position condor(String id, int shortCall, int longCall, int shortPut, int longPut) {
        return Position.open(
                id,
                "IRON_CONDOR",
                IndexName.NIFTY,
                List.of(
                        leg(id, LegRole.SHORT_CALL, shortCall, OptionType.CE),
                        leg(id, LegRole.LONG_CALL, longCall, OptionType.CE),
                        leg(id, LegRole.SHORT_PUT, shortPut, OptionType.PE),
                        leg(id, LegRole.LONG_PUT, longPut, OptionType.PE)),
                T0);
    }

    private static OptionLeg leg(LegRole role, int strike, OptionType type) {
        return leg(POSITION_ID, role, strike, type);
    }

    private static OptionLeg leg(String id, LegRole role, int strike, OptionType type) {
        return OptionLeg.fromContract(id + "-" + role.name(), role, contract(strike, type), LOT_SIZE);
    }
}
