package com.condortrader.domain.enums;

/**
 * Position of a leg inside the condor. Ordinal order is the canonical leg order:
 * sell call, buy call (hedge), sell put, buy put (hedge).
 */
public enum LegRole {
    SHORT_CALL(OptionType.CE, OrderSide.SELL),
    LONG_CALL(OptionType.CE, OrderSide.BUY),
    SHORT_PUT(OptionType.PE, OrderSide.SELL),
    LONG_PUT(OptionType.PE, OrderSide.BUY);

    private final OptionType optionType;
    private final OrderSide side;

    LegRole(OptionType optionType, OrderSide side) {
        this.optionType = optionType;
        this.side = side;
    }

    public OptionType optionType() {
        return optionType;
    }

    /** Side used to open the leg. */
    public OrderSide side() {
        return side;
    }

    public boolean isShort() {
        return side == OrderSide.SELL;
    }

    /** The protective wing paired with a short leg. */
    public LegRole hedge() {
        return switch (this) {
            case SHORT_CALL -> LONG_CALL;
            case SHORT_PUT -> LONG_PUT;
            default -> this;
        };
    }
}
