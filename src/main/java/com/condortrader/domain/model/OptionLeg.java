package com.condortrader.domain.model;

import com.condortrader.domain.enums.LegRole;
import com.condortrader.domain.enums.OptionType;
import com.condortrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One option leg of a Position. Owned by exactly one Position and mutated only through
 * fills applied by the owning strategy.
 *
 * <p>Quantities are in units (lots x lot size). {@code openedQuantity} and
 * {@code closedQuantity} are cumulative, so the live exposure is their difference.
 * Realized P&L accumulates per close fill against the average entry price.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OptionLeg {

    private String legId;
    private LegRole role;
    private long instrumentToken;
    private String tradingSymbol;
    private String exchange;
    private BigDecimal strike;
    private OptionType optionType;
    private LocalDate expiry;

    /** Side the leg was opened with. */
    private OrderSide side;

    /** Target quantity of the opening order. */
    private int quantity;

    /** Average opening price, null until the first open fill. */
    private BigDecimal entryPrice;

    @Builder.Default
    private int openedQuantity = 0;

    @Builder.Default
    private int closedQuantity = 0;

    /** Average closing price, null until the first close fill. */
    private BigDecimal exitPrice;

    @Builder.Default
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    /** Close orders of this leg rejected so far. */
    @Builder.Default
    private int closeRejections = 0;

    /** Set once closes stop being sent for this leg; its units need manual handling. */
    private boolean closeAbandoned;

    public static OptionLeg fromContract(String legId, LegRole role, OptionContract contract, int quantity) {
        return OptionLeg.builder()
                .legId(legId)
                .role(role)
                .instrumentToken(contract.getInstrumentToken())
                .tradingSymbol(contract.getTradingSymbol())
                .exchange(contract.getExchange())
                .strike(contract.getStrike())
                .optionType(contract.getOptionType())
                .expiry(contract.getExpiry())
                .side(role.side())
                .quantity(quantity)
                .build();
    }

    public OptionContract toContract() {
        return OptionContract.builder()
                .instrumentToken(instrumentToken)
                .tradingSymbol(tradingSymbol)
                .exchange(exchange)
                .strike(strike)
                .optionType(optionType)
                .expiry(expiry)
                .build();
    }

    /** Units currently held. */
    public int openQuantity() {
        return openedQuantity - closedQuantity;
    }

    public boolean fullyOpened() {
        return openedQuantity >= quantity;
    }

    public boolean flat() {
        return openQuantity() == 0;
    }

    public void applyOpenFill(int qty, BigDecimal price) {
        BigDecimal previousCost =
                entryPrice != null ? entryPrice.multiply(BigDecimal.valueOf(openedQuantity)) : BigDecimal.ZERO;
        openedQuantity += qty;
        entryPrice = previousCost
                .add(price.multiply(BigDecimal.valueOf(qty)))
                .divide(BigDecimal.valueOf(openedQuantity), 4, RoundingMode.HALF_UP);
    }

    /**
     * Applies a closing fill and returns the P&L it realized. The realized amount uses the
     * average entry price; for a leg opened in one go and closed in one go this equals FIFO.
     */
    public BigDecimal applyCloseFill(int qty, BigDecimal price) {
        BigDecimal previousProceeds =
                exitPrice != null ? exitPrice.multiply(BigDecimal.valueOf(closedQuantity)) : BigDecimal.ZERO;
        closedQuantity += qty;
        exitPrice = previousProceeds
                .add(price.multiply(BigDecimal.valueOf(qty)))
                .divide(BigDecimal.valueOf(closedQuantity), 4, RoundingMode.HALF_UP);

        BigDecimal basis = entryPrice != null ? entryPrice : price;
        BigDecimal realized = price.subtract(basis)
                .multiply(BigDecimal.valueOf(qty))
                .multiply(BigDecimal.valueOf(side.sign()));
        realizedPnl = realizedPnl.add(realized);
        return realized;
    }

    /** Unrealized P&L of the open units at the given mark. */
    public BigDecimal markToMarket(BigDecimal mark) {
        if (flat() || entryPrice == null) {
            return BigDecimal.ZERO;
        }
        return mark.subtract(entryPrice)
                .multiply(BigDecimal.valueOf(openQuantity()))
                .multiply(BigDecimal.valueOf(side.sign()));
    }
}
