package com.condortrader.strategy;

import com.condortrader.domain.model.FeedStatus;
import com.condortrader.domain.model.OptionChainSnapshot;
import com.condortrader.risk.RiskLimits;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a strategy may look at during one evaluation. Built by the decision loop for
 * every step, so a strategy never reads a clock or a shared service on its own.
 */
@Value
@Builder(toBuilder = true)
public class StrategyContext {

    OptionChainSnapshot snapshot;

    /** Decision time: the tick timestamp, or the scheduler time on a timer step. */
    LocalDateTime now;

    FeedStatus feedStatus;

    RiskLimits riskLimits;

    /** Current IV rank (0-100), null while the tracker has too few samples. */
    BigDecimal ivRank;

    /** Open positions across the process. */
    int openPositions;

    /** Instruments held by other open positions. */
    @Builder.Default
    Set<Long> claimedInstruments = Set.of();
}
