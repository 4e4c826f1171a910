package com.condortrader.config;

import com.condortrader.risk.RiskLimits;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the process-wide {@link RiskLimits} bean from {@code condortrader.risk.*}.
 *
 * <p>Unlike the other limits, {@code max-lots-per-position} may stay unset, which disables
 * the sizing cap.
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimits riskLimits(TradingProperties tradingProperties) {
        TradingProperties.Risk risk = tradingProperties.getRisk();
        return RiskLimits.builder()
                .maxLossPerPosition(risk.getMaxLossPerPosition())
                .maxPositions(risk.getMaxPositions())
                .stopLossPct(risk.getStopLossPct())
                .hedgeTriggerDelta(risk.getHedgeTriggerDelta())
                .maxLotsPerPosition(risk.getMaxLotsPerPosition())
                .build();
    }
}
