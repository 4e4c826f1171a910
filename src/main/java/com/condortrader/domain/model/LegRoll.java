package com.condortrader.domain.model;

import com.condortrader.domain.enums.LegRole;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A roll in progress: the breached leg is being bought back while its replacement is sold
 * further out. The replacement takes the leg's slot once both sides have filled.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LegRoll {

    private LegRole role;
    private String oldLegId;
    private OptionLeg newLeg;
    private LocalDateTime startedAt;
    private String closeOrderId;
    private String openOrderId;
}
