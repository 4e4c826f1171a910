package com.condortrader.engine;

import com.condortrader.domain.model.OptionLeg;
import com.condortrader.domain.model.Position;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Open positions of the process and the instruments each one holds.
 *
 * <p>No instrument may be claimed by two open positions at once. A position's claim covers
 * all of its live legs, a pending roll replacement included, and is refreshed after every
 * step that changed the position. Owned by the decision thread.
 */
public class PositionBook {

    private static final Logger log = LoggerFactory.getLogger(PositionBook.class);

    private final Map<String, Set<Long>> claims = new LinkedHashMap<>();

    /**
     * Claims the instruments of an open position, replacing its previous claim.
     *
     * @throws IllegalStateException when another open position holds one of the instruments
     */
    public void claim(Position position) {
        Set<Long> tokens = new HashSet<>();
        for (OptionLeg leg : position.liveLegs()) {
            tokens.add(leg.getInstrumentToken());
        }
        for (Map.Entry<String, Set<Long>> other : claims.entrySet()) {
            if (other.getKey().equals(position.getId())) {
                continue;
            }
            for (Long token : tokens) {
                if (other.getValue().contains(token)) {
                    throw new IllegalStateException("Instrument " + token + " of position " + position.getId()
                            + " is already held by position " + other.getKey());
                }
            }
        }
        Set<Long> previous = claims.put(position.getId(), tokens);
        if (previous == null) {
            log.info("Position {} claimed instruments {}", position.getId(), tokens);
        }
    }

    public void release(String positionId) {
        Set<Long> released = claims.remove(positionId);
        if (released != null) {
            log.info("Position {} released instruments {}", positionId, released);
        }
    }

    /** Instruments held by open positions other than {@code positionId} (null for all). */
    public Set<Long> claimedExcept(String positionId) {
        Set<Long> tokens = new HashSet<>();
        claims.forEach((id, held) -> {
            if (!id.equals(positionId)) {
                tokens.addAll(held);
            }
        });
        return Set.copyOf(tokens);
    }

    public boolean isOpen(String positionId) {
        return claims.containsKey(positionId);
    }

    public int openCount() {
        return claims.size();
    }
}
