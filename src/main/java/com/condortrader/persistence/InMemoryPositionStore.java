package com.condortrader.persistence;

import com.condortrader.domain.model.Position;
import com.condortrader.mapper.JsonHelper;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Position store kept in memory, for backtests and tests. Snapshots are stored as JSON so
 * a loaded position never aliases the live object, as with the database store.
 */
public class InMemoryPositionStore implements PositionStore {

    private final Map<String, StoredJson> snapshots = new LinkedHashMap<>();
    private final List<String> archive = new ArrayList<>();

    @Override
    public synchronized void snapshot(Position position, LocalDateTime at) {
        snapshots.put(position.getId(), new StoredJson(JsonHelper.toJson(position), at));
    }

    @Override
    public synchronized void archive(Position position, LocalDateTime at) {
        snapshots.remove(position.getId());
        archive.add(JsonHelper.toJson(position));
    }

    @Override
    public synchronized List<StoredPosition> loadOpen() {
        return snapshots.values().stream()
                .map(s -> new StoredPosition(JsonHelper.fromJson(s.json(), Position.class), s.at()))
                .toList();
    }

    @Override
    public synchronized List<Position> archivedOn(LocalDate tradingDay) {
        return archive.stream()
                .map(json -> JsonHelper.fromJson(json, Position.class))
                .filter(p -> p.getEntryTime().toLocalDate().equals(tradingDay))
                .toList();
    }

    private record StoredJson(String json, LocalDateTime at) {}
}
