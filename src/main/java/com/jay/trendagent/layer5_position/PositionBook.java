package com.jay.trendagent.layer5_position;

import com.jay.trendagent.model.Position;
import com.jay.trendagent.model.PositionKey;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Open positions keyed by (connector, symbol), plus the per-key bookkeeping the loop needs:
 * the last bar timestamp seen and the remaining re-entry cool-down.
 * Owned by the tick thread; not thread-safe.
 */
@Component
public class PositionBook {

    private final Map<PositionKey, Position> open = new LinkedHashMap<>();
    private final Map<PositionKey, Instant> lastBarTime = new HashMap<>();
    private final Map<PositionKey, Integer> cooldownBars = new HashMap<>();

    public Position get(PositionKey key) {
        return open.get(key);
    }

    public boolean isOpen(PositionKey key) {
        return open.containsKey(key);
    }

    public void add(Position position) {
        if (open.putIfAbsent(position.getKey(), position) != null) {
            throw new IllegalStateException("Position already open for " + position.getKey());
        }
    }

    public void remove(PositionKey key) {
        open.remove(key);
    }

    /** Snapshot copy, safe to iterate while positions close. */
    public List<Position> openPositions() {
        return new ArrayList<>(open.values());
    }

    public int size() {
        return open.size();
    }

    // ── Fresh-bar gating ─────────────────────────────────────────────────────

    /**
     * Records {@code barTime} for the key. Returns true if it is newer than the last one seen.
     */
    public boolean markBar(PositionKey key, Instant barTime) {
        Instant previous = lastBarTime.get(key);
        if (previous != null && !barTime.isAfter(previous)) {
            return false;
        }
        lastBarTime.put(key, barTime);
        return true;
    }

    // ── Re-entry cool-down ───────────────────────────────────────────────────

    public void startCooldown(PositionKey key, int bars) {
        if (bars > 0) {
            cooldownBars.put(key, bars);
        }
    }

    /** Burns one fresh bar of cool-down. Returns true if the key was still cooling down. */
    public boolean consumeCooldown(PositionKey key) {
        Integer left = cooldownBars.get(key);
        if (left == null) return false;
        if (left <= 1) cooldownBars.remove(key);
        else cooldownBars.put(key, left - 1);
        return true;
    }
}
