package com.jay.trendagent.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable set of blocked symbols with expiries. Every mutator returns a new instance.
 */
public final class BlockedSymbolSet {

    private static final BlockedSymbolSet EMPTY = new BlockedSymbolSet(Map.of());

    private final Map<String, BlockedSymbol> entries;

    private BlockedSymbolSet(Map<String, BlockedSymbol> entries) {
        this.entries = Collections.unmodifiableMap(new TreeMap<>(entries));
    }

    public static BlockedSymbolSet empty() {
        return EMPTY;
    }

    public static BlockedSymbolSet of(Collection<BlockedSymbol> blocks) {
        BlockedSymbolSet set = EMPTY;
        for (BlockedSymbol b : blocks) {
            set = set.with(b);
        }
        return set;
    }

    public boolean isBlocked(String symbol, Instant now) {
        BlockedSymbol b = entries.get(symbol);
        return b != null && b.isActive(now);
    }

    /**
     * Adds a block. If the symbol is already blocked the longer block wins;
     * an entry without expiry is never shortened.
     */
    public BlockedSymbolSet with(BlockedSymbol block) {
        BlockedSymbol existing = entries.get(block.symbol());
        if (existing != null && outlasts(existing, block)) {
            return this;
        }
        Map<String, BlockedSymbol> copy = new TreeMap<>(entries);
        copy.put(block.symbol(), block);
        return new BlockedSymbolSet(copy);
    }

    public BlockedSymbolSet merge(BlockedSymbolSet other) {
        BlockedSymbolSet merged = this;
        for (BlockedSymbol b : other.entries.values()) {
            merged = merged.with(b);
        }
        return merged;
    }

    /** Drops entries whose expiry has passed at {@code now}. */
    public BlockedSymbolSet withoutExpired(Instant now) {
        Map<String, BlockedSymbol> active = entries.values().stream()
            .filter(b -> b.isActive(now))
            .collect(Collectors.toMap(BlockedSymbol::symbol, b -> b));
        return active.size() == entries.size() ? this : new BlockedSymbolSet(active);
    }

    public Set<String> activeSymbols(Instant now) {
        return entries.values().stream()
            .filter(b -> b.isActive(now))
            .map(BlockedSymbol::symbol)
            .collect(Collectors.toCollection(TreeSet::new));
    }

    public Collection<BlockedSymbol> entries() {
        return entries.values();
    }

    public int size() {
        return entries.size();
    }

    private static boolean outlasts(BlockedSymbol existing, BlockedSymbol incoming) {
        if (existing.blockedUntil() == null) return true;
        if (incoming.blockedUntil() == null) return false;
        return !existing.blockedUntil().isBefore(incoming.blockedUntil());
    }

    @Override
    public String toString() {
        return "BlockedSymbolSet" + entries.keySet();
    }
}
