package com.jay.stfunnel.layer1_data;

import com.jay.stfunnel.config.FunnelConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The screening universe from config.yaml, with the sector map used for concentration limits.
 */
@Slf4j
@Service
public class UniverseService {

    private final Map<String, FunnelConfig.UniverseEntry> entries = new LinkedHashMap<>();

    public UniverseService(FunnelConfig config) {
        for (FunnelConfig.UniverseEntry entry : config.universe()) {
            if (entry.getTicker() == null || entry.getTicker().isBlank()) continue;
            entries.putIfAbsent(normalize(entry.getTicker()), entry);
        }
        log.info("Universe loaded: {} tickers across {} sectors", entries.size(), sectors().size());
    }

    public List<String> tickers() {
        return new ArrayList<>(entries.keySet());
    }

    /** Universe tickers not present in {@code exclude}, in universe order. */
    public List<String> tickersExcluding(Collection<String> exclude) {
        Set<String> excluded = new HashSet<>();
        exclude.forEach(t -> excluded.add(normalize(t)));
        return entries.keySet().stream().filter(t -> !excluded.contains(t)).toList();
    }

    /** Configured sector, or null when the ticker is outside the universe. */
    public String sectorFor(String ticker) {
        FunnelConfig.UniverseEntry entry = entries.get(normalize(ticker));
        return entry != null ? entry.getSector() : null;
    }

    public String nameFor(String ticker) {
        FunnelConfig.UniverseEntry entry = entries.get(normalize(ticker));
        return entry != null ? entry.getName() : null;
    }

    public Set<String> sectors() {
        Set<String> sectors = new TreeSet<>();
        entries.values().forEach(e -> { if (e.getSector() != null) sectors.add(e.getSector()); });
        return sectors;
    }

    public static String normalize(String ticker) {
        return ticker.trim().toUpperCase(Locale.ROOT);
    }
}
