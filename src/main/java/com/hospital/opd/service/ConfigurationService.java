package com.hospital.opd.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.hospital.opd.config.ConfigKey;
import com.hospital.opd.config.ConfigSnapshot;
import com.hospital.opd.config.ConfigView;
import com.hospital.opd.config.OpdProperties;
import com.hospital.opd.config.ReallocationScope;
import com.hospital.opd.entity.ConfigurationEntry;
import com.hospital.opd.entity.TokenSource;
import com.hospital.opd.exception.AllocationException;
import com.hospital.opd.repository.ConfigurationEntryRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runtime configuration backed by the {@code configurations} table, falling
 * back to {@link OpdProperties}. Reads go through a Caffeine snapshot that
 * expires after {@code opd.config.cache-ttl}.
 */
@Service
public class ConfigurationService implements ConfigView {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationService.class);
    private static final String SNAPSHOT = "snapshot";

    private final ConfigurationEntryRepository repository;
    private final OpdProperties properties;
    private final Cache<String, ConfigSnapshot> cache;
    private final Clock clock;

    public ConfigurationService(ConfigurationEntryRepository repository, OpdProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(properties.getConfig().getCacheTtl())
                .maximumSize(1)
                .build();
    }

    @Override
    public ConfigSnapshot snapshot() {
        return cache.get(SNAPSHOT, k -> load());
    }

    /** Effective value of every known key, overrides applied. */
    @Transactional(readOnly = true)
    public Map<String, String> effectiveValues() {
        Map<String, String> values = defaults();
        for (ConfigurationEntry entry : repository.findByActiveTrue()) {
            if (ConfigKey.fromKey(entry.getConfigKey()).isPresent()) {
                values.put(entry.getConfigKey(), entry.getConfigValue());
            }
        }
        return values;
    }

    @Transactional(readOnly = true)
    public Map<String, String> getByCategory(String category) {
        Map<String, String> result = new LinkedHashMap<>();
        effectiveValues().forEach((key, value) -> {
            ConfigKey.fromKey(key)
                    .filter(k -> k.category().equalsIgnoreCase(category))
                    .ifPresent(k -> result.put(key, value));
        });
        return result;
    }

    /** Upserts an override. The repository call commits before the cache is cleared. */
    public ConfigurationEntry setValue(String key, String value, String updatedBy) {
        ConfigKey configKey = ConfigKey.fromKey(key)
                .orElseThrow(() -> AllocationException.validation("Unknown configuration key: " + key, Map.of("key", String.valueOf(key))));
        String normalized = validate(configKey, value);

        ConfigurationEntry entry = repository.findByConfigKey(key)
                .orElse(ConfigurationEntry.builder()
                        .configKey(key)
                        .category(configKey.category())
                        .description(configKey.description())
                        .build());
        entry.setConfigValue(normalized);
        entry.setUpdatedBy(StringUtils.defaultIfBlank(updatedBy, "system"));
        entry.setActive(true);
        entry.setUpdatedAt(clock.instant());
        entry = repository.save(entry);

        cache.invalidateAll();
        log.info("Configuration {} set to {} by {}", key, normalized, entry.getUpdatedBy());
        return entry;
    }

    public boolean deleteValue(String key) {
        Optional<ConfigurationEntry> entry = repository.findByConfigKey(key);
        if (entry.isEmpty()) return false;
        repository.delete(entry.get());
        cache.invalidateAll();
        log.info("Configuration override {} removed", key);
        return true;
    }

    public void refresh() {
        cache.invalidateAll();
        log.debug("Configuration cache cleared");
    }

    private ConfigSnapshot load() {
        Map<String, String> values = effectiveValues();

        Map<TokenSource, Integer> bases = new EnumMap<>(TokenSource.class);
        bases.put(TokenSource.EMERGENCY, intValue(values, ConfigKey.PRIORITY_EMERGENCY));
        bases.put(TokenSource.PRIORITY, intValue(values, ConfigKey.PRIORITY_PRIORITY));
        bases.put(TokenSource.FOLLOWUP, intValue(values, ConfigKey.PRIORITY_FOLLOWUP));
        bases.put(TokenSource.ONLINE, intValue(values, ConfigKey.PRIORITY_ONLINE));
        bases.put(TokenSource.WALKIN, intValue(values, ConfigKey.PRIORITY_WALKIN));

        ConfigSnapshot snapshot = new ConfigSnapshot(
                bases,
                intValue(values, ConfigKey.DEFAULT_SLOT_CAPACITY),
                intValue(values, ConfigKey.EMERGENCY_RESERVE_PERCENTAGE),
                intValue(values, ConfigKey.DEFAULT_CONSULTATION_MINUTES),
                intValue(values, ConfigKey.BUFFER_MINUTES),
                intValue(values, ConfigKey.REALLOCATION_WINDOW_HOURS),
                intValue(values, ConfigKey.PREEMPTION_THRESHOLD),
                intValue(values, ConfigKey.REALLOCATION_SEARCH_LIMIT),
                parseOrder(values.get(ConfigKey.REALLOCATION_ORDER.key()))
        );
        log.debug("Loaded configuration snapshot {}", snapshot);
        return snapshot;
    }

    private Map<String, String> defaults() {
        ConfigSnapshot base = ConfigSnapshot.fromProperties(properties);
        Map<String, String> values = new LinkedHashMap<>();
        values.put(ConfigKey.PRIORITY_EMERGENCY.key(), String.valueOf(base.basePriority(TokenSource.EMERGENCY)));
        values.put(ConfigKey.PRIORITY_PRIORITY.key(), String.valueOf(base.basePriority(TokenSource.PRIORITY)));
        values.put(ConfigKey.PRIORITY_FOLLOWUP.key(), String.valueOf(base.basePriority(TokenSource.FOLLOWUP)));
        values.put(ConfigKey.PRIORITY_ONLINE.key(), String.valueOf(base.basePriority(TokenSource.ONLINE)));
        values.put(ConfigKey.PRIORITY_WALKIN.key(), String.valueOf(base.basePriority(TokenSource.WALKIN)));
        values.put(ConfigKey.DEFAULT_SLOT_CAPACITY.key(), String.valueOf(base.defaultSlotCapacity()));
        values.put(ConfigKey.EMERGENCY_RESERVE_PERCENTAGE.key(), String.valueOf(base.emergencyReservePercentage()));
        values.put(ConfigKey.DEFAULT_CONSULTATION_MINUTES.key(), String.valueOf(base.consultationMinutes()));
        values.put(ConfigKey.BUFFER_MINUTES.key(), String.valueOf(base.bufferMinutes()));
        values.put(ConfigKey.REALLOCATION_WINDOW_HOURS.key(), String.valueOf(base.reallocationWindowHours()));
        values.put(ConfigKey.PREEMPTION_THRESHOLD.key(), String.valueOf(base.preemptionThreshold()));
        values.put(ConfigKey.REALLOCATION_SEARCH_LIMIT.key(), String.valueOf(base.reallocationSearchLimit()));
        values.put(ConfigKey.REALLOCATION_ORDER.key(), String.join(",",
                base.reallocationOrder().stream().map(s -> s.name().toLowerCase(Locale.ROOT)).toList()));
        return values;
    }

    private int intValue(Map<String, String> values, ConfigKey key) {
        String raw = values.get(key.key());
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid value '{}' for {}", raw, key.key());
            return Integer.parseInt(defaults().get(key.key()));
        }
    }

    private static List<ReallocationScope> parseOrder(String raw) {
        List<ReallocationScope> order = new ArrayList<>();
        for (String part : StringUtils.split(StringUtils.defaultString(raw), ',')) {
            ReallocationScope.parse(part).filter(s -> !order.contains(s)).ifPresent(order::add);
        }
        return order;
    }

    private static String validate(ConfigKey key, String value) {
        if (StringUtils.isBlank(value)) {
            throw AllocationException.validation("Configuration " + key.key() + " requires a value", Map.of("key", key.key()));
        }
        String trimmed = value.trim();
        if (key.isNumeric()) {
            int parsed;
            try {
                parsed = Integer.parseInt(trimmed);
            } catch (NumberFormatException e) {
                throw AllocationException.validation("Configuration " + key.key() + " must be a number",
                        Map.of("key", key.key(), "value", trimmed));
            }
            if (parsed < key.min() || parsed > key.max()) {
                throw AllocationException.validation(
                        "Configuration " + key.key() + " must be between " + key.min() + " and " + key.max(),
                        Map.of("key", key.key(), "value", parsed, "min", key.min(), "max", key.max()));
            }
            return String.valueOf(parsed);
        }
        List<ReallocationScope> order = parseOrder(trimmed);
        if (order.isEmpty() || order.size() != StringUtils.split(trimmed, ',').length) {
            throw AllocationException.validation("Configuration " + key.key() + " has unknown scopes",
                    Map.of("key", key.key(), "value", trimmed));
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }
}
