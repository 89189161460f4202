package com.storescout.scan.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.storescout.config.RetailerProperties;
import com.storescout.scan.model.StoreRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps one raw search result into a {@link StoreRecord}. Records that cannot be read are skipped
 * with a warning; siblings in the same response are unaffected.
 */
@Component
public class StoreNormalizer {
    private static final Logger log = LoggerFactory.getLogger(StoreNormalizer.class);

    static final List<String> WEEKDAYS = List.of(
        "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday"
    );
    static final String UNKNOWN_STORE_TYPE = "unknown";

    private static final Pattern CLOCK_TIME = Pattern.compile("^(\\d{1,2}):(\\d{2})$");

    private final Clock clock;

    public StoreNormalizer(Clock clock) {
        this.clock = clock;
    }

    public Optional<StoreRecord> normalize(String retailer, JsonNode raw, RetailerProperties retailerProperties) {
        try {
            ProviderStore store = ProviderStore.from(raw);
            ProviderStore.Address address = store.address();
            ProviderStore.Coordinate coordinate = store.coordinate();
            String storeId = store.id() == null ? "" : store.id();
            JsonNode hours = store.hours();

            return Optional.of(new StoreRecord(
                storeId,
                store.name(),
                categorize(store.locatorFilters(), retailerProperties.getStoreTypes()),
                address.line1(),
                address.city(),
                address.region(),
                address.postalCode(),
                address.countryCode() == null || address.countryCode().isBlank()
                    ? retailerProperties.getDefaultCountry()
                    : address.countryCode(),
                coordinate == null ? null : inRange(retailer, storeId, "latitude", coordinate.latitude(), 90.0),
                coordinate == null ? null : inRange(retailer, storeId, "longitude", coordinate.longitude(), 180.0),
                store.mainPhone(),
                store.websiteUrl(),
                formatHours(hours, WEEKDAYS.get(0)),
                formatHours(hours, WEEKDAYS.get(1)),
                formatHours(hours, WEEKDAYS.get(2)),
                formatHours(hours, WEEKDAYS.get(3)),
                formatHours(hours, WEEKDAYS.get(4)),
                formatHours(hours, WEEKDAYS.get(5)),
                formatHours(hours, WEEKDAYS.get(6)),
                store.closed(),
                Instant.now(clock).toString()
            ));
        } catch (RuntimeException e) {
            log.warn("[{}] Failed to parse store {}: {}", retailer, ProviderStore.bestEffortId(raw), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * First tag found in the lookup table wins; otherwise the first tag, lowercased with spaces
     * replaced by underscores; {@code "unknown"} when there are no tags.
     */
    public static String categorize(List<String> locatorFilters, Map<String, String> storeTypes) {
        if (locatorFilters == null || locatorFilters.isEmpty()) {
            return UNKNOWN_STORE_TYPE;
        }
        if (storeTypes != null) {
            for (String tag : locatorFilters) {
                String mapped = storeTypes.get(tag);
                if (mapped != null) {
                    return mapped;
                }
            }
        }
        return locatorFilters.get(0).toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    /**
     * {@code "HH:MM-HH:MM"} from the day's first open interval, or {@code ""} when any piece is missing.
     */
    public static String formatHours(JsonNode hours, String day) {
        if (hours == null || !hours.isObject()) {
            return "";
        }
        JsonNode dayHours = hours.get(day);
        if (dayHours == null || !dayHours.isObject()) {
            return "";
        }
        JsonNode intervals = dayHours.path("openIntervals");
        if (!intervals.isArray() || intervals.isEmpty()) {
            return "";
        }
        JsonNode first = intervals.get(0);
        String start = clockTime(first.path("start").asText(""));
        String end = clockTime(first.path("end").asText(""));
        if (start.isEmpty() || end.isEmpty()) {
            return "";
        }
        return start + "-" + end;
    }

    private static String clockTime(String value) {
        Matcher matcher = CLOCK_TIME.matcher(value.trim());
        if (!matcher.matches()) {
            return "";
        }
        int hour = Integer.parseInt(matcher.group(1));
        int minute = Integer.parseInt(matcher.group(2));
        if (hour > 24 || minute > 59) {
            return "";
        }
        return String.format(Locale.ROOT, "%02d:%02d", hour, minute);
    }

    private Double inRange(String retailer, String storeId, String field, Double value, double limit) {
        if (value == null) {
            return null;
        }
        if (!Double.isFinite(value) || value < -limit || value > limit) {
            log.warn("[{}] Dropping out-of-range {} {} for store {}", retailer, field, value, storeId);
            return null;
        }
        return value;
    }
}
