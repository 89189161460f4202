package com.storescout.scan.validation;

import com.storescout.config.StoreScoutProperties;
import com.storescout.scan.model.ValidationResult;
import com.storescout.scan.model.ValidationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Post-scan quality report over plain store field maps. Never mutates its input.
 */
@Component
public class StoreValidator {
    private static final Logger log = LoggerFactory.getLogger(StoreValidator.class);

    public static final List<String> REQUIRED_FIELDS = List.of("store_id", "name", "street_address", "city", "state");
    public static final List<String> RECOMMENDED_FIELDS = List.of("latitude", "longitude", "phone", "url");

    private static final double LAT_LIMIT = 90.0;
    private static final double LNG_LIMIT = 180.0;
    private static final int ZIP_LENGTH_SHORT = 5;
    private static final int ZIP_LENGTH_LONG = 10;

    private final StoreScoutProperties properties;

    public StoreValidator(StoreScoutProperties properties) {
        this.properties = properties;
    }

    public ValidationResult validate(Map<String, Object> store, boolean strict) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (String field : REQUIRED_FIELDS) {
            if (isBlank(store.get(field))) {
                errors.add("Missing required field: " + field);
            }
        }
        for (String field : RECOMMENDED_FIELDS) {
            if (isBlank(store.get(field))) {
                if (strict) {
                    errors.add("Missing recommended field: " + field);
                } else {
                    warnings.add("Missing recommended field: " + field);
                }
            }
        }

        Object lat = store.get("latitude");
        Object lng = store.get("longitude");
        if (!isBlank(lat) && !isBlank(lng)) {
            try {
                double latValue = Double.parseDouble(lat.toString().trim());
                double lngValue = Double.parseDouble(lng.toString().trim());
                if (!(latValue >= -LAT_LIMIT && latValue <= LAT_LIMIT)) {
                    errors.add("Invalid latitude: " + lat + " (must be between " + -LAT_LIMIT + " and " + LAT_LIMIT + ")");
                }
                if (!(lngValue >= -LNG_LIMIT && lngValue <= LNG_LIMIT)) {
                    errors.add("Invalid longitude: " + lng + " (must be between " + -LNG_LIMIT + " and " + LNG_LIMIT + ")");
                }
            } catch (NumberFormatException e) {
                errors.add("Invalid coordinate format: lat=" + lat + ", lng=" + lng);
            }
        }

        Object postalCode = store.get("postal_code") != null ? store.get("postal_code") : store.get("zip");
        if (!isBlank(postalCode)) {
            int length = postalCode.toString().trim().length();
            if (length != ZIP_LENGTH_SHORT && length != ZIP_LENGTH_LONG) {
                warnings.add("Unusual postal code format: " + postalCode);
            }
        }

        return new ValidationResult(errors.isEmpty(), List.copyOf(errors), List.copyOf(warnings));
    }

    public ValidationSummary validateBatch(List<Map<String, Object>> stores, boolean strict, boolean logIssues) {
        int valid = 0;
        List<String> invalidIds = new ArrayList<>();
        List<String> allErrors = new ArrayList<>();
        int warningCount = 0;
        List<ValidationResult> results = new ArrayList<>(stores.size());

        for (int i = 0; i < stores.size(); i++) {
            Map<String, Object> store = stores.get(i);
            ValidationResult result = validate(store, strict);
            results.add(result);
            if (result.valid()) {
                valid++;
            } else {
                String storeId = isBlank(store.get("store_id")) ? "index_" + i : store.get("store_id").toString();
                invalidIds.add(storeId);
                for (String error : result.errors()) {
                    allErrors.add("Store " + storeId + ": " + error);
                }
            }
            warningCount += result.warnings().size();
        }

        if (logIssues && !allErrors.isEmpty()) {
            int limit = properties.getValidation().getErrorLogLimit();
            allErrors.stream().limit(limit).forEach(log::warn);
            if (allErrors.size() > limit) {
                log.warn("... and {} more validation errors", allErrors.size() - limit);
            }
        }

        return new ValidationSummary(
            stores.size(),
            valid,
            stores.size() - valid,
            List.copyOf(invalidIds),
            allErrors.size(),
            warningCount,
            List.copyOf(results)
        );
    }

    private static boolean isBlank(Object value) {
        return value == null || (value instanceof String text && text.isBlank());
    }
}
