package com.storescout.scan.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One normalized store location. {@code storeId} is the dedup key within a scan.
 * Only {@code latitude}, {@code longitude} and {@code url} may be null.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StoreRecord(
    String storeId,
    String name,
    String storeType,
    String streetAddress,
    String city,
    String state,
    String postalCode,
    String country,
    Double latitude,
    Double longitude,
    String phone,
    String url,
    String hoursMonday,
    String hoursTuesday,
    String hoursWednesday,
    String hoursThursday,
    String hoursFriday,
    String hoursSaturday,
    String hoursSunday,
    boolean closed,
    String scrapedAt
) {
    public StoreRecord {
        storeId = nullToEmpty(storeId);
        name = nullToEmpty(name);
        storeType = nullToEmpty(storeType);
        streetAddress = nullToEmpty(streetAddress);
        city = nullToEmpty(city);
        state = nullToEmpty(state);
        postalCode = nullToEmpty(postalCode);
        country = nullToEmpty(country);
        phone = nullToEmpty(phone);
        hoursMonday = nullToEmpty(hoursMonday);
        hoursTuesday = nullToEmpty(hoursTuesday);
        hoursWednesday = nullToEmpty(hoursWednesday);
        hoursThursday = nullToEmpty(hoursThursday);
        hoursFriday = nullToEmpty(hoursFriday);
        hoursSaturday = nullToEmpty(hoursSaturday);
        hoursSunday = nullToEmpty(hoursSunday);
        scrapedAt = nullToEmpty(scrapedAt);
    }

    public Map<String, Object> toFieldMap() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("store_id", storeId);
        fields.put("name", name);
        fields.put("store_type", storeType);
        fields.put("street_address", streetAddress);
        fields.put("city", city);
        fields.put("state", state);
        fields.put("postal_code", postalCode);
        fields.put("country", country);
        fields.put("latitude", latitude);
        fields.put("longitude", longitude);
        fields.put("phone", phone);
        fields.put("url", url);
        fields.put("hours_monday", hoursMonday);
        fields.put("hours_tuesday", hoursTuesday);
        fields.put("hours_wednesday", hoursWednesday);
        fields.put("hours_thursday", hoursThursday);
        fields.put("hours_friday", hoursFriday);
        fields.put("hours_saturday", hoursSaturday);
        fields.put("hours_sunday", hoursSunday);
        fields.put("closed", closed);
        fields.put("scraped_at", scrapedAt);
        return fields;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
