package com.storescout.scan.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed view over one raw search result. Optional fields are null when the provider omits them;
 * fields present with the wrong JSON shape raise {@link IllegalArgumentException}.
 * Results may arrive wrapped in a {@code data} object or bare.
 */
record ProviderStore(
    String id,
    String name,
    Address address,
    Coordinate geocodedCoordinate,
    Coordinate displayCoordinate,
    JsonNode hours,
    List<String> locatorFilters,
    String websiteUrl,
    String mainPhone,
    boolean closed
) {

    static ProviderStore from(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            throw new IllegalArgumentException("store payload is not a JSON object");
        }
        JsonNode data = raw.path("data").isObject() ? raw.get("data") : raw;

        JsonNode hours = data.get("hours");
        if (hours != null && !hours.isNull() && !hours.isObject()) {
            throw new IllegalArgumentException("hours is not an object");
        }
        return new ProviderStore(
            scalar(data, "id"),
            scalar(data, "name"),
            Address.from(data.get("address")),
            Coordinate.from(data.get("geocodedCoordinate")),
            Coordinate.from(data.get("yextDisplayCoordinate")),
            hours == null || hours.isNull() ? null : hours,
            stringList(data.get("c_locatorFilters")),
            website(data.get("websiteUrl")),
            scalar(data, "mainPhone"),
            data.path("closed").asBoolean(false)
        );
    }

    /**
     * First non-empty of geocoded, display, then address-embedded coordinate.
     */
    Coordinate coordinate() {
        if (geocodedCoordinate != null) {
            return geocodedCoordinate;
        }
        if (displayCoordinate != null) {
            return displayCoordinate;
        }
        return address.coordinate();
    }

    static String bestEffortId(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            return "unknown";
        }
        JsonNode wrapped = raw.path("data").path("id");
        if (wrapped.isValueNode() && !wrapped.asText().isBlank()) {
            return wrapped.asText();
        }
        JsonNode bare = raw.path("id");
        return bare.isValueNode() && !bare.asText().isBlank() ? bare.asText() : "unknown";
    }

    private static String scalar(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isValueNode()) {
            throw new IllegalArgumentException(field + " is not a scalar value");
        }
        return value.asText();
    }

    private static List<String> stringList(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("c_locatorFilters is not an array");
        }
        List<String> out = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isValueNode() && !item.isNull()) {
                out.add(item.asText());
            }
        }
        return out;
    }

    // Either a plain string or an object carrying a "url" field.
    private static String website(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String url = node.isObject() ? node.path("url").asText("") : node.isValueNode() ? node.asText() : "";
        url = url.trim();
        return url.isEmpty() ? null : url;
    }

    record Address(
        String line1,
        String city,
        String region,
        String postalCode,
        String countryCode,
        Coordinate coordinate
    ) {
        static final Address EMPTY = new Address(null, null, null, null, null, null);

        static Address from(JsonNode node) {
            if (node == null || node.isNull()) {
                return EMPTY;
            }
            if (!node.isObject()) {
                throw new IllegalArgumentException("address is not an object");
            }
            return new Address(
                scalar(node, "line1"),
                scalar(node, "city"),
                scalar(node, "region"),
                scalar(node, "postalCode"),
                scalar(node, "countryCode"),
                Coordinate.from(node.get("coordinate"))
            );
        }
    }

    record Coordinate(Double latitude, Double longitude) {

        /**
         * Null for a missing or empty object, so the next candidate source is tried.
         */
        static Coordinate from(JsonNode node) {
            if (node == null || node.isNull()) {
                return null;
            }
            if (!node.isObject()) {
                throw new IllegalArgumentException("coordinate is not an object");
            }
            if (node.isEmpty()) {
                return null;
            }
            return new Coordinate(number(node.get("latitude")), number(node.get("longitude")));
        }

        private static Double number(JsonNode value) {
            if (value == null || value.isNull()) {
                return null;
            }
            if (value.isNumber()) {
                return value.asDouble();
            }
            if (value.isTextual()) {
                try {
                    return Double.parseDouble(value.asText().trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("coordinate value is not numeric: " + value.asText(), e);
                }
            }
            throw new IllegalArgumentException("coordinate value is not numeric");
        }
    }
}
