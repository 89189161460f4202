package com.storescout.scan.model;

public record GridPoint(double latitude, double longitude) {

    public String asQueryValue() {
        return latitude + "," + longitude;
    }

    @Override
    public String toString() {
        return "(" + latitude + ", " + longitude + ")";
    }
}
