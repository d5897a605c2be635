package io.recur4j.core;

public record PropertyInfo(
        String id,
        String addressLine1,
        String city,
        String state,
        String zip
) {

    public String formattedAddress() {
        return addressLine1 + ", " + city + ", " + state + " " + zip;
    }
}
