package io.recur4j.core;

public record ClientInfo(
        String id,
        String companyName,
        String firstName,
        String lastName,
        String billingAddressLine1
) {

    /**
     * Company name, else "first last", else null.
     */
    public String displayName() {
        if (companyName != null && !companyName.isBlank()) {
            return companyName;
        }
        String first = firstName == null ? "" : firstName;
        String last = lastName == null ? "" : lastName;
        String full = (first + " " + last).trim();
        return full.isEmpty() ? null : full;
    }
}
