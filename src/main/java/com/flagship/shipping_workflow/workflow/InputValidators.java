package com.flagship.shipping_workflow.workflow;

import java.math.BigDecimal;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validation and normalization rules for user-typed shipment data.
 *
 * US-only: states are two-letter USPS codes, phones are NANP numbers.
 */
public final class InputValidators {

    private static final Set<String> US_STATES = Set.of(
        "AL", "AK", "AZ", "AR", "CA", "CO", "CT", "DE", "FL", "GA",
        "HI", "ID", "IL", "IN", "IA", "KS", "KY", "LA", "ME", "MD",
        "MA", "MI", "MN", "MS", "MO", "MT", "NE", "NV", "NH", "NJ",
        "NM", "NY", "NC", "ND", "OH", "OK", "OR", "PA", "RI", "SC",
        "SD", "TN", "TX", "UT", "VT", "VA", "WA", "WV", "WI", "WY",
        "DC", "PR", "VI", "GU", "AS", "MP"
    );

    private static final Pattern CYRILLIC = Pattern.compile("[\\u0400-\\u04FF]");
    private static final Pattern NAME_CHARS = Pattern.compile("[A-Za-z\\s.'-]+");
    private static final Pattern ADDRESS_CHARS = Pattern.compile("[A-Za-z0-9 .,#&/-]+");
    private static final Pattern CITY_CHARS = Pattern.compile("[A-Za-z\\s'-]+");
    private static final Pattern ZIP = Pattern.compile("^\\d{5}(-\\d{4})?$");

    private static final BigDecimal MIN_WEIGHT = new BigDecimal("0.1");
    private static final BigDecimal MAX_WEIGHT = new BigDecimal("150");
    private static final BigDecimal MIN_DIMENSION = new BigDecimal("0.1");
    private static final BigDecimal MAX_DIMENSION = new BigDecimal("108");

    private InputValidators() {
        // Utility class
    }

    public static ValidationResult name(String raw) {
        String name = trim(raw);
        if (CYRILLIC.matcher(name).find()) {
            return ValidationResult.error("Use Latin letters only, for example: John Smith");
        }
        if (name.length() < 2) {
            return ValidationResult.error("Name is too short, enter at least 2 characters");
        }
        if (name.length() > 50) {
            return ValidationResult.error("Name is too long, 50 characters maximum");
        }
        if (!NAME_CHARS.matcher(name).matches()) {
            return ValidationResult.error("Only letters, spaces, dots, hyphens and apostrophes are allowed");
        }
        return ValidationResult.ok(name);
    }

    public static ValidationResult address(String raw) {
        String address = trim(raw);
        if (CYRILLIC.matcher(address).find()) {
            return ValidationResult.error("Address: use Latin letters only");
        }
        if (address.length() < 3) {
            return ValidationResult.error("Address is too short, enter at least 3 characters");
        }
        if (address.length() > 100) {
            return ValidationResult.error("Address is too long, 100 characters maximum");
        }
        if (!ADDRESS_CHARS.matcher(address).matches()) {
            return ValidationResult.error("Address: only Latin letters, digits and . , - # & / are allowed");
        }
        return ValidationResult.ok(address);
    }

    public static ValidationResult city(String raw) {
        String city = trim(raw);
        if (CYRILLIC.matcher(city).find()) {
            return ValidationResult.error("Use Latin letters only, for example: New York");
        }
        if (city.length() < 2) {
            return ValidationResult.error("City name is too short");
        }
        if (city.length() > 50) {
            return ValidationResult.error("City name is too long, 50 characters maximum");
        }
        if (!CITY_CHARS.matcher(city).matches()) {
            return ValidationResult.error("Only letters, spaces, hyphens and apostrophes are allowed");
        }
        return ValidationResult.ok(city);
    }

    public static ValidationResult state(String raw) {
        String state = trim(raw).toUpperCase();
        if (state.length() != 2) {
            return ValidationResult.error("Enter a 2-letter state code (for example CA, NY, TX)");
        }
        if (!state.chars().allMatch(Character::isLetter)) {
            return ValidationResult.error("State code must contain letters only");
        }
        if (!US_STATES.contains(state)) {
            return ValidationResult.error("Unknown state code: " + state);
        }
        return ValidationResult.ok(state);
    }

    public static ValidationResult zip(String raw) {
        String zip = trim(raw);
        if (!ZIP.matcher(zip).matches()) {
            return ValidationResult.error("Invalid ZIP format, enter 5 digits (for example 12345)");
        }
        return ValidationResult.ok(zip);
    }

    /**
     * Accepts 10 digits, or 11 digits, and normalizes to E.164.
     */
    public static ValidationResult phone(String raw) {
        String phone = trim(raw);
        if (phone.isEmpty() || !(Character.isDigit(phone.charAt(0)) || phone.charAt(0) == '+')) {
            return ValidationResult.error("Phone number must start with + or a digit");
        }
        String digits = phone.replaceAll("\\D", "");
        if (digits.length() < 10 || digits.length() > 11) {
            return ValidationResult.error("Enter 10 digits (for example 2125551234)");
        }
        String formatted = digits.length() == 10 ? "+1" + digits : "+" + digits;
        return ValidationResult.ok(formatted);
    }

    public static ValidationResult weight(String raw) {
        return boundedNumber(raw, MIN_WEIGHT, MAX_WEIGHT, "Weight", "lb");
    }

    public static ValidationResult dimension(String raw) {
        return boundedNumber(raw, MIN_DIMENSION, MAX_DIMENSION, "Dimension", "in");
    }

    private static ValidationResult boundedNumber(String raw, BigDecimal min, BigDecimal max,
                                                  String label, String unit) {
        BigDecimal value;
        try {
            value = new BigDecimal(trim(raw).replace(',', '.'));
        } catch (NumberFormatException e) {
            return ValidationResult.error("Enter a number (for example 5 or 5.5)");
        }
        if (value.signum() <= 0) {
            return ValidationResult.error(label + " must be greater than 0");
        }
        if (value.compareTo(min) < 0) {
            return ValidationResult.error(label + " minimum is " + min.toPlainString() + " " + unit);
        }
        if (value.compareTo(max) > 0) {
            return ValidationResult.error(label + " maximum is " + max.toPlainString() + " " + unit);
        }
        return ValidationResult.ok(value.stripTrailingZeros().toPlainString());
    }

    private static String trim(String raw) {
        return raw == null ? "" : raw.strip();
    }
}
