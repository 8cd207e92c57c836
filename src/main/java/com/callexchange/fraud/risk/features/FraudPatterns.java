package com.callexchange.fraud.risk.features;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Static heuristics for what a throwaway account, a probing bid or a risky destination looks like.
 * Shared by the feature extractor and the built-in account/bid checks.
 */
public final class FraudPatterns {

    static final List<String> DISPOSABLE_EMAIL_DOMAINS = List.of(
            "tempmail.com",
            "guerrillamail.com",
            "mailinator.com",
            "10minutemail.com",
            "throwaway.email");

    /** Amounts fraudsters use to probe whether a buyer account works. */
    static final List<BigDecimal> TEST_AMOUNTS = List.of(
            new BigDecimal("1.00"),
            new BigDecimal("0.01"),
            new BigDecimal("9.99"),
            new BigDecimal("99.99"),
            new BigDecimal("100.00"),
            new BigDecimal("1000.00"));

    /** Dialing prefix to ISO country; longest prefix wins. */
    private static final Map<String, String> COUNTRY_PREFIXES = Map.ofEntries(
            Map.entry("+1", "US"),
            Map.entry("+7", "RU"),
            Map.entry("+33", "FR"),
            Map.entry("+44", "GB"),
            Map.entry("+49", "DE"),
            Map.entry("+52", "MX"),
            Map.entry("+61", "AU"),
            Map.entry("+62", "ID"),
            Map.entry("+63", "PH"),
            Map.entry("+86", "CN"),
            Map.entry("+91", "IN"),
            Map.entry("+92", "PK"),
            Map.entry("+216", "TN"),
            Map.entry("+233", "GH"),
            Map.entry("+234", "NG"),
            Map.entry("+252", "SO"),
            Map.entry("+370", "LT"),
            Map.entry("+371", "LV"),
            Map.entry("+675", "PG"),
            Map.entry("+677", "SB"),
            Map.entry("+678", "VU"),
            Map.entry("+870", "XS"),
            Map.entry("+881", "XS"),
            Map.entry("+882", "XN"),
            Map.entry("+883", "XN"),
            Map.entry("+960", "MV"));

    /** Destinations commonly abused for international revenue share fraud. */
    private static final Set<String> HIGH_RISK_PREFIXES = Set.of(
            "+216", "+252", "+370", "+371", "+675", "+677", "+678", "+870", "+881", "+882", "+883", "+960");

    private FraudPatterns() {
    }

    public static boolean isDisposableEmail(String email) {
        if (email == null || email.isBlank()) {
            return false;
        }
        String lower = email.toLowerCase(Locale.ROOT);
        for (String domain : DISPOSABLE_EMAIL_DOMAINS) {
            if (lower.contains(domain)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A phone number is structurally valid when it starts with '+' and carries 10 to 15 digits.
     */
    public static boolean isValidPhoneFormat(String phone) {
        if (phone == null || !phone.startsWith("+")) {
            return false;
        }
        int digits = 0;
        for (char ch : phone.substring(1).toCharArray()) {
            if (ch >= '0' && ch <= '9') {
                digits++;
            }
        }
        return digits >= 10 && digits <= 15;
    }

    /**
     * Known probing amounts, or repeated-digit cents such as 11.11 or 7.77.
     */
    public static boolean isSuspiciousBidAmount(BigDecimal amount) {
        if (amount == null) {
            return false;
        }
        for (BigDecimal test : TEST_AMOUNTS) {
            if (amount.compareTo(test) == 0) {
                return true;
            }
        }
        int cents = amount.abs()
                .remainder(BigDecimal.ONE)
                .movePointRight(2)
                .setScale(0, RoundingMode.DOWN)
                .intValue();
        return cents > 0 && cents % 11 == 0;
    }

    public static boolean isRoundAmount(BigDecimal amount) {
        return amount != null
                && amount.signum() > 0
                && amount.stripTrailingZeros().scale() <= 0;
    }

    public static String emailDomain(String email) {
        if (email == null) {
            return "";
        }
        int at = email.lastIndexOf('@');
        return at >= 0 ? email.substring(at + 1).toLowerCase(Locale.ROOT) : "";
    }

    /** ISO country for an E.164 number, empty when unknown. */
    public static String countryOf(String phone) {
        String prefix = matchingPrefix(phone, COUNTRY_PREFIXES.keySet());
        return prefix != null ? COUNTRY_PREFIXES.get(prefix) : "";
    }

    public static boolean isHighRiskDestination(String phone) {
        return matchingPrefix(phone, HIGH_RISK_PREFIXES) != null;
    }

    /** NANP area code for +1 numbers, empty otherwise. */
    public static String areaCode(String phone) {
        if (phone != null && phone.startsWith("+1") && phone.length() >= 12) {
            return phone.substring(2, 5);
        }
        return "";
    }

    private static String matchingPrefix(String phone, Set<String> prefixes) {
        if (phone == null || !phone.startsWith("+")) {
            return null;
        }
        String best = null;
        for (String prefix : prefixes) {
            if (phone.startsWith(prefix) && (best == null || prefix.length() > best.length())) {
                best = prefix;
            }
        }
        return best;
    }
}
