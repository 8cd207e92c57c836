package com.callexchange.fraud.risk.features;

import com.callexchange.fraud.domain.Account;
import com.callexchange.fraud.domain.Bid;
import com.callexchange.fraud.domain.Call;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Turns a call, bid or account into the feature bag consumed by the classifier and rule engine.
 * No I/O and no error path: missing fields fall back to neutral defaults.
 */
@Component
@RequiredArgsConstructor
public class FeatureExtractor {

    static final double DEFAULT_REPUTATION = 0.5;

    private final Clock clock;

    public CallFeatures extract(Call call) {
        ZonedDateTime start = utc(call.getStartTime());
        String from = call.getFromNumber();
        String to = call.getToNumber();
        String sourceCountry = FraudPatterns.countryOf(from);
        String destCountry = FraudPatterns.countryOf(to);
        boolean international = !sourceCountry.isEmpty() && !destCountry.isEmpty()
                && !sourceCountry.equals(destCountry);
        boolean hasCli = from != null && !from.isBlank();
        boolean cliValidated = hasCli && FraudPatterns.isValidPhoneFormat(from);

        return CallFeatures.builder()
                .duration(call.getDurationSeconds() != null && call.getDurationSeconds() > 0
                        ? Duration.ofSeconds(call.getDurationSeconds())
                        : Duration.ZERO)
                .callerReputation(cliValidated ? DEFAULT_REPUTATION : DEFAULT_REPUTATION / 2)
                .calleeReputation(DEFAULT_REPUTATION)
                .timeOfDay(start.getHour())
                .dayOfWeek(start.getDayOfWeek().getValue() % 7)
                .callFrequency(-1)
                .geographicRisk(geographicRisk(to, destCountry, international))
                .priceDeviation(0.0)
                .callType(call.getDirection() != null ? call.getDirection().name().toLowerCase() : "unknown")
                .sourceCountry(sourceCountry)
                .destCountry(destCountry)
                .fromAreaCode(FraudPatterns.areaCode(from))
                .toAreaCode(FraudPatterns.areaCode(to))
                .carrierReputation(DEFAULT_REPUTATION)
                .international(international)
                .hasCli(hasCli)
                .cliValidated(cliValidated)
                .build();
    }

    public BidFeatures extract(Bid bid, Account buyer) {
        ZonedDateTime placed = utc(bid.getPlacedAt());
        BigDecimal amount = bid.getAmount() != null ? bid.getAmount() : BigDecimal.ZERO;

        Duration timeToSubmit = Duration.ZERO;
        if (bid.getAuctionStartedAt() != null && bid.getPlacedAt() != null
                && !bid.getPlacedAt().isBefore(bid.getAuctionStartedAt())) {
            timeToSubmit = Duration.between(bid.getAuctionStartedAt(), bid.getPlacedAt());
        }

        double reputation = DEFAULT_REPUTATION;
        double priceDeviation = 0.0;
        Duration accountAge = Duration.ZERO;
        String accountType = "unknown";
        String accountStatus = "unknown";
        if (buyer != null) {
            reputation = clamp(buyer.getQualityScore() / 100.0);
            BigDecimal maxBid = buyer.getMaxBidAmount();
            if (maxBid != null && maxBid.signum() > 0) {
                priceDeviation = amount.subtract(maxBid)
                        .divide(maxBid, 4, RoundingMode.HALF_UP)
                        .doubleValue();
            }
            accountAge = age(buyer.getCreatedAt());
            if (buyer.getType() != null) accountType = buyer.getType().name().toLowerCase();
            if (buyer.getStatus() != null) accountStatus = buyer.getStatus().name().toLowerCase();
        }

        return BidFeatures.builder()
                .bidAmount(amount.doubleValue())
                .buyerReputation(reputation)
                .timeOfDay(placed.getHour())
                .dayOfWeek(placed.getDayOfWeek().getValue() % 7)
                .timeToSubmit(timeToSubmit)
                .priceDeviation(priceDeviation)
                .accountAge(accountAge)
                .accountType(accountType)
                .accountStatus(accountStatus)
                .suspiciousAmount(FraudPatterns.isSuspiciousBidAmount(amount))
                .roundAmount(FraudPatterns.isRoundAmount(amount))
                .build();
    }

    public AccountFeatures extract(Account account) {
        long daysSinceLogin = -1;
        if (account.getLastLoginAt() != null) {
            daysSinceLogin = Math.max(0, Duration.between(account.getLastLoginAt(), clock.instant()).toDays());
        }
        double compliance = (account.isTcpaConsent() ? 0.5 : 0.0) + (account.isGdprConsent() ? 0.5 : 0.0);

        return AccountFeatures.builder()
                .accountAge(age(account.getCreatedAt()))
                .daysSinceLastLogin(daysSinceLogin)
                .accountType(account.getType() != null ? account.getType().name().toLowerCase() : "unknown")
                .accountStatus(account.getStatus() != null ? account.getStatus().name().toLowerCase() : "unknown")
                .emailDomain(FraudPatterns.emailDomain(account.getEmail()))
                .disposableEmail(FraudPatterns.isDisposableEmail(account.getEmail()))
                .validPhone(FraudPatterns.isValidPhoneFormat(account.getPhoneNumber()))
                .phoneCountry(FraudPatterns.countryOf(account.getPhoneNumber()))
                .qualityScore(account.getQualityScore())
                .complianceScore(compliance)
                .balance(account.getBalance() != null ? account.getBalance().doubleValue() : 0.0)
                .build();
    }

    private static double geographicRisk(String destination, String destCountry, boolean international) {
        if (FraudPatterns.isHighRiskDestination(destination)) return 0.9;
        if (destCountry.isEmpty()) return 0.3;
        return international ? 0.4 : 0.1;
    }

    private ZonedDateTime utc(Instant instant) {
        return (instant != null ? instant : clock.instant()).atZone(ZoneOffset.UTC);
    }

    private Duration age(Instant createdAt) {
        if (createdAt == null) {
            return Duration.ZERO;
        }
        Duration age = Duration.between(createdAt, clock.instant());
        return age.isNegative() ? Duration.ZERO : age;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
