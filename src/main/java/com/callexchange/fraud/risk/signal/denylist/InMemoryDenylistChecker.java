package com.callexchange.fraud.risk.signal.denylist;

import com.callexchange.fraud.risk.signal.DenylistChecker;
import com.callexchange.fraud.risk.signal.DenylistMatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Local denylist seeded from configuration. Stands in for the platform denylist service in
 * single-node deployments; entries can be added at runtime by operators.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "fraud.denylist.enabled", havingValue = "true", matchIfMissing = true)
public class InMemoryDenylistChecker implements DenylistChecker {

    private static final String CONFIGURED_REASON = "configured denylist entry";

    private final Map<String, String> entries = new ConcurrentHashMap<>();

    public InMemoryDenylistChecker(@Value("${fraud.denylist.phones:}") List<String> phones,
                                   @Value("${fraud.denylist.emails:}") List<String> emails) {
        phones.stream().filter(p -> !p.isBlank()).forEach(p -> add(p, "phone", CONFIGURED_REASON));
        emails.stream().filter(e -> !e.isBlank()).forEach(e -> add(e, "email", CONFIGURED_REASON));
        log.info("Denylist initialized with {} entries", entries.size());
    }

    @Override
    public DenylistMatch check(String identifier, String identifierKind) {
        if (identifier == null || identifier.isBlank()) {
            return DenylistMatch.clear();
        }
        String reason = entries.get(key(identifier, identifierKind));
        return reason != null ? DenylistMatch.listed(reason) : DenylistMatch.clear();
    }

    public void add(String identifier, String identifierKind, String reason) {
        entries.put(key(identifier, identifierKind), reason != null ? reason : CONFIGURED_REASON);
        log.debug("Denylisted {} {}", identifierKind, identifier);
    }

    public boolean remove(String identifier, String identifierKind) {
        return entries.remove(key(identifier, identifierKind)) != null;
    }

    private static String key(String identifier, String identifierKind) {
        return identifierKind.toLowerCase(Locale.ROOT) + ":" + identifier.trim().toLowerCase(Locale.ROOT);
    }
}
