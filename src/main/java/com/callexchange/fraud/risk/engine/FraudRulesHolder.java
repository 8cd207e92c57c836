package com.callexchange.fraud.risk.engine;

import com.callexchange.fraud.risk.domain.FraudRules;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-wide live {@link FraudRules}. Replacement is a whole-object swap under the write lock;
 * an evaluation reads one snapshot and keeps using it even if a swap happens meanwhile.
 * The lock is not shared with the risk score cache.
 */
@Slf4j
public class FraudRulesHolder {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private FraudRules rules;

    public FraudRulesHolder(FraudRules initial) {
        this.rules = Objects.requireNonNull(initial, "initial rules");
    }

    public FraudRules current() {
        lock.readLock().lock();
        try {
            return rules;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void replace(FraudRules next) {
        Objects.requireNonNull(next, "rules");
        FraudRules previous;
        lock.writeLock().lock();
        try {
            previous = rules;
            rules = next;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Fraud rules replaced: version {} -> {}, mfa={}, autoBlock={}, ml={}, rules={}",
                previous.getVersion(), next.getVersion(), next.getRequireMfaScore(), next.getAutoBlockScore(),
                next.isMlEnabled(), next.isRulesEnabled());
    }
}
