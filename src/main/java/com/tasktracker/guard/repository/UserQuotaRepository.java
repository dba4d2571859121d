package com.tasktracker.guard.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.exp.Exp;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.tasktracker.guard.config.AerospikeConfig;
import com.tasktracker.guard.model.UserQuota;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Daily usage counters. Rollover, increment and the warning flag are single-record
 * atomic operations so parallel requests for one user cannot lose updates.
 */
@Repository
public class UserQuotaRepository {

    private static final Logger log = LoggerFactory.getLogger(UserQuotaRepository.class);

    private static final String BIN_USED = "used";
    private static final String BIN_WARNED = "warned";
    private static final String BIN_LAST_RESET = "lastReset";
    private static final String BIN_LAST_UPDATED = "lastUpdated";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public UserQuotaRepository(AerospikeClient client,
                               @Qualifier("aerospikeNamespace") String namespace,
                               @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                               @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public UserQuota findByUserId(long userId) {
        Record record = client.get(readPolicy, key(userId));
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<UserQuota> findAll() {
        List<UserQuota> quotas = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_USER_QUOTAS,
                (key, record) -> {
                    try {
                        UserQuota quota = mapRecord(record);
                        synchronized (quotas) {
                            quotas.add(quota);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize user quota: {}", e.getMessage());
                    }
                });
        quotas.sort(Comparator.comparingLong(UserQuota::getUserId));
        return quotas;
    }

    /**
     * Inserts the quota only if none exists yet. Returns false when another request created it first.
     */
    public boolean createIfAbsent(UserQuota quota) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        try {
            client.put(policy, key(quota.getUserId()),
                    new Bin("userId", quota.getUserId()),
                    new Bin("tierId", quota.getSubscriptionTierId()),
                    new Bin(BIN_USED, quota.getApiCallsUsedToday()),
                    new Bin("maxDaily", quota.getMaxDailyApiCalls()),
                    new Bin(BIN_LAST_RESET, quota.getLastResetTime()),
                    new Bin(BIN_LAST_UPDATED, quota.getLastUpdatedTime()),
                    new Bin("exempt", quota.isExemptFromQuota()),
                    new Bin(BIN_WARNED, quota.isHasReceivedQuotaWarning() ? 1 : 0),
                    new Bin("warnPct", quota.getQuotaWarningThresholdPercent()));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
    }

    /**
     * Zeroes the counter and clears the warning flag, but only while the stored counter
     * belongs to a day before {@code todayStart}. Returns true when this call did the reset.
     */
    public boolean resetIfStale(long userId, long todayStart, long now) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.filterExp = Exp.build(Exp.lt(Exp.intBin(BIN_LAST_RESET), Exp.val(todayStart)));
        policy.failOnFilteredOut = true;
        try {
            client.operate(policy, key(userId),
                    Operation.put(new Bin(BIN_USED, 0L)),
                    Operation.put(new Bin(BIN_WARNED, 0)),
                    Operation.put(new Bin(BIN_LAST_RESET, todayStart)),
                    Operation.put(new Bin(BIN_LAST_UPDATED, now)));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.FILTERED_OUT) {
                return false;
            }
            throw e;
        }
    }

    /**
     * Atomically adds {@code count} to today's usage and returns the new total.
     */
    public long addUsage(long userId, int count, long now) {
        Record record = client.operate(writePolicy, key(userId),
                Operation.add(new Bin(BIN_USED, count)),
                Operation.put(new Bin(BIN_LAST_UPDATED, now)),
                Operation.get(BIN_USED));
        return record.getLong(BIN_USED);
    }

    /**
     * Sets the warning flag if it is not set yet. Returns true only for the call that flipped it.
     */
    public boolean markQuotaWarning(long userId, long now) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.filterExp = Exp.build(Exp.eq(Exp.intBin(BIN_WARNED), Exp.val(0)));
        policy.failOnFilteredOut = true;
        try {
            client.operate(policy, key(userId),
                    Operation.put(new Bin(BIN_WARNED, 1)),
                    Operation.put(new Bin(BIN_LAST_UPDATED, now)));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.FILTERED_OUT) {
                return false;
            }
            throw e;
        }
    }

    /**
     * Unconditional reset, used by the operator endpoint.
     */
    public void resetUsage(long userId, long todayStart, long now) {
        client.operate(writePolicy, key(userId),
                Operation.put(new Bin(BIN_USED, 0L)),
                Operation.put(new Bin(BIN_WARNED, 0)),
                Operation.put(new Bin(BIN_LAST_RESET, todayStart)),
                Operation.put(new Bin(BIN_LAST_UPDATED, now)));
    }

    private Key key(long userId) {
        return new Key(namespace, AerospikeConfig.SET_USER_QUOTAS, userId);
    }

    private UserQuota mapRecord(Record record) {
        return UserQuota.builder()
                .userId(record.getLong("userId"))
                .subscriptionTierId(record.getLong("tierId"))
                .apiCallsUsedToday(record.getLong(BIN_USED))
                .maxDailyApiCalls(record.getInt("maxDaily"))
                .lastResetTime(record.getLong(BIN_LAST_RESET))
                .lastUpdatedTime(record.getLong(BIN_LAST_UPDATED))
                .exemptFromQuota(record.getBoolean("exempt"))
                .hasReceivedQuotaWarning(record.getInt(BIN_WARNED) == 1)
                .quotaWarningThresholdPercent(record.getInt("warnPct"))
                .build();
    }
}
