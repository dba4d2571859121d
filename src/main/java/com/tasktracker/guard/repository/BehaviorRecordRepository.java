package com.tasktracker.guard.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.exp.Exp;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.tasktracker.guard.config.AerospikeConfig;
import com.tasktracker.guard.model.BehaviorRecord;
import com.tasktracker.guard.model.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Append-only behavior ledger. Records are keyed by recordId; every query is a
 * filtered scan over the set.
 */
@Repository
public class BehaviorRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(BehaviorRecordRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public BehaviorRecordRepository(AerospikeClient client,
                                    @Qualifier("aerospikeNamespace") String namespace,
                                    @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                    @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(BehaviorRecord rec) {
        Key key = new Key(namespace, AerospikeConfig.SET_BEHAVIOR_RECORDS, rec.getRecordId());
        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("recordId", rec.getRecordId()),
                new Bin("userId", rec.getUserId()),
                new Bin("ip", rec.getIpAddress()),
                new Bin("actionType", rec.getActionType()),
                new Bin("ts", rec.getTimestamp()),
                new Bin("sessionSecs", rec.getSessionDurationSeconds()),
                new Bin("apm", rec.getActionsPerMinute()),
                new Bin("dataVolume", rec.getDataVolumeAccessed()),
                new Bin("country", rec.getCountry()),
                new Bin("city", rec.getCity()),
                new Bin("deviceType", rec.getDeviceType()),
                new Bin("browser", rec.getBrowser()),
                new Bin("os", rec.getOperatingSystem()),
                new Bin("anomalous", rec.isAnomalous()),
                new Bin("score", rec.getAnomalyScore()),
                new Bin("riskLevel", rec.getRiskLevel() != null ? rec.getRiskLevel().name() : RiskLevel.LOW.name()),
                new Bin("newLocation", rec.isNewLocation()),
                new Bin("newDevice", rec.isNewDevice()),
                new Bin("offHours", rec.isOffHours()),
                new Bin("highVelocity", rec.isHighVelocity()),
                new Bin("deviation", rec.getDeviationFromBaseline()),
                new Bin("outsidePattern", rec.isOutsideNormalPattern()),
                new Bin("createdAt", rec.getCreatedAt())));

        if (rec.getUsername() != null) {
            bins.add(new Bin("username", rec.getUsername()));
        }
        if (rec.getUserAgent() != null) {
            bins.add(new Bin("userAgent", rec.getUserAgent()));
        }
        if (rec.getResourceAccessed() != null) {
            bins.add(new Bin("resource", rec.getResourceAccessed()));
        }
        if (rec.getAnomalyReason() != null) {
            bins.add(new Bin("reason", rec.getAnomalyReason()));
        }

        client.put(writePolicy, key, bins.toArray(new Bin[0]));
    }

    public BehaviorRecord findById(String recordId) {
        Key key = new Key(namespace, AerospikeConfig.SET_BEHAVIOR_RECORDS, recordId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Records of a user with {@code from <= timestamp < to}, oldest first.
     */
    public List<BehaviorRecord> findByUserIdBetween(long userId, long from, long to) {
        List<BehaviorRecord> results = scan(Exp.and(userIs(userId), tsAtLeast(from), tsBefore(to)));
        results.sort(Comparator.comparingLong(BehaviorRecord::getTimestamp));
        return results;
    }

    public List<BehaviorRecord> findByUserIdAndIpBetween(long userId, String ipAddress, long from, long to) {
        List<BehaviorRecord> results = scan(Exp.and(userIs(userId),
                Exp.eq(Exp.stringBin("ip"), Exp.val(ipAddress)),
                tsAtLeast(from), tsBefore(to)));
        results.sort(Comparator.comparingLong(BehaviorRecord::getTimestamp));
        return results;
    }

    public int countByUserIdBetween(long userId, long from, long to) {
        AtomicInteger count = new AtomicInteger();
        ScanPolicy scanPolicy = scanPolicy(Exp.and(userIs(userId), tsAtLeast(from), tsBefore(to)));
        scanPolicy.includeBinData = false;
        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_BEHAVIOR_RECORDS,
                (key, record) -> count.incrementAndGet());
        return count.get();
    }

    /**
     * The user's latest record strictly before {@code before}, or null.
     */
    public BehaviorRecord findLatestByUserIdBefore(long userId, long before) {
        return scan(Exp.and(userIs(userId), tsBefore(before))).stream()
                .max(Comparator.comparingLong(BehaviorRecord::getTimestamp))
                .orElse(null);
    }

    public boolean existsByUserIdAndLocation(long userId, String country, String city) {
        return exists(Exp.and(userIs(userId),
                Exp.eq(Exp.stringBin("country"), Exp.val(country)),
                Exp.eq(Exp.stringBin("city"), Exp.val(city))));
    }

    public boolean existsByUserIdAndDevice(long userId, String deviceType, String browser) {
        return exists(Exp.and(userIs(userId),
                Exp.eq(Exp.stringBin("deviceType"), Exp.val(deviceType)),
                Exp.eq(Exp.stringBin("browser"), Exp.val(browser))));
    }

    /**
     * Fleet-wide records with {@code from <= timestamp < to}, newest first.
     */
    public List<BehaviorRecord> findBetween(long from, long to) {
        List<BehaviorRecord> results = scan(Exp.and(tsAtLeast(from), tsBefore(to)));
        results.sort(Comparator.comparingLong(BehaviorRecord::getTimestamp).reversed());
        return results;
    }

    /**
     * Every record in the ledger, newest first. The ledger is bounded by retention cleanup.
     */
    public List<BehaviorRecord> findAll() {
        List<BehaviorRecord> results = scan(null);
        results.sort(Comparator.comparingLong(BehaviorRecord::getTimestamp).reversed());
        return results;
    }

    /**
     * Deletes every record with timestamp before {@code cutoff}. Returns the number removed.
     */
    public int deleteOlderThan(long cutoff) {
        List<Key> stale = new ArrayList<>();
        ScanPolicy scanPolicy = scanPolicy(tsBefore(cutoff));
        scanPolicy.includeBinData = false;
        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_BEHAVIOR_RECORDS,
                (key, record) -> {
                    synchronized (stale) {
                        stale.add(key);
                    }
                });

        int deleted = 0;
        for (Key key : stale) {
            if (client.delete(writePolicy, key)) {
                deleted++;
            }
        }
        log.debug("Deleted {} behavior records older than {}", deleted, cutoff);
        return deleted;
    }

    private boolean exists(Exp filter) {
        AtomicBoolean found = new AtomicBoolean(false);
        ScanPolicy scanPolicy = scanPolicy(filter);
        scanPolicy.includeBinData = false;
        scanPolicy.maxRecords = 1;
        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_BEHAVIOR_RECORDS,
                (key, record) -> found.set(true));
        return found.get();
    }

    private List<BehaviorRecord> scan(Exp filter) {
        List<BehaviorRecord> results = new ArrayList<>();
        client.scanAll(scanPolicy(filter), namespace, AerospikeConfig.SET_BEHAVIOR_RECORDS,
                (key, record) -> {
                    try {
                        BehaviorRecord mapped = mapRecord(record);
                        synchronized (results) {
                            results.add(mapped);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize behavior record: {}", e.getMessage());
                    }
                });
        return results;
    }

    private ScanPolicy scanPolicy(Exp filter) {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;
        if (filter != null) {
            scanPolicy.filterExp = Exp.build(filter);
        }
        return scanPolicy;
    }

    private static Exp userIs(long userId) {
        return Exp.eq(Exp.intBin("userId"), Exp.val(userId));
    }

    private static Exp tsAtLeast(long from) {
        return Exp.ge(Exp.intBin("ts"), Exp.val(from));
    }

    private static Exp tsBefore(long to) {
        return Exp.lt(Exp.intBin("ts"), Exp.val(to));
    }

    private BehaviorRecord mapRecord(Record record) {
        String riskLevel = record.getString("riskLevel");
        return BehaviorRecord.builder()
                .recordId(record.getString("recordId"))
                .userId(record.getLong("userId"))
                .username(record.getString("username"))
                .ipAddress(record.getString("ip"))
                .userAgent(record.getString("userAgent"))
                .actionType(record.getString("actionType"))
                .resourceAccessed(record.getString("resource"))
                .timestamp(record.getLong("ts"))
                .sessionDurationSeconds(record.getLong("sessionSecs"))
                .actionsPerMinute(record.getInt("apm"))
                .dataVolumeAccessed(record.getLong("dataVolume"))
                .country(record.getString("country"))
                .city(record.getString("city"))
                .deviceType(record.getString("deviceType"))
                .browser(record.getString("browser"))
                .operatingSystem(record.getString("os"))
                .anomalous(record.getBoolean("anomalous"))
                .anomalyScore(record.getDouble("score"))
                .riskLevel(riskLevel != null ? RiskLevel.valueOf(riskLevel) : RiskLevel.LOW)
                .anomalyReason(record.getString("reason"))
                .newLocation(record.getBoolean("newLocation"))
                .newDevice(record.getBoolean("newDevice"))
                .offHours(record.getBoolean("offHours"))
                .highVelocity(record.getBoolean("highVelocity"))
                .deviationFromBaseline(record.getDouble("deviation"))
                .outsideNormalPattern(record.getBoolean("outsidePattern"))
                .createdAt(record.getLong("createdAt"))
                .build();
    }
}
