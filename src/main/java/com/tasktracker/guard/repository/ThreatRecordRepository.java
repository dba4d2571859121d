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
import com.tasktracker.guard.model.ThreatRecord;
import com.tasktracker.guard.model.ThreatSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

@Repository
public class ThreatRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(ThreatRecordRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public ThreatRecordRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public ThreatRecord findById(String threatId) {
        Key key = new Key(namespace, AerospikeConfig.SET_THREAT_RECORDS, threatId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<ThreatRecord> findAllByIp(String ipAddress) {
        return scan(Exp.eq(Exp.stringBin("ip"), Exp.val(ipAddress)));
    }

    public ThreatRecord findByIpAndType(String ipAddress, String threatType) {
        List<ThreatRecord> matches = scan(Exp.and(
                Exp.eq(Exp.stringBin("ip"), Exp.val(ipAddress)),
                Exp.eq(Exp.stringBin("threatType"), Exp.val(threatType))));
        return matches.stream()
                .max(Comparator.comparingLong(ThreatRecord::getLastSeen))
                .orElse(null);
    }

    public List<ThreatRecord> findAll() {
        return scan(null);
    }

    public List<ThreatRecord> findActive() {
        return scan(Exp.eq(Exp.boolBin("active"), Exp.val(true)));
    }

    public List<ThreatRecord> findActiveByType(String threatType) {
        return scan(Exp.and(
                Exp.eq(Exp.boolBin("active"), Exp.val(true)),
                Exp.eq(Exp.stringBin("threatType"), Exp.val(threatType))));
    }

    public List<ThreatRecord> findActiveBySeverity(ThreatSeverity severity) {
        return scan(Exp.and(
                Exp.eq(Exp.boolBin("active"), Exp.val(true)),
                Exp.eq(Exp.stringBin("severity"), Exp.val(severity.name()))));
    }

    /**
     * Records last seen before {@code cutoff}, regardless of their list flags.
     */
    public List<ThreatRecord> findLastSeenBefore(long cutoff) {
        return scan(Exp.lt(Exp.intBin("lastSeen"), Exp.val(cutoff)));
    }

    public void save(ThreatRecord threat) {
        Key key = new Key(namespace, AerospikeConfig.SET_THREAT_RECORDS, threat.getThreatId());
        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("threatId", threat.getThreatId()),
                new Bin("ip", threat.getIpAddress()),
                new Bin("threatType", threat.getThreatType()),
                new Bin("severity", threat.getSeverity().name()),
                new Bin("confidence", threat.getConfidenceScore()),
                new Bin("firstSeen", threat.getFirstSeen()),
                new Bin("lastSeen", threat.getLastSeen()),
                new Bin("reportCount", threat.getReportCount()),
                new Bin("active", threat.isActive()),
                new Bin("whitelisted", threat.isWhitelisted()),
                new Bin("blacklisted", threat.isBlacklisted()),
                new Bin("createdAt", threat.getCreatedAt()),
                new Bin("updatedAt", threat.getUpdatedAt())));

        if (threat.getThreatSource() != null) {
            bins.add(new Bin("source", threat.getThreatSource()));
        }
        if (threat.getDescription() != null) {
            bins.add(new Bin("description", threat.getDescription()));
        }
        if (threat.getCountry() != null) {
            bins.add(new Bin("country", threat.getCountry()));
        }

        client.put(writePolicy, key, bins.toArray(new Bin[0]));
    }

    public boolean delete(String threatId) {
        Key key = new Key(namespace, AerospikeConfig.SET_THREAT_RECORDS, threatId);
        return client.delete(writePolicy, key);
    }

    public int deleteAll(Collection<String> threatIds) {
        int deleted = 0;
        for (String threatId : threatIds) {
            if (delete(threatId)) {
                deleted++;
            }
        }
        return deleted;
    }

    private List<ThreatRecord> scan(Exp filter) {
        List<ThreatRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;
        if (filter != null) {
            scanPolicy.filterExp = Exp.build(filter);
        }

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_THREAT_RECORDS,
                (key, record) -> {
                    try {
                        ThreatRecord mapped = mapRecord(record);
                        synchronized (results) {
                            results.add(mapped);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize threat record: {}", e.getMessage());
                    }
                });
        return results;
    }

    private ThreatRecord mapRecord(Record record) {
        return ThreatRecord.builder()
                .threatId(record.getString("threatId"))
                .ipAddress(record.getString("ip"))
                .threatType(record.getString("threatType"))
                .severity(ThreatSeverity.valueOf(record.getString("severity")))
                .threatSource(record.getString("source"))
                .description(record.getString("description"))
                .confidenceScore(record.getInt("confidence"))
                .firstSeen(record.getLong("firstSeen"))
                .lastSeen(record.getLong("lastSeen"))
                .reportCount(record.getInt("reportCount"))
                .active(record.getBoolean("active"))
                .whitelisted(record.getBoolean("whitelisted"))
                .blacklisted(record.getBoolean("blacklisted"))
                .country(record.getString("country"))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .build();
    }
}
