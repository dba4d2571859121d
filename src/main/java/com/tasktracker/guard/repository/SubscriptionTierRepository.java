package com.tasktracker.guard.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.tasktracker.guard.config.AerospikeConfig;
import com.tasktracker.guard.model.SubscriptionTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class SubscriptionTierRepository {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionTierRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public SubscriptionTierRepository(AerospikeClient client,
                                      @Qualifier("aerospikeNamespace") String namespace,
                                      @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                      @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public SubscriptionTier findById(long tierId) {
        Key key = new Key(namespace, AerospikeConfig.SET_SUBSCRIPTION_TIERS, tierId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Case-insensitive name lookup. When several tiers share a name the lowest id wins.
     */
    public SubscriptionTier findByName(String name) {
        return findAll().stream()
                .filter(tier -> name.equalsIgnoreCase(tier.getName()))
                .findFirst()
                .orElse(null);
    }

    public List<SubscriptionTier> findAll() {
        List<SubscriptionTier> tiers = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_SUBSCRIPTION_TIERS,
                (key, record) -> {
                    try {
                        SubscriptionTier tier = mapRecord(record);
                        synchronized (tiers) {
                            tiers.add(tier);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize subscription tier: {}", e.getMessage());
                    }
                });
        tiers.sort(Comparator.comparingLong(SubscriptionTier::getId));
        return tiers;
    }

    public void save(SubscriptionTier tier) {
        Key key = new Key(namespace, AerospikeConfig.SET_SUBSCRIPTION_TIERS, tier.getId());
        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("id", tier.getId()),
                new Bin("name", tier.getName()),
                new Bin("systemTier", tier.isSystemTier()),
                new Bin("bypassLimits", tier.isBypassStandardRateLimits()),
                new Bin("dailyQuota", tier.getDailyApiQuota()),
                new Bin("defaultLimit", tier.getDefaultRateLimit()),
                new Bin("defaultWindow", tier.getDefaultTimeWindowSeconds())));
        if (tier.getDescription() != null) {
            bins.add(new Bin("description", tier.getDescription()));
        }
        client.put(writePolicy, key, bins.toArray(new Bin[0]));
    }

    private SubscriptionTier mapRecord(Record record) {
        return SubscriptionTier.builder()
                .id(record.getLong("id"))
                .name(record.getString("name"))
                .systemTier(record.getBoolean("systemTier"))
                .bypassStandardRateLimits(record.getBoolean("bypassLimits"))
                .dailyApiQuota(record.getInt("dailyQuota"))
                .defaultRateLimit(record.getInt("defaultLimit"))
                .defaultTimeWindowSeconds(record.getInt("defaultWindow"))
                .description(record.getString("description"))
                .build();
    }
}
