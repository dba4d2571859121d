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
import com.tasktracker.guard.model.RateLimitRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class RateLimitRuleRepository {

    private static final Logger log = LoggerFactory.getLogger(RateLimitRuleRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public RateLimitRuleRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                   @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public RateLimitRule findById(String ruleId) {
        Key key = new Key(namespace, AerospikeConfig.SET_RATE_LIMIT_RULES, ruleId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Rules of a tier, highest matchPriority first. Ties keep ruleId order so lookups are stable.
     */
    public List<RateLimitRule> findByTierIdOrderByPriorityDesc(long tierId) {
        List<RateLimitRule> rules = scan(Exp.eq(Exp.intBin("tierId"), Exp.val(tierId)));
        rules.sort(Comparator.comparingInt(RateLimitRule::getMatchPriority).reversed()
                .thenComparing(RateLimitRule::getRuleId, Comparator.nullsLast(Comparator.naturalOrder())));
        return rules;
    }

    public List<RateLimitRule> findAll() {
        return scan(null);
    }

    public void save(RateLimitRule rule) {
        Key key = new Key(namespace, AerospikeConfig.SET_RATE_LIMIT_RULES, rule.getRuleId());
        client.put(writePolicy, key,
                new Bin("ruleId", rule.getRuleId()),
                new Bin("tierId", rule.getSubscriptionTierId()),
                new Bin("pattern", rule.getEndpointPattern()),
                new Bin("rateLimit", rule.getRateLimit()),
                new Bin("windowSecs", rule.getTimeWindowSeconds()),
                new Bin("priority", rule.getMatchPriority()));
    }

    private List<RateLimitRule> scan(Exp filter) {
        List<RateLimitRule> rules = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;
        if (filter != null) {
            scanPolicy.filterExp = Exp.build(filter);
        }

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_RATE_LIMIT_RULES,
                (key, record) -> {
                    try {
                        RateLimitRule rule = mapRecord(record);
                        synchronized (rules) {
                            rules.add(rule);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize rate limit rule: {}", e.getMessage());
                    }
                });
        return rules;
    }

    private RateLimitRule mapRecord(Record record) {
        return RateLimitRule.builder()
                .ruleId(record.getString("ruleId"))
                .subscriptionTierId(record.getLong("tierId"))
                .endpointPattern(record.getString("pattern"))
                .rateLimit(record.getInt("rateLimit"))
                .timeWindowSeconds(record.getInt("windowSecs"))
                .matchPriority(record.getInt("priority"))
                .build();
    }
}
