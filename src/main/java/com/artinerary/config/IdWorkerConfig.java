package com.artinerary.config;

import com.baomidou.mybatisplus.core.incrementer.DefaultIdentifierGenerator;
import com.baomidou.mybatisplus.core.incrementer.IdentifierGenerator;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Snowflake worker/datacenter ids for {@code IdType.ASSIGN_ID}.
 *
 * <p>If {@code artinerary.id.worker-id} is not set, the trailing number of
 * {@code artinerary.instance-id} (e.g. {@code engage-3}) minus one is used.</p>
 */
@Configuration
public class IdWorkerConfig {
    private static final Logger log = LoggerFactory.getLogger(IdWorkerConfig.class);
    private static final Pattern LAST_NUMBER = Pattern.compile("(\\d+)(?!.*\\d)");

    private final long datacenterId;
    private final long workerId;
    private final String instanceId;

    public IdWorkerConfig(
            @Value("${artinerary.id.datacenter-id:1}") long datacenterId,
            @Value("${artinerary.id.worker-id:-1}") long workerId,
            @Value("${artinerary.instance-id:}") String instanceId
    ) {
        this.datacenterId = datacenterId;
        this.workerId = workerId;
        this.instanceId = instanceId;
    }

    @PostConstruct
    public void init() {
        long[] resolved = resolveIds();
        if (resolved == null) {
            log.info("IdWorker: keep default (no artinerary.id.worker-id and no numeric instance-id)");
            return;
        }
        IdWorker.initSequence(resolved[0], resolved[1]);
        log.info("IdWorker: initSequence(workerId={}, datacenterId={}, instanceId={})", resolved[0], resolved[1], instanceId);
    }

    @Bean
    public IdentifierGenerator identifierGenerator() {
        long[] resolved = resolveIds();
        if (resolved == null) {
            return DefaultIdentifierGenerator.getInstance();
        }
        return new DefaultIdentifierGenerator(resolved[0], resolved[1]);
    }

    long[] resolveIds() {
        long dc = normalize5Bits(datacenterId);
        long wid = workerId;
        if (wid < 0) {
            wid = parseWorkerIdFromInstanceId(instanceId);
        }
        if (wid < 0) {
            return null;
        }
        return new long[]{normalize5Bits(wid), dc};
    }

    private static long parseWorkerIdFromInstanceId(String instanceId) {
        if (instanceId == null || instanceId.isBlank()) {
            return -1;
        }
        Matcher matcher = LAST_NUMBER.matcher(instanceId);
        if (!matcher.find()) {
            return -1;
        }
        try {
            return Long.parseLong(matcher.group(1)) - 1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static long normalize5Bits(long v) {
        long x = v % 32;
        return x < 0 ? x + 32 : x;
    }
}
