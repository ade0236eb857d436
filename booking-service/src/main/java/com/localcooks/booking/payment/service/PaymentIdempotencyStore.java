package com.localcooks.booking.payment.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.localcooks.booking.payment.model.PaymentOperation;
import com.localcooks.booking.payment.model.PaymentOperationRecord;
import com.localcooks.booking.payment.repository.PaymentOperationRecordRepository;
import com.localcooks.common.exception.ServiceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Results of completed payment operations, keyed by idempotency key.
 * The {@code payment_operations} table is the source of truth; Redis is a read-through cache in front of it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentIdempotencyStore {

    private static final String IDEMPOTENCY_UNAVAILABLE_MSG =
            "Idempotency check temporarily unavailable. Retry with same key later.";
    private static final String REDIS_IDEMPOTENCY_PREFIX = "idempotency:payment-op:";
    private static final Duration REDIS_IDEMPOTENCY_TTL = Duration.ofHours(24);

    private final PaymentOperationRecordRepository operationRecordRepository;
    private final ObjectMapper objectMapper;

    @Autowired(required = false)
    private StringRedisTemplate stringRedisTemplate;

    @Value("${payment.idempotency-redis-cache:true}")
    private boolean idempotencyRedisCacheEnabled;

    /**
     * Read: Redis first if enabled; on miss or error fall back to DB.
     *
     * @throws ServiceUnavailableException if the DB cannot answer; the caller must not proceed to the provider
     */
    public <T> Optional<T> find(String idempotencyKey, Class<T> type) {
        if (idempotencyRedisCacheEnabled && stringRedisTemplate != null) {
            try {
                String json = stringRedisTemplate.opsForValue().get(REDIS_IDEMPOTENCY_PREFIX + idempotencyKey);
                if (json != null) {
                    log.debug("Idempotency hit from Redis for key: {}", idempotencyKey);
                    return Optional.of(objectMapper.readValue(json, type));
                }
            } catch (Exception e) {
                log.debug("Redis idempotency read missed or failed, falling back to DB: {}", e.getMessage());
            }
        }
        try {
            Optional<PaymentOperationRecord> stored = operationRecordRepository.findById(idempotencyKey);
            if (stored.isEmpty()) {
                return Optional.empty();
            }
            T response = objectMapper.readValue(stored.get().getResponseJson(), type);
            log.debug("Idempotency hit from DB for key: {}", idempotencyKey);
            warmRedisCache(idempotencyKey, stored.get().getResponseJson());
            return Optional.of(response);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize stored payment result for key: {}", idempotencyKey, e);
            throw new ServiceUnavailableException(IDEMPOTENCY_UNAVAILABLE_MSG, e);
        } catch (DataAccessException e) {
            log.warn("Idempotency store (DB) unavailable for key: {}", idempotencyKey, e);
            throw new ServiceUnavailableException(IDEMPOTENCY_UNAVAILABLE_MSG, e);
        }
    }

    /**
     * Stores the result of an operation that already happened at the provider.
     * The money has moved by now, so a failed write is logged and not rethrown;
     * a retry reaches the provider again with the same key and gets the same answer.
     */
    public void record(String idempotencyKey, PaymentOperation operation, Object response) {
        String json;
        try {
            json = objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} result for idempotency key: {}", operation, idempotencyKey, e);
            return;
        }
        try {
            operationRecordRepository.save(
                    new PaymentOperationRecord(idempotencyKey, operation, json, LocalDateTime.now()));
        } catch (DataAccessException e) {
            log.error("Failed to store {} result for idempotency key: {}; provider replay will cover a retry",
                    operation, idempotencyKey, e);
            return;
        }
        warmRedisCache(idempotencyKey, json);
    }

    /** Best-effort: warm Redis after DB save. */
    private void warmRedisCache(String idempotencyKey, String json) {
        if (!idempotencyRedisCacheEnabled || stringRedisTemplate == null) return;
        try {
            stringRedisTemplate.opsForValue().set(
                    REDIS_IDEMPOTENCY_PREFIX + idempotencyKey, json, REDIS_IDEMPOTENCY_TTL);
            log.debug("Warmed Redis idempotency cache for key: {}", idempotencyKey);
        } catch (Exception e) {
            log.warn("Failed to warm Redis idempotency cache for key: {} (non-fatal)", idempotencyKey, e);
        }
    }
}
