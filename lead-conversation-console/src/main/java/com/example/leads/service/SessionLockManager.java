package com.example.leads.service;

import com.example.leads.config.LeadConsoleProperties;
import com.example.leads.service.exception.ErrorCode;
import com.example.leads.service.exception.ServiceException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class SessionLockManager {

    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;
    private final LeadConsoleProperties properties;

    public <T> T withSessionLock(String sessionId, Supplier<T> action) {
        RLock lock = redissonClient.getLock(keyFactory.sessionLockKey(sessionId));
        boolean acquired;
        try {
            acquired = lock.tryLock(
                    properties.getRedis().getLockWait().toMillis(),
                    properties.getRedis().getLockLease().toMillis(),
                    TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ServiceException(ErrorCode.TRANSIENT_STORE_ERROR, "Interrupted while locking session " + sessionId, ex);
        }
        if (!acquired) {
            log.warn("Timed out waiting for transition lock of session {}", sessionId);
            throw new ServiceException(ErrorCode.TRANSIENT_STORE_ERROR, "Session " + sessionId + " is busy, retry shortly");
        }
        try {
            return action.get();
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }
}
