package com.nextride.backend.service;

import com.nextride.backend.model.Subscription;
import com.nextride.backend.model.SubscriptionTarget;
import com.nextride.backend.repository.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

    private final SubscriptionRepository subscriptionRepository;

    /**
     * Look up the surrogate id of a user without registering them.
     */
    public Optional<Long> findUserId(String username) {
        requireUsername(username);
        return subscriptionRepository.findUserId(username);
    }

    /**
     * Look up the surrogate id of a user, registering the user on first
     * contact.
     */
    public long getOrCreateUserId(String username) {
        return findUserId(username).orElseGet(() -> {
            try {
                subscriptionRepository.insertUser(username);
                log.info("👤 Registered new user {}", username);
            } catch (DuplicateKeyException e) {
                // registered concurrently by another request
                log.debug("User {} already registered", username);
            }
            return subscriptionRepository.findUserId(username)
                    .orElseThrow(() -> new IllegalStateException("User " + username + " missing after insert"));
        });
    }

    /**
     * @return true when the subscription was created, false when the user
     *         already had it
     */
    public boolean subscribe(String username, SubscriptionTarget target) {
        long userId = getOrCreateUserId(username);
        if (subscriptionRepository.exists(userId, target)) {
            log.info("User {} already subscribed to {} {}", username, target.getType(), target.getId());
            return false;
        }
        subscriptionRepository.insert(userId, target);
        log.info("✅ User {} subscribed to {} {}", username, target.getType(), target.getId());
        return true;
    }

    /**
     * Subscriptions of a user; empty for a user that was never registered.
     */
    public List<Subscription> getSubscriptions(String username) {
        return findUserId(username)
                .map(subscriptionRepository::findByUser)
                .orElseGet(Collections::emptyList);
    }

    /**
     * @return true when a subscription owned by the user was removed
     */
    public boolean unsubscribe(String username, long subscriptionId) {
        Optional<Long> userId = findUserId(username);
        if (userId.isEmpty()) {
            return false;
        }
        boolean removed = subscriptionRepository.delete(userId.get(), subscriptionId) > 0;
        if (removed) {
            log.info("User {} unsubscribed from {}", username, subscriptionId);
        }
        return removed;
    }

    private static void requireUsername(String username) {
        if (username == null || username.trim().isEmpty()) {
            throw new IllegalArgumentException("username is required");
        }
    }
}
