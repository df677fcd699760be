package com.nextride.backend.repository;

import com.nextride.backend.model.Subscription;
import com.nextride.backend.model.SubscriptionTarget;

import java.util.List;
import java.util.Optional;

public interface SubscriptionRepository {

    Optional<Long> findUserId(String username);

    void insertUser(String username);

    boolean exists(long userId, SubscriptionTarget target);

    void insert(long userId, SubscriptionTarget target);

    /**
     * Subscriptions of a user ordered by stop id, then route id.
     */
    List<Subscription> findByUser(long userId);

    /**
     * @return number of rows removed, 0 when the subscription does not belong to the user
     */
    int delete(long userId, long subscriptionId);
}
