package com.subscription.billing.persistence.repository;

import com.subscription.billing.persistence.entity.SubscriptionHistoryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Ledger rows. Insert only.
 */
@Repository
public interface SubscriptionHistoryRepository extends JpaRepository<SubscriptionHistoryEntity, UUID> {

    boolean existsByIdempotencyKey(String idempotencyKey);

    List<SubscriptionHistoryEntity> findBySubscriptionIdOrderByCreatedAtAsc(UUID subscriptionId);
}
