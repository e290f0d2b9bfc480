package com.subscription.billing.persistence.repository;

import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.persistence.entity.SubscriptionEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SubscriptionRepository extends JpaRepository<SubscriptionEntity, UUID> {

    /** Row lock held for the ledger transaction. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM SubscriptionEntity s WHERE s.id = :id")
    Optional<SubscriptionEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<SubscriptionEntity> findByProviderAndProviderSubscriptionId(ProviderType provider, String providerSubscriptionId);

    List<SubscriptionEntity> findByUserIdAndStatusIn(String userId, Collection<SubscriptionStatus> statuses);

    Optional<SubscriptionEntity> findFirstByUserIdOrderByCreatedAtDesc(String userId);

    @Query("SELECT s FROM SubscriptionEntity s WHERE s.status = :status AND s.currentPeriodEnd < :cutoff")
    List<SubscriptionEntity> findByStatusAndPeriodEndedBefore(@Param("status") SubscriptionStatus status,
                                                             @Param("cutoff") Instant cutoff);
}
