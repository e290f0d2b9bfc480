package com.subscription.billing.persistence.repository;

import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.persistence.entity.SubscriptionPlanEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface SubscriptionPlanRepository extends JpaRepository<SubscriptionPlanEntity, UUID> {

    Optional<SubscriptionPlanEntity> findByPlanCodeAndProviderAndActiveTrue(String planCode, ProviderType provider);
}
