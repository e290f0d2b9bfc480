package com.subscription.billing.persistence.repository;

import com.subscription.billing.persistence.entity.SubscriptionInvoiceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SubscriptionInvoiceRepository extends JpaRepository<SubscriptionInvoiceEntity, UUID> {

    boolean existsByProviderPaymentId(String providerPaymentId);

    List<SubscriptionInvoiceEntity> findBySubscriptionIdOrderByCreatedAtAsc(UUID subscriptionId);
}
