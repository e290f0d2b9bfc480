package com.subscription.billing.persistence.repository;

import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.persistence.entity.IapReceiptEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface IapReceiptRepository extends JpaRepository<IapReceiptEntity, UUID> {

    Optional<IapReceiptEntity> findByProviderAndTransactionId(ProviderType provider, String transactionId);
}
