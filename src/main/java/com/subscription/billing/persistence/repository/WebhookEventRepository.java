package com.subscription.billing.persistence.repository;

import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.persistence.entity.WebhookEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface WebhookEventRepository extends JpaRepository<WebhookEventEntity, UUID> {

    Optional<WebhookEventEntity> findByProviderAndNotificationId(ProviderType provider, String notificationId);
}
