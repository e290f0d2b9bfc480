package com.subscription.billing.config;

import com.subscription.billing.verification.AppleSignedPayloadVerifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class VerificationConfig {

    @Bean
    public AppleSignedPayloadVerifier appleSignedPayloadVerifier(
            @Value("${billing.apple.root-ca-sha256:}") String rootCaSha256,
            @Value("${billing.apple.require-apple-extensions:true}") boolean requireAppleExtensions,
            Clock clock) {
        return new AppleSignedPayloadVerifier(rootCaSha256, requireAppleExtensions, clock);
    }
}
