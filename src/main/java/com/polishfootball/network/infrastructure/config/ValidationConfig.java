package com.polishfootball.network.infrastructure.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.beanvalidation.LocalValidatorFactoryBean;

import java.time.Clock;

/**
 * Bean Validation evaluates {@code @PastOrPresent} and friends against the application clock (UTC).
 */
@Configuration
public class ValidationConfig {

    @Bean
    public LocalValidatorFactoryBean validator(Clock clock) {
        LocalValidatorFactoryBean factoryBean = new LocalValidatorFactoryBean();
        factoryBean.setConfigurationInitializer(configuration -> configuration.clockProvider(() -> clock));
        return factoryBean;
    }
}
