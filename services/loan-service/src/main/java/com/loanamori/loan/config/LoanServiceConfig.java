package com.loanamori.loan.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables the {@link LoanProperties} binding (loan.*)
 */
@Configuration
@EnableConfigurationProperties(LoanProperties.class)
@Slf4j
public class LoanServiceConfig {

    public LoanServiceConfig(LoanProperties loanProperties) {
        log.info("Loan limits: maxTermMonths={}, maxPrincipal={}",
                loanProperties.getMaxTermMonths(), loanProperties.getMaxPrincipal());
    }
}
