/**
 * Loan Service Application
 * Loan registration with on-demand amortization schedules and balance summaries
 *
 * Features:
 * - User registration
 * - Loan registration and read-only sharing between users
 * - Month-by-month amortization schedule
 * - Point-in-time principal and interest summary
 */
package com.loanamori.loan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@SpringBootApplication
@EnableTransactionManagement
public class LoanServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoanServiceApplication.class, args);
    }
}
