package com.loanamori.loan.entity;

import com.loanamori.loan.amortization.LoanParameters;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Loan registered by an owner. Only the amortization inputs are stored; schedules and
 * summaries are derived from them on every request.
 */
@Entity
@Table(name = "loans", indexes = {
    @Index(name = "idx_loans_owner", columnList = "user_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Loan {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Version field for optimistic locking of concurrent share grants
     */
    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User owner;

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "annual_interest_rate", nullable = false, precision = 7, scale = 4)
    private BigDecimal annualInterestRate;

    @Column(name = "loan_term_in_months", nullable = false)
    private Integer loanTermInMonths;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
        name = "loan_shares",
        joinColumns = @JoinColumn(name = "loan_id"),
        inverseJoinColumns = @JoinColumn(name = "user_id")
    )
    @Builder.Default
    private Set<User> sharedUsers = new LinkedHashSet<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public boolean isOwnedBy(UUID userId) {
        return owner != null && owner.getId().equals(userId);
    }

    public boolean isSharedWith(UUID userId) {
        return sharedUsers.stream().anyMatch(user -> user.getId().equals(userId));
    }

    /**
     * Amortization inputs of this loan.
     *
     * @throws com.loanamori.loan.exception.InvalidLoanParametersException if the stored values cannot be amortized
     */
    public LoanParameters toParameters() {
        return LoanParameters.of(amount, annualInterestRate, loanTermInMonths == null ? 0 : loanTermInMonths);
    }
}
