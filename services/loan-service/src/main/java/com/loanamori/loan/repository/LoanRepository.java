package com.loanamori.loan.repository;

import com.loanamori.loan.entity.Loan;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LoanRepository extends JpaRepository<Loan, UUID> {

    // Loans owned by a user
    @EntityGraph(attributePaths = {"owner", "sharedUsers"})
    List<Loan> findByOwnerIdOrderByCreatedAtAsc(UUID ownerId);

    @EntityGraph(attributePaths = {"owner", "sharedUsers"})
    List<Loan> findAllByOrderByCreatedAtAsc();

    // Loan with owner and share list loaded
    @EntityGraph(attributePaths = {"owner", "sharedUsers"})
    @Query("SELECT l FROM Loan l WHERE l.id = :loanId")
    Optional<Loan> findDetailedById(@Param("loanId") UUID loanId);
}
