package com.loanamori.loan.service;

import com.loanamori.loan.amortization.LoanParameters;
import com.loanamori.loan.config.LoanProperties;
import com.loanamori.loan.dto.LoanCreateRequest;
import com.loanamori.loan.dto.LoanResponse;
import com.loanamori.loan.dto.LoanShareRequest;
import com.loanamori.loan.dto.LoanSummaryResponse;
import com.loanamori.loan.dto.ScheduleItemResponse;
import com.loanamori.loan.entity.Loan;
import com.loanamori.loan.entity.User;
import com.loanamori.loan.exception.DuplicateResourceException;
import com.loanamori.loan.exception.InvalidRequestException;
import com.loanamori.loan.exception.ResourceNotFoundException;
import com.loanamori.loan.mapper.LoanMapper;
import com.loanamori.loan.repository.LoanRepository;
import com.loanamori.loan.repository.UserRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Loan Service
 * Loan registration, read-only sharing and the schedule and summary views of a stored loan
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanService {

    private final LoanRepository loanRepository;
    private final UserRepository userRepository;
    private final AmortizationService amortizationService;
    private final LoanMapper loanMapper;
    private final LoanProperties loanProperties;
    private final MeterRegistry meterRegistry;

    private Counter registrationsCounter;

    /**
     * Register a new loan for an existing owner
     */
    @Transactional
    public LoanResponse createLoan(LoanCreateRequest request) {
        log.info("Registering loan for user: {}", request.getUserId());

        User owner = userRepository.findById(request.getUserId())
            .orElseThrow(() -> ResourceNotFoundException.user(request.getUserId()));

        validateLimits(request);

        Loan savedLoan = loanRepository.save(loanMapper.toEntity(request, owner));
        getRegistrationsCounter().increment();

        log.info("Loan registered: {} amount={} rate={} term={}", savedLoan.getId(),
            savedLoan.getAmount(), savedLoan.getAnnualInterestRate(), savedLoan.getLoanTermInMonths());
        return loanMapper.toResponse(savedLoan);
    }

    @Transactional(readOnly = true)
    public List<LoanResponse> listLoans() {
        return loanMapper.toResponseList(loanRepository.findAllByOrderByCreatedAtAsc());
    }

    @Transactional(readOnly = true)
    public LoanResponse getLoan(UUID loanId) {
        return loanMapper.toResponse(findLoan(loanId));
    }

    /**
     * Grant another user read-only access to a loan
     */
    @Transactional
    public LoanResponse shareLoan(UUID loanId, LoanShareRequest request) {
        Loan loan = findLoan(loanId);
        User user = userRepository.findById(request.getUserId())
            .orElseThrow(() -> new ResourceNotFoundException("User to share with not found: " + request.getUserId()));

        if (loan.isOwnedBy(user.getId())) {
            throw new InvalidRequestException("Owner already has access to this loan");
        }
        if (loan.isSharedWith(user.getId())) {
            throw new DuplicateResourceException("Loan already shared with this user");
        }

        loan.getSharedUsers().add(user);
        Loan savedLoan = loanRepository.save(loan);

        log.info("Loan {} shared with user {}", loanId, user.getId());
        return loanMapper.toResponse(savedLoan);
    }

    @Transactional(readOnly = true)
    public List<ScheduleItemResponse> getSchedule(UUID loanId) {
        LoanParameters parameters = findLoan(loanId).toParameters();
        return loanMapper.toScheduleItems(amortizationService.getSchedule(parameters));
    }

    @Transactional(readOnly = true)
    public LoanSummaryResponse getSummary(UUID loanId, int month) {
        LoanParameters parameters = findLoan(loanId).toParameters();
        return loanMapper.toSummaryResponse(amortizationService.getSummary(parameters, month));
    }

    private Loan findLoan(UUID loanId) {
        return loanRepository.findDetailedById(loanId)
            .orElseThrow(() -> ResourceNotFoundException.loan(loanId));
    }

    private void validateLimits(LoanCreateRequest request) {
        if (request.getLoanTermInMonths() > loanProperties.getMaxTermMonths()) {
            throw new InvalidRequestException(String.format("Loan term cannot exceed %d months",
                loanProperties.getMaxTermMonths()));
        }
        if (request.getAmount().compareTo(loanProperties.getMaxPrincipal()) > 0) {
            throw new InvalidRequestException("Loan amount cannot exceed " + loanProperties.getMaxPrincipal());
        }
    }

    private Counter getRegistrationsCounter() {
        if (registrationsCounter == null) {
            registrationsCounter = Counter.builder("loan_registrations_total")
                .description("Total number of loans registered")
                .tag("service", "loan")
                .register(meterRegistry);
        }
        return registrationsCounter;
    }
}
