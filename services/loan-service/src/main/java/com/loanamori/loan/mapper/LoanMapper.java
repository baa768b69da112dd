package com.loanamori.loan.mapper;

import com.loanamori.loan.amortization.LoanSummary;
import com.loanamori.loan.amortization.ScheduleEntry;
import com.loanamori.loan.dto.LoanCreateRequest;
import com.loanamori.loan.dto.LoanResponse;
import com.loanamori.loan.dto.LoanSummaryResponse;
import com.loanamori.loan.dto.ScheduleItemResponse;
import com.loanamori.loan.entity.Loan;
import com.loanamori.loan.entity.User;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Mapping between loan entities, amortization results and their HTTP representations
 */
@Component
public class LoanMapper {

    public Loan toEntity(LoanCreateRequest request, User owner) {
        return Loan.builder()
            .owner(owner)
            .amount(request.getAmount())
            .annualInterestRate(request.getAnnualInterestRate())
            .loanTermInMonths(request.getLoanTermInMonths())
            .build();
    }

    public LoanResponse toResponse(Loan entity) {
        if (entity == null) {
            return null;
        }
        return LoanResponse.builder()
            .id(entity.getId())
            .userId(entity.getOwner().getId())
            .amount(entity.getAmount())
            .annualInterestRate(entity.getAnnualInterestRate())
            .loanTermInMonths(entity.getLoanTermInMonths())
            .sharedUserIds(entity.getSharedUsers().stream()
                .map(User::getId)
                .collect(Collectors.toList()))
            .build();
    }

    public List<LoanResponse> toResponseList(List<Loan> entities) {
        return entities.stream()
            .map(this::toResponse)
            .collect(Collectors.toList());
    }

    public ScheduleItemResponse toScheduleItem(ScheduleEntry entry) {
        return ScheduleItemResponse.builder()
            .month(entry.getMonth())
            .remainingBalance(entry.getRemainingBalance())
            .monthlyPayment(entry.getMonthlyPayment())
            .build();
    }

    public List<ScheduleItemResponse> toScheduleItems(List<ScheduleEntry> entries) {
        return entries.stream()
            .map(this::toScheduleItem)
            .collect(Collectors.toList());
    }

    public LoanSummaryResponse toSummaryResponse(LoanSummary summary) {
        return LoanSummaryResponse.builder()
            .currentPrincipalBalance(summary.getCurrentPrincipalBalance())
            .totalPrincipalPaid(summary.getTotalPrincipalPaid())
            .totalInterestPaid(summary.getTotalInterestPaid())
            .build();
    }
}
