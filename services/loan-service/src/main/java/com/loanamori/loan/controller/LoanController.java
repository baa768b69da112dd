/**
 * Loan Controller
 * REST API endpoints for loan registration, sharing, schedules and summaries
 */
package com.loanamori.loan.controller;

import com.loanamori.loan.dto.LoanCreateRequest;
import com.loanamori.loan.dto.LoanResponse;
import com.loanamori.loan.dto.LoanShareRequest;
import com.loanamori.loan.dto.LoanSummaryResponse;
import com.loanamori.loan.dto.ScheduleItemResponse;
import com.loanamori.loan.service.LoanService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/loans")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Loans", description = "Loan registration and amortization views")
public class LoanController {

    private final LoanService loanService;

    @PostMapping
    @Operation(summary = "Create loan", description = "Register a loan for an existing owner")
    @ApiResponse(responseCode = "201", description = "Loan created")
    @ApiResponse(responseCode = "404", description = "Owner not found")
    public ResponseEntity<LoanResponse> createLoan(@Valid @RequestBody LoanCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(loanService.createLoan(request));
    }

    @GetMapping
    @Operation(summary = "List loans")
    public ResponseEntity<List<LoanResponse>> listLoans() {
        return ResponseEntity.ok(loanService.listLoans());
    }

    @GetMapping("/{loanId}")
    @Operation(summary = "Get loan", description = "Retrieve a loan including the ids of users it is shared with")
    @ApiResponse(responseCode = "404", description = "Loan not found")
    public ResponseEntity<LoanResponse> getLoan(
            @Parameter(description = "Loan ID") @PathVariable UUID loanId) {
        return ResponseEntity.ok(loanService.getLoan(loanId));
    }

    @PostMapping("/{loanId}/share")
    @Operation(summary = "Share loan", description = "Grant another user read-only access to a loan")
    @ApiResponse(responseCode = "400", description = "Target is the owner or already has access")
    @ApiResponse(responseCode = "404", description = "Loan or user not found")
    public ResponseEntity<LoanResponse> shareLoan(
            @Parameter(description = "Loan ID") @PathVariable UUID loanId,
            @Valid @RequestBody LoanShareRequest request) {
        return ResponseEntity.ok(loanService.shareLoan(loanId, request));
    }

    @GetMapping("/{loanId}/schedule")
    @Operation(summary = "Get amortization schedule",
               description = "Month-by-month remaining balance and payment, recomputed on every request")
    @ApiResponse(responseCode = "404", description = "Loan not found")
    public ResponseEntity<List<ScheduleItemResponse>> getSchedule(
            @Parameter(description = "Loan ID") @PathVariable UUID loanId) {
        return ResponseEntity.ok(loanService.getSchedule(loanId));
    }

    @GetMapping("/{loanId}/summary")
    @Operation(summary = "Get loan summary",
               description = "Principal balance, principal paid and interest paid after the given month")
    @ApiResponse(responseCode = "400", description = "Month outside 0..term")
    @ApiResponse(responseCode = "404", description = "Loan not found")
    public ResponseEntity<LoanSummaryResponse> getSummary(
            @Parameter(description = "Loan ID") @PathVariable UUID loanId,
            @Parameter(description = "Number of payments made, 0 to term") @RequestParam int month) {
        return ResponseEntity.ok(loanService.getSummary(loanId, month));
    }
}
