package com.loanamori.loan.controller;

import com.loanamori.loan.dto.LoanResponse;
import com.loanamori.loan.dto.UserCreateRequest;
import com.loanamori.loan.dto.UserResponse;
import com.loanamori.loan.service.UserService;
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
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Users", description = "User registration and owned loans")
public class UserController {

    private final UserService userService;

    @PostMapping
    @Operation(summary = "Create user", description = "Register a user with a unique username and email")
    @ApiResponse(responseCode = "201", description = "User created")
    @ApiResponse(responseCode = "400", description = "Username or email already exists")
    public ResponseEntity<UserResponse> createUser(@Valid @RequestBody UserCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.createUser(request));
    }

    @GetMapping
    @Operation(summary = "List users")
    public ResponseEntity<List<UserResponse>> listUsers() {
        return ResponseEntity.ok(userService.listUsers());
    }

    @GetMapping("/{userId}/loans")
    @Operation(summary = "List user loans", description = "Loans owned by a specific user")
    @ApiResponse(responseCode = "404", description = "User not found")
    public ResponseEntity<List<LoanResponse>> listLoansForUser(
            @Parameter(description = "User ID") @PathVariable UUID userId) {
        return ResponseEntity.ok(userService.listLoansForUser(userId));
    }
}
