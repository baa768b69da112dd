package com.loanamori.loan.service;

import com.loanamori.loan.dto.LoanResponse;
import com.loanamori.loan.dto.UserCreateRequest;
import com.loanamori.loan.dto.UserResponse;
import com.loanamori.loan.entity.User;
import com.loanamori.loan.exception.DuplicateResourceException;
import com.loanamori.loan.exception.ResourceNotFoundException;
import com.loanamori.loan.mapper.LoanMapper;
import com.loanamori.loan.mapper.UserMapper;
import com.loanamori.loan.repository.LoanRepository;
import com.loanamori.loan.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final LoanRepository loanRepository;
    private final UserMapper userMapper;
    private final LoanMapper loanMapper;

    /**
     * Register a user with a unique username and email
     */
    @Transactional
    public UserResponse createUser(UserCreateRequest request) {
        User user = userMapper.toEntity(request);
        if (userRepository.existsByUsernameOrEmail(user.getUsername(), user.getEmail())) {
            log.warn("Rejected registration, username or email already taken: {}", user.getUsername());
            throw new DuplicateResourceException("Username or email already exists");
        }

        User savedUser;
        try {
            // Unique indexes settle registrations racing past the check above
            savedUser = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent registration lost for username {}", user.getUsername());
            throw new DuplicateResourceException("Username or email already exists", e);
        }
        log.info("User created: {} ({})", savedUser.getId(), savedUser.getUsername());
        return userMapper.toResponse(savedUser);
    }

    @Transactional(readOnly = true)
    public List<UserResponse> listUsers() {
        return userMapper.toResponseList(userRepository.findAllByOrderByCreatedAtAsc());
    }

    /**
     * Loans owned by a user; shared loans are not included
     */
    @Transactional(readOnly = true)
    public List<LoanResponse> listLoansForUser(UUID userId) {
        if (!userRepository.existsById(userId)) {
            throw ResourceNotFoundException.user(userId);
        }
        return loanMapper.toResponseList(loanRepository.findByOwnerIdOrderByCreatedAtAsc(userId));
    }
}
