package com.loanamori.loan.mapper;

import com.loanamori.loan.dto.UserCreateRequest;
import com.loanamori.loan.dto.UserResponse;
import com.loanamori.loan.entity.User;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
public class UserMapper {

    public User toEntity(UserCreateRequest request) {
        return User.builder()
            .username(request.getUsername().trim())
            .email(request.getEmail().trim())
            .build();
    }

    public UserResponse toResponse(User entity) {
        if (entity == null) {
            return null;
        }
        return UserResponse.builder()
            .id(entity.getId())
            .username(entity.getUsername())
            .email(entity.getEmail())
            .build();
    }

    public List<UserResponse> toResponseList(List<User> entities) {
        return entities.stream()
            .map(this::toResponse)
            .collect(Collectors.toList());
    }
}
