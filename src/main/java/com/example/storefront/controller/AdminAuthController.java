package com.example.storefront.controller;

import com.example.storefront.model.LoginResult;
import com.example.storefront.service.AdminSessionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Validated
public class AdminAuthController {

    private final AdminSessionService adminSessionService;

    @PostMapping("/login")
    public LoginResult login(@Valid @RequestBody LoginRequest request) {
        return adminSessionService.login(request.username(), request.password());
    }

    public record LoginRequest(@NotNull String username, @NotNull String password) {
    }
}
