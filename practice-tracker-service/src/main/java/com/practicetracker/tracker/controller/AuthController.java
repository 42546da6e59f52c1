package com.practicetracker.tracker.controller;

import com.practicetracker.tracker.dto.AuthResponse;
import com.practicetracker.tracker.dto.CredentialsRequest;
import com.practicetracker.tracker.service.AccountService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "${cors.allowed.origins}")
public class AuthController {

    private final AccountService accountService;

    public AuthController(AccountService accountService) {
        this.accountService = accountService;
    }

    /**
     * POST /api/register
     */
    @PostMapping("/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody CredentialsRequest request) {
        return ResponseEntity.ok(accountService.register(request.getUsername(), request.getPassword()));
    }

    /**
     * POST /api/login
     */
    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@RequestBody CredentialsRequest request) {
        return ResponseEntity.ok(accountService.login(request.getUsername(), request.getPassword()));
    }
}
