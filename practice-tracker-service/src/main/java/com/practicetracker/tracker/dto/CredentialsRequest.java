package com.practicetracker.tracker.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of both register and login calls
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CredentialsRequest {
    @NotBlank
    private String username;
    @NotBlank
    private String password;
}
