package com.practicetracker.tracker.dto;

import com.practicetracker.tracker.entity.User;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AuthResponse {
    private String token;
    private User user;
}
