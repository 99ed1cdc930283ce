package com.boilerplate.backend.modules.auth.application;

import java.util.Optional;

import com.boilerplate.backend.global.error.ProblemException;
import com.boilerplate.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.boilerplate.backend.modules.auth.domain.User;
import com.boilerplate.backend.modules.auth.infrastructure.persistence.UserRepository;
import com.boilerplate.backend.modules.auth.presentation.dto.AuthResponse;
import com.boilerplate.backend.modules.auth.presentation.dto.LoginRequest;
import com.boilerplate.backend.modules.auth.presentation.dto.MessageResponse;
import com.boilerplate.backend.modules.auth.presentation.dto.RegisterRequest;
import com.boilerplate.backend.modules.auth.presentation.dto.UserResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String REGISTERED_MESSAGE = "User registered successfully.";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    public AuthService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService
    ) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
    }

    public MessageResponse register(RegisterRequest request) {
        if (userRepository.existsByUsernameOrEmail(request.username(), request.email())) {
            throw userAlreadyExists();
        }

        User user = new User();
        user.setUsername(request.username());
        user.setFullName(request.fullName());
        user.setEmail(request.email());
        user.setPasswordHash(passwordEncoder.encode(request.password()));

        try {
            userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // a concurrent registration won the unique constraint
            throw userAlreadyExists();
        }

        log.info("Registered user id={} username={}", user.getId(), user.getUsername());
        return new MessageResponse(REGISTERED_MESSAGE);
    }

    @Transactional(readOnly = true)
    public AuthResponse login(LoginRequest request) {
        String identifier = request.usernameOrEmail();
        Optional<User> candidate = identifier.contains("@")
                ? userRepository.findByEmailIgnoreCase(identifier)
                : userRepository.findByUsernameIgnoreCase(identifier);

        User user = candidate
                .filter(found -> passwordEncoder.matches(request.password(), found.getPasswordHash()))
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Invalid credentials."));

        if (!jwtTokenService.isSigningKeyConfigured()) {
            log.error("Cannot issue token for user id={}: jwt.key is missing or too short", user.getId());
            throw new ProblemException(HttpStatus.INTERNAL_SERVER_ERROR, "SERVER_MISCONFIGURED", "JWT configuration is missing");
        }

        IssuedToken issued = jwtTokenService.issueAccessToken(user);
        log.info("Issued token jti={} for user id={} expiring at {}", issued.tokenId(), user.getId(), issued.expiresAt());
        return new AuthResponse(issued.token(), user.getUsername(), user.getEmail());
    }

    @Transactional(readOnly = true)
    public UserResponse loadProfile(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND", "User not found"));
        return UserResponse.from(user);
    }

    private ProblemException userAlreadyExists() {
        return new ProblemException(HttpStatus.BAD_REQUEST, "CONFLICT", "User already exists.");
    }
}
