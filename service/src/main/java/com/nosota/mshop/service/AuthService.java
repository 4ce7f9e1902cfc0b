package com.nosota.mshop.service;

import com.nosota.mshop.api.model.UserRole;
import com.nosota.mshop.api.request.LoginRequest;
import com.nosota.mshop.api.request.RegisterRequest;
import com.nosota.mshop.api.response.AuthResponse;
import com.nosota.mshop.error.ConflictException;
import com.nosota.mshop.error.InvalidCredentialsException;
import com.nosota.mshop.mapper.UserMapper;
import com.nosota.mshop.model.User;
import com.nosota.mshop.repository.UserRepository;
import com.nosota.mshop.security.JwtTokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

/**
 * Registration and login of regular users.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    /**
     * Wallet balance every new account starts with.
     */
    public static final long SIGNUP_BONUS = 1000L;

    static final String DUPLICATE_USER_MESSAGE = "User with this email or username already exists";
    static final String INVALID_CREDENTIALS_MESSAGE = "Invalid credentials";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    /**
     * Creates a USER account with the signup bonus and logs it in.
     *
     * <p>Uniqueness is checked up front; the unique constraints on username and email catch
     * a concurrent registration that slips past the check.
     *
     * @param request Validated registration data
     * @return Token and public view of the new account
     * @throws ConflictException if the username or email is already taken
     */
    @Transactional(rollbackFor = Exception.class)
    public AuthResponse register(RegisterRequest request) throws ConflictException {
        log.info("Registering user: username={}", request.username());

        if (userRepository.existsByUsernameOrEmail(request.username(), request.email())) {
            throw new ConflictException(DUPLICATE_USER_MESSAGE);
        }

        User user = new User();
        user.setName(request.name());
        user.setUsername(request.username());
        user.setEmail(request.email());
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setRole(UserRole.USER);
        user.setWallet(SIGNUP_BONUS);

        User savedUser;
        try {
            savedUser = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException(DUPLICATE_USER_MESSAGE, e);
        }

        log.info("User registered: userId={}, username={}", savedUser.getId(), savedUser.getUsername());

        return new AuthResponse(jwtTokenService.issueToken(savedUser), UserMapper.INSTANCE.toDTO(savedUser));
    }

    /**
     * Checks the password and issues a fresh token.
     *
     * @throws InvalidCredentialsException with the same message for an unknown username and a wrong password
     */
    @Transactional(readOnly = true)
    public AuthResponse login(LoginRequest request) throws InvalidCredentialsException {
        User user = userRepository.findByUsername(request.username())
                .orElseThrow(() -> new InvalidCredentialsException(INVALID_CREDENTIALS_MESSAGE));

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new InvalidCredentialsException(INVALID_CREDENTIALS_MESSAGE);
        }

        log.info("User logged in: userId={}", user.getId());

        return new AuthResponse(jwtTokenService.issueToken(user), UserMapper.INSTANCE.toDTO(user));
    }
}
