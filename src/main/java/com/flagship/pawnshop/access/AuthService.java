package com.flagship.pawnshop.access;

import com.flagship.pawnshop.exception.AuthenticationRequiredException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Login and per-request session resolution.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private final UserRepository userRepository;
    private final RoleRepository roleRepository;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;

    /**
     * Checks credentials and issues an access token.
     *
     * @throws AuthenticationRequiredException on unknown user, wrong password or inactive account
     */
    @Transactional(readOnly = true)
    public LoginResult login(String username, String password) {
        UserEntity user = userRepository.findByUsername(username)
            .filter(u -> passwordEncoder.matches(password, u.getPasswordHash()))
            .orElseThrow(() -> {
                log.warn("Failed login attempt: username={}", username);
                return new AuthenticationRequiredException("Incorrect username or password");
            });

        if (!user.isActive()) {
            log.warn("Login refused for inactive user: username={}", username);
            throw new AuthenticationRequiredException("Inactive user");
        }

        String roleName = roleRepository.findById(user.getRoleId())
            .map(RoleEntity::getName)
            .orElse(null);

        log.info("User logged in: username={}, role={}", username, roleName);
        return new LoginResult(tokenService.issue(user), user, roleName);
    }

    /**
     * Resolves a bearer token to the caller it belongs to.
     * Empty when the token is invalid or the user no longer exists or is inactive.
     */
    @Transactional(readOnly = true)
    public Optional<Caller> resolveCaller(String token) {
        return tokenService.verify(token)
            .flatMap(userRepository::findById)
            .filter(UserEntity::isActive)
            .map(user -> new Caller(
                user.getId(),
                user.getUsername(),
                roleRepository.findById(user.getRoleId()).map(RoleEntity::getName).orElse(null)));
    }

    @lombok.Value
    public static class LoginResult {
        String accessToken;
        UserEntity user;
        String roleName;
    }
}
