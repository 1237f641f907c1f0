package com.flagship.pawnshop.access;

import com.flagship.pawnshop.access.dto.LoginRequest;
import com.flagship.pawnshop.access.dto.LoginResponse;
import com.flagship.pawnshop.access.dto.UserResponse;
import com.flagship.pawnshop.config.PawnshopProperties;
import com.flagship.pawnshop.exception.AuthenticationRequiredException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Login, logout and "who am I".
 *
 * Login is the only public endpoint besides /health.
 */
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private static final String TOKEN_TYPE = "bearer";

    private final AuthService authService;
    private final UserService userService;
    private final PawnshopProperties properties;

    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        AuthService.LoginResult result = authService.login(request.getUsername(), request.getPassword());

        ResponseCookie cookie = ResponseCookie.from(properties.getSecurity().getCookieName(), result.getAccessToken())
            .httpOnly(true)
            .path("/")
            .sameSite("Lax")
            .maxAge(properties.getSecurity().getTokenTtl())
            .build();

        UserResponse user = UserResponse.from(result.getUser(), result.getRoleName(),
            AccessControlTable.permissionsFor(result.getRoleName()));

        return ResponseEntity.ok()
            .header(HttpHeaders.SET_COOKIE, cookie.toString())
            .body(new LoginResponse(result.getAccessToken(), TOKEN_TYPE, user));
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout() {
        ResponseCookie cookie = ResponseCookie.from(properties.getSecurity().getCookieName(), "")
            .httpOnly(true)
            .path("/")
            .maxAge(0)
            .build();
        return ResponseEntity.noContent()
            .header(HttpHeaders.SET_COOKIE, cookie.toString())
            .build();
    }

    @GetMapping("/me")
    public ResponseEntity<UserResponse> me() {
        Caller caller = CallerContext.get()
            .orElseThrow(() -> new AuthenticationRequiredException("Not authenticated"));
        UserEntity user = userService.getUser(caller.getUserId());
        return ResponseEntity.ok(UserResponse.from(user, caller.getRoleName(),
            AccessControlTable.permissionsFor(caller.getRoleName())));
    }
}
