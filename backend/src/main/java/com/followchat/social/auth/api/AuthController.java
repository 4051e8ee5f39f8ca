package com.followchat.social.auth.api;

import com.followchat.social.auth.service.AuthService;
import com.followchat.social.common.api.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private final AuthService authService;
    private final String accessCookieName;

    public AuthController(
            AuthService authService,
            @Value("${app.ws.access-cookie-name:access_token}") String accessCookieName
    ) {
        this.authService = authService;
        this.accessCookieName = accessCookieName;
    }

    @PostMapping("/register")
    public ApiResponse<RegisterResponse> register(@Valid @RequestBody RegisterRequest req) {
        return ApiResponse.ok(authService.register(req));
    }

    /**
     * Also sets the token as an HttpOnly cookie so browser WebSocket handshakes carry it.
     */
    @PostMapping("/login")
    public ResponseEntity<ApiResponse<LoginResponse>> login(@Valid @RequestBody LoginRequest req) {
        var res = authService.login(req);
        var cookie = ResponseCookie.from(accessCookieName, res.access_token())
                .httpOnly(true)
                .path("/")
                .sameSite("Lax")
                .maxAge(authService.accessTtl())
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookie.toString())
                .body(ApiResponse.ok(res));
    }

    @GetMapping("/me")
    public ApiResponse<MeResponse> me(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @CookieValue(value = "${app.ws.access-cookie-name:access_token}", required = false) String cookieToken
    ) {
        var username = authService.requireUsername(authorization, cookieToken);
        return ApiResponse.ok(authService.me(username));
    }
}
