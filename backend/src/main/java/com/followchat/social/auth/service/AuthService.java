package com.followchat.social.auth.service;

import com.followchat.social.auth.api.LoginRequest;
import com.followchat.social.auth.api.LoginResponse;
import com.followchat.social.auth.api.MeResponse;
import com.followchat.social.auth.api.RegisterRequest;
import com.followchat.social.auth.api.RegisterResponse;
import com.followchat.social.auth.service.crypto.PasswordHasher;
import com.followchat.social.auth.service.jwt.JwtService;
import com.followchat.social.common.api.ChatError;
import com.followchat.social.common.api.ChatException;
import com.followchat.social.user.repo.FollowRepository;
import com.followchat.social.user.repo.UserAccountRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.regex.Pattern;

@Service
public class AuthService {

    /**
     * Identities double as room-name tokens, so the room separator ({@code _}) is not allowed.
     */
    public static final Pattern USERNAME_PATTERN = Pattern.compile("^[A-Za-z0-9.-]{3,50}$");

    private final UserAccountRepository userAccountRepository;
    private final FollowRepository followRepository;
    private final PasswordHasher passwordHasher;
    private final JwtService jwtService;
    private final Duration accessTtl;

    public AuthService(
            UserAccountRepository userAccountRepository,
            FollowRepository followRepository,
            PasswordHasher passwordHasher,
            JwtService jwtService,
            @Value("${app.jwt.access-ttl-seconds:7200}") long accessTtlSeconds
    ) {
        this.userAccountRepository = userAccountRepository;
        this.followRepository = followRepository;
        this.passwordHasher = passwordHasher;
        this.jwtService = jwtService;
        this.accessTtl = Duration.ofSeconds(accessTtlSeconds);
    }

    public Duration accessTtl() {
        return accessTtl;
    }

    public RegisterResponse register(RegisterRequest req) {
        var username = req.username().trim();
        if (!USERNAME_PATTERN.matcher(username).matches()) {
            throw new ChatException(ChatError.INVALID_USERNAME);
        }
        if (userAccountRepository.existsUsername(username)) {
            throw new ChatException(ChatError.USERNAME_TAKEN);
        }
        try {
            userAccountRepository.createUser(username, passwordHasher.hash(req.password()), req.bio());
        } catch (DuplicateKeyException dup) {
            throw new ChatException(ChatError.USERNAME_TAKEN, dup);
        }
        return new RegisterResponse(username);
    }

    public LoginResponse login(LoginRequest req) {
        var user = userAccountRepository.findByUsername(req.username().trim())
                .orElseThrow(() -> new ChatException(ChatError.INVALID_CREDENTIALS));

        if (!passwordHasher.matches(req.password(), user.passwordHash())) {
            throw new ChatException(ChatError.INVALID_CREDENTIALS);
        }

        var accessToken = jwtService.issueAccessToken(user.username(), accessTtl);
        return new LoginResponse(accessToken, accessTtl.toSeconds(), user.username());
    }

    public MeResponse me(String username) {
        var me = userAccountRepository.findPublicByUsername(username)
                .orElseThrow(() -> new ChatException(ChatError.USER_NOT_FOUND));
        return new MeResponse(
                me.username(),
                me.bio(),
                followRepository.countFollowers(username),
                followRepository.countFollowing(username)
        );
    }

    public String requireUsername(String authorization, String cookieToken) {
        var token = JwtService.extractBearerToken(authorization)
                .or(() -> Optional.ofNullable(cookieToken).filter(t -> !t.isBlank()))
                .orElseThrow(() -> new ChatException(ChatError.UNAUTHORIZED));
        var claims = jwtService.parse(token);
        if (!userAccountRepository.existsUsername(claims.username())) {
            throw new ChatException(ChatError.UNAUTHORIZED);
        }
        return claims.username();
    }
}
