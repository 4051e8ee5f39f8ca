package com.followchat.social.user.api;

import com.followchat.social.auth.service.AuthService;
import com.followchat.social.common.api.ApiResponse;
import com.followchat.social.common.api.ChatError;
import com.followchat.social.common.api.ChatException;
import com.followchat.social.social.service.SocialGraphGate;
import com.followchat.social.user.repo.FollowRepository;
import com.followchat.social.user.repo.UserAccountRepository;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/users")
public class UserController {

    private final AuthService authService;
    private final UserAccountRepository userAccountRepository;
    private final FollowRepository followRepository;
    private final SocialGraphGate socialGraphGate;

    public UserController(
            AuthService authService,
            UserAccountRepository userAccountRepository,
            FollowRepository followRepository,
            SocialGraphGate socialGraphGate
    ) {
        this.authService = authService;
        this.userAccountRepository = userAccountRepository;
        this.followRepository = followRepository;
        this.socialGraphGate = socialGraphGate;
    }

    @GetMapping("/{username}")
    public ApiResponse<UserProfileResponse> profile(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @CookieValue(value = "${app.ws.access-cookie-name:access_token}", required = false) String cookieToken,
            @PathVariable("username") String username
    ) {
        var me = authService.requireUsername(authorization, cookieToken);
        var user = userAccountRepository.findPublicByUsername(username)
                .orElseThrow(() -> new ChatException(ChatError.USER_NOT_FOUND));

        return ApiResponse.ok(new UserProfileResponse(
                user.username(),
                user.bio(),
                followRepository.countFollowers(user.username()),
                followRepository.countFollowing(user.username()),
                me.equals(user.username()),
                followRepository.follows(me, user.username()),
                followRepository.follows(user.username(), me),
                socialGraphGate.canMessage(me, user.username()).allowed()
        ));
    }

    @PostMapping("/{username}/follow")
    public ApiResponse<FollowToggleResponse> toggleFollow(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @CookieValue(value = "${app.ws.access-cookie-name:access_token}", required = false) String cookieToken,
            @PathVariable("username") String username
    ) {
        var me = authService.requireUsername(authorization, cookieToken);
        if (me.equals(username)) {
            throw new ChatException(ChatError.SELF_FOLLOW);
        }
        if (!userAccountRepository.existsUsername(username)) {
            throw new ChatException(ChatError.USER_NOT_FOUND);
        }

        if (followRepository.follows(me, username)) {
            followRepository.unfollow(me, username);
            return ApiResponse.ok(new FollowToggleResponse(false));
        }
        followRepository.follow(me, username);
        return ApiResponse.ok(new FollowToggleResponse(true));
    }
}
