package com.followchat.social.social.service;

import com.followchat.social.common.api.ChatError;
import com.followchat.social.common.api.ChatException;
import com.followchat.social.user.repo.FollowRepository;
import org.springframework.stereotype.Service;

/**
 * Decides whether two identities may message each other. Stateless: every call reads the
 * follow table, so an unfollow is visible to the next check.
 */
@Service
public class SocialGraphGate {

    private final FollowRepository followRepository;

    public SocialGraphGate(FollowRepository followRepository) {
        this.followRepository = followRepository;
    }

    public boolean mutualFollow(String a, String b) {
        if (a == null || b == null || a.equals(b)) return false;
        return followRepository.follows(a, b) && followRepository.follows(b, a);
    }

    public MessagingEligibility canMessage(String from, String to) {
        if (from != null && from.equals(to)) {
            return MessagingEligibility.deny(ChatError.SELF_MESSAGE);
        }
        if (!mutualFollow(from, to)) {
            return MessagingEligibility.deny(ChatError.NOT_MUTUAL);
        }
        return MessagingEligibility.allow();
    }

    public void requireCanMessage(String from, String to) {
        var eligibility = canMessage(from, to);
        if (!eligibility.allowed()) {
            throw new ChatException(eligibility.reason());
        }
    }
}
