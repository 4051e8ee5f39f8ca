package com.followchat.social.chat.ws;

import com.followchat.social.chat.service.RoomId;
import com.followchat.social.social.service.SocialGraphGate;
import org.springframework.stereotype.Component;

@Component
public class RoomAuthorizer {

    public record Decision(RoomAuthorization outcome, RoomId room) {
        public boolean authorized() {
            return outcome == RoomAuthorization.AUTHORIZED;
        }
    }

    private final SocialGraphGate socialGraphGate;

    public RoomAuthorizer(SocialGraphGate socialGraphGate) {
        this.socialGraphGate = socialGraphGate;
    }

    public Decision authorize(ConnectionIdentity identity, String rawRoom) {
        if (identity == null || identity.anonymous()) {
            return new Decision(RoomAuthorization.UNAUTHENTICATED, null);
        }

        var room = RoomId.parse(rawRoom).orElse(null);
        if (room == null || !room.contains(identity.username())) {
            return new Decision(RoomAuthorization.NOT_PARTICIPANT, room);
        }

        var other = room.other(identity.username());
        if (!socialGraphGate.mutualFollow(identity.username(), other)) {
            return new Decision(RoomAuthorization.FORBIDDEN, room);
        }
        return new Decision(RoomAuthorization.AUTHORIZED, room);
    }
}
