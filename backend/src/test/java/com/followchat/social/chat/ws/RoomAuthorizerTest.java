package com.followchat.social.chat.ws;

import com.followchat.social.chat.service.RoomId;
import com.followchat.social.social.service.SocialGraphGate;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RoomAuthorizerTest {

    private final SocialGraphGate gate = mock(SocialGraphGate.class);
    private final RoomAuthorizer authorizer = new RoomAuthorizer(gate);

    @Test
    void anonymous_is_unauthenticated_before_anything_else() {
        var decision = authorizer.authorize(ConnectionIdentity.ANONYMOUS, "alice_bob");

        assertThat(decision.outcome()).isEqualTo(RoomAuthorization.UNAUTHENTICATED);
        assertThat(decision.outcome().closeCode()).isEqualTo(4001);
        verify(gate, never()).mutualFollow(anyString(), anyString());
    }

    @Test
    void outsider_is_not_participant_even_when_everyone_follows_everyone() {
        when(gate.mutualFollow(anyString(), anyString())).thenReturn(true);

        var decision = authorizer.authorize(ConnectionIdentity.of("carol"), "alice_bob");

        assertThat(decision.outcome()).isEqualTo(RoomAuthorization.NOT_PARTICIPANT);
        assertThat(decision.outcome().closeCode()).isEqualTo(4002);
    }

    @Test
    void undecomposable_room_is_not_participant() {
        assertThat(authorizer.authorize(ConnectionIdentity.of("alice"), "alice").outcome())
                .isEqualTo(RoomAuthorization.NOT_PARTICIPANT);
        assertThat(authorizer.authorize(ConnectionIdentity.of("alice"), "alice_bob_carol").outcome())
                .isEqualTo(RoomAuthorization.NOT_PARTICIPANT);
        assertThat(authorizer.authorize(ConnectionIdentity.of("alice"), null).outcome())
                .isEqualTo(RoomAuthorization.NOT_PARTICIPANT);
    }

    @Test
    void participant_without_mutual_follow_is_forbidden() {
        when(gate.mutualFollow("carol", "dave")).thenReturn(false);

        var decision = authorizer.authorize(ConnectionIdentity.of("carol"), "carol_dave");

        assertThat(decision.outcome()).isEqualTo(RoomAuthorization.FORBIDDEN);
        assertThat(decision.outcome().closeStatus().getCode()).isEqualTo(4003);
    }

    @Test
    void mutual_followers_are_admitted_from_either_room_spelling() {
        when(gate.mutualFollow("bob", "alice")).thenReturn(true);

        var decision = authorizer.authorize(ConnectionIdentity.of("bob"), "bob_alice");

        assertThat(decision.authorized()).isTrue();
        assertThat(decision.room()).isEqualTo(RoomId.of("alice", "bob"));
    }
}
