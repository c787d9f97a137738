package com.example.fieldauthz.actor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CurrentActor")
class CurrentActorTest {

    @Test
    @DisplayName("should bind the actor only for the duration of the call")
    void shouldBindForCallDuration() {
        Object seen = CurrentActor.callAs("alice", CurrentActor::get);

        assertThat(seen).isEqualTo("alice");
        assertThat(CurrentActor.get()).isNull();
    }

    @Test
    @DisplayName("should restore the outer actor after a nested call")
    void shouldRestoreOuterActor() {
        CurrentActor.runAs("alice", () -> {
            CurrentActor.runAs("bob", () -> assertThat(CurrentActor.get()).isEqualTo("bob"));
            assertThat(CurrentActor.get()).isEqualTo("alice");
        });
    }

    @Test
    @DisplayName("should restore the previous actor when the work fails")
    void shouldRestoreOnFailure() {
        assertThatThrownBy(() -> CurrentActor.runAs("alice", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(CurrentActor.get()).isNull();
        assertThat(ActorProvider.threadBound().currentActor()).isNull();
    }
}
