package com.example.fanout.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class AudienceTest {

  @Test
  void usersAreTrimmedDedupedAndKeepFirstSeenOrder() {
    final Audience audience = Audience.users(Arrays.asList(" bob", "alice", "bob ", "", null, "  "));

    assertThat(audience.mode()).isEqualTo(AudienceMode.USER);
    assertThat(audience.members()).containsExactly("bob", "alice");
  }

  @Test
  void emptyRoleListIsValid() {
    final Audience audience = Audience.roles(List.of());

    assertThat(audience).isInstanceOf(Audience.Roles.class);
    assertThat(audience.members()).isEmpty();
  }

  @Test
  void broadcastHasNoMembers() {
    assertThat(Audience.broadcast().members()).isEmpty();
    assertThat(Audience.of(AudienceMode.BROADCAST, List.of("ignored")))
        .isEqualTo(Audience.broadcast());
  }

  @Test
  void membersCannotBeModified() {
    final Audience audience = Audience.roles(List.of("admin"));

    assertThatThrownBy(() -> audience.members().add("tenant"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void modeParsesWireValuesCaseInsensitively() {
    assertThat(AudienceMode.fromValue("Role")).isEqualTo(AudienceMode.ROLE);
    assertThatThrownBy(() -> AudienceMode.fromValue("combined"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
