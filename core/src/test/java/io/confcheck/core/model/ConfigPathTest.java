package io.confcheck.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ConfigPathTest {

    @Test
    void childExtendsWithoutTouchingParent() {
        ConfigPath db = ConfigPath.of("db");
        ConfigPath host = db.child("host");

        assertThat(db.segments()).containsExactly("db");
        assertThat(host.segments()).containsExactly("db", "host");
        assertThat(host.last()).isEqualTo("host");
        assertThat(host.depth()).isEqualTo(2);
    }

    @Test
    void indicesAreSegments() {
        ConfigPath path = ConfigPath.of("hosts").index(3);

        assertThat(path).isEqualTo(ConfigPath.of("hosts", 3));
        assertThat(path.toString()).isEqualTo("[hosts, 3]");
        assertThatThrownBy(() -> path.index(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rootIsEmpty() {
        assertThat(ConfigPath.root().isRoot()).isTrue();
        assertThat(ConfigPath.root().last()).isNull();
        assertThat(ConfigPath.root()).isEqualTo(ConfigPath.of());
    }

    @Test
    void segmentsAreUnmodifiable() {
        assertThatThrownBy(() -> ConfigPath.of("a").segments().add("b"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
