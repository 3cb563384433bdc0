package net.osslabz.wamp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;


class UriTest {

    @Test
    void acceptsDottedUri() {

        Uri uri = Uri.of("com.example.error.bad_argument");

        assertThat(uri.toString()).isEqualTo("com.example.error.bad_argument");
        assertThat(uri.segments()).containsExactly("com", "example", "error", "bad_argument");
    }


    @ParameterizedTest
    @ValueSource(strings = {"", "com..example", ".com", "com.", "com.exa mple", "com.#"})
    void rejectsInvalidUri(String raw) {

        assertThatThrownBy(() -> Uri.of(raw))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("invalid uri");
    }


    @Test
    void rejectsNull() {

        assertThatThrownBy(() -> Uri.of(null)).isInstanceOf(IllegalArgumentException.class);
    }


    @Test
    void patternAllowsEmptySegments() {

        Uri pattern = Uri.ofPattern("com..error");

        assertThat(pattern.segments()).containsExactly("com", "", "error");
    }


    @Test
    void equalsByValue() {

        assertThat(Uri.of("a.b")).isEqualTo(Uri.of("a.b")).hasSameHashCodeAs(Uri.of("a.b"));
        assertThat(Uri.of("a.b")).isNotEqualTo(Uri.of("a.c"));
    }
}
