package blog.platform.domain;

import blog.platform.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NormalizerTest {

    @Test
    @DisplayName("username is trimmed and must be 3..64 characters")
    void registerUsername() {
        assertThat(Normalizer.registerUsername("  alice  ")).isEqualTo("alice");
        assertThat(Normalizer.registerUsername("abc")).isEqualTo("abc");
        assertThat(Normalizer.registerUsername("a".repeat(64))).hasSize(64);

        assertThatThrownBy(() -> Normalizer.registerUsername("  ab  "))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("username");
        assertThatThrownBy(() -> Normalizer.registerUsername("a".repeat(65)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Normalizer.registerUsername(null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("length is counted in code points, not UTF-16 units")
    void lengthCountsCodePoints() {
        String threeEmoji = "😀😁😂";
        assertThat(Normalizer.registerUsername(threeEmoji)).isEqualTo(threeEmoji);

        String sevenChars = "😀".repeat(7);
        assertThatThrownBy(() -> Normalizer.registerPassword(sevenChars))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("password");
    }

    @Test
    @DisplayName("login username only needs to be non-empty after trimming")
    void loginUsername() {
        assertThat(Normalizer.loginUsername(" x ")).isEqualTo("x");
        assertThatThrownBy(() -> Normalizer.loginUsername("   "))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("email is trimmed and lower-cased")
    void emailIsNormalized() {
        assertThat(Normalizer.email("  Alice@Example.COM ")).isEqualTo("alice@example.com");
        assertThat(Normalizer.email("first.last+tag@sub.example.org")).isEqualTo("first.last+tag@sub.example.org");
    }

    @Test
    void emailLengthIsBounded() {
        String domain = "b".repeat(63) + "." + "c".repeat(63) + "." + "d".repeat(57) + ".com";
        String longest = "a".repeat(64) + "@" + domain;
        assertThat(longest).hasSize(254);
        assertThat(Normalizer.email(longest)).isEqualTo(longest);

        String tooLong = longest.replace(".com", "d.com");
        assertThat(tooLong).hasSize(255);
        assertThatThrownBy(() -> Normalizer.email(tooLong))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("email");
    }

    @Test
    void emailLocalPartIsBounded() {
        assertThat(Normalizer.email("a".repeat(64) + "@example.com")).startsWith("a".repeat(64));
        assertThatThrownBy(() -> Normalizer.email("a".repeat(65) + "@example.com"))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("email");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "plain", "@example.com", "alice@", "alice@-example.com", "a b@example.com", "alice@exa mple.com"})
    @DisplayName("malformed emails are rejected with field email")
    void malformedEmailRejected(String email) {
        assertThatThrownBy(() -> Normalizer.email(email))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("email");
    }

    @Test
    @DisplayName("register password is kept verbatim and must be 8..128 characters")
    void registerPassword() {
        assertThat(Normalizer.registerPassword("  secret1  ")).isEqualTo("  secret1  ");
        assertThat(Normalizer.registerPassword("p".repeat(128))).hasSize(128);

        assertThatThrownBy(() -> Normalizer.registerPassword("short"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Normalizer.registerPassword("p".repeat(129)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void loginPasswordMustNotBeEmpty() {
        assertThat(Normalizer.loginPassword("x")).isEqualTo("x");
        assertThatThrownBy(() -> Normalizer.loginPassword(""))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("password");
    }

    @Test
    @DisplayName("title is trimmed and must be 1..255 characters; content must be non-empty")
    void titleAndContent() {
        assertThat(Normalizer.title("  Hello  ")).isEqualTo("Hello");
        assertThat(Normalizer.title("t".repeat(255))).hasSize(255);
        assertThatThrownBy(() -> Normalizer.title("t".repeat(256)))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("title");
        assertThatThrownBy(() -> Normalizer.title(" \t "))
                .isInstanceOf(ValidationException.class);

        assertThat(Normalizer.content(" body \n")).isEqualTo("body");
        assertThatThrownBy(() -> Normalizer.content("   "))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("content");
    }

    @Test
    void positiveRejectsZeroAndNegative() {
        assertThat(Normalizer.positive("id", 1)).isEqualTo(1);
        assertThatThrownBy(() -> Normalizer.positive("id", 0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'id'");
        assertThatThrownBy(() -> Normalizer.positive("author_id", -5))
                .isInstanceOf(ValidationException.class);
    }
}
