package blog.platform.security;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BearerTokenParserTest {

    @Test
    void extractsToken() {
        assertThat(BearerTokenParser.parse("Bearer abc.def.ghi")).contains("abc.def.ghi");
        assertThat(BearerTokenParser.parse("bearer abc")).contains("abc");
        assertThat(BearerTokenParser.parse("  BEARER   abc  ")).contains("abc");
    }

    @Test
    void rejectsOtherShapes() {
        assertThat(BearerTokenParser.parse(null)).isEmpty();
        assertThat(BearerTokenParser.parse("")).isEmpty();
        assertThat(BearerTokenParser.parse("Bearer")).isEmpty();
        assertThat(BearerTokenParser.parse("Basic dXNlcjpwYXNz")).isEmpty();
        assertThat(BearerTokenParser.parse("Bearer abc def")).isEmpty();
        assertThat(BearerTokenParser.parse("abc")).isEmpty();
    }
}
