package ac.tagcache.scan;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GlobPatternTest {

    @Test
    void starMatchesAnySequence() {
        GlobPattern pattern = GlobPattern.compile("cart:*");

        assertThat(pattern.matches("cart:1")).isTrue();
        assertThat(pattern.matches("cart:")).isTrue();
        assertThat(pattern.matches("cart:1:items")).isTrue();
        assertThat(pattern.matches("sku:42")).isFalse();
        assertThat(pattern.matches("xcart:1")).isFalse();
    }

    @Test
    void questionMarkMatchesExactlyOneCharacter() {
        GlobPattern pattern = GlobPattern.compile("h?llo");

        assertThat(pattern.matches("hello")).isTrue();
        assertThat(pattern.matches("hallo")).isTrue();
        assertThat(pattern.matches("hllo")).isFalse();
        assertThat(pattern.matches("heello")).isFalse();
    }

    @Test
    void characterClassesAndNegation() {
        assertThat(GlobPattern.compile("h[ae]llo").matches("hello")).isTrue();
        assertThat(GlobPattern.compile("h[ae]llo").matches("hillo")).isFalse();
        assertThat(GlobPattern.compile("h[^e]llo").matches("hallo")).isTrue();
        assertThat(GlobPattern.compile("h[^e]llo").matches("hello")).isFalse();
        assertThat(GlobPattern.compile("h[a-c]llo").matches("hbllo")).isTrue();
        assertThat(GlobPattern.compile("h[a-c]llo").matches("hdllo")).isFalse();
    }

    @Test
    void reversedRangeIsNormalized() {
        assertThat(GlobPattern.compile("[z-a]").matches("m")).isTrue();
    }

    @Test
    void escapedMetacharactersAreLiterals() {
        GlobPattern pattern = GlobPattern.compile("a\\*b");

        assertThat(pattern.matches("a*b")).isTrue();
        assertThat(pattern.matches("axb")).isFalse();
    }

    @Test
    void regexMetacharactersInTheGlobAreLiterals() {
        GlobPattern pattern = GlobPattern.compile("user.(1)+$");

        assertThat(pattern.matches("user.(1)+$")).isTrue();
        assertThat(pattern.matches("userX(1)+$")).isFalse();
    }

    @Test
    void emptyClassMatchesNothing() {
        assertThat(GlobPattern.compile("a[]").matches("a")).isFalse();
        assertThat(GlobPattern.compile("a[]").matches("ab")).isFalse();
    }

    @Test
    void escapeProducesAPatternMatchingOnlyTheLiteral() {
        String literal = "tagcache:[v1]*?";
        GlobPattern pattern = GlobPattern.compile(GlobPattern.escape(literal) + "*");

        assertThat(pattern.matches(literal + "tag:sale")).isTrue();
        assertThat(pattern.matches("tagcache:v1xx")).isFalse();
    }

    @Test
    void nullCandidateNeverMatches() {
        assertThat(GlobPattern.compile("*").matches(null)).isFalse();
    }

    @Test
    void nullPatternIsRejected() {
        assertThatThrownBy(() -> GlobPattern.compile(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
