package ai.i18next.parser.report;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CharDiffTest {

    @Test
    void identicalStringsAreCopied() {
        assertThat(CharDiff.diff("Hello, world!", "Hello, world!")).isEqualTo("Hello, world!");
        assertThat(CharDiff.diff("", "")).isEmpty();
    }

    @Test
    void groupsDifferingRuns() {
        assertThat(CharDiff.diff("Reset", "Resat")).isEqualTo("Res[-e-]{+a+}t");
    }

    @Test
    void marksTrailingCharactersOfTheLongerString() {
        assertThat(CharDiff.diff("Hello, world!", "Hello!")).isEqualTo("Hello[-, world!-]{+!+}");
        assertThat(CharDiff.diff("Hi", "Hi there")).isEqualTo("Hi{+ there+}");
    }

    @Test
    void comparesCodePoints() {
        assertThat(CharDiff.diff("a😀b", "a😁b")).isEqualTo("a[-😀-]{+😁+}b");
    }
}
