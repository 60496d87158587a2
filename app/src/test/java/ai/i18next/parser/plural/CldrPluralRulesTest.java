package ai.i18next.parser.plural;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import org.junit.jupiter.api.Test;

class CldrPluralRulesTest {

    private final CldrPluralRules rules = new CldrPluralRules();

    @Test
    void returnsCategoriesInCldrOrder() {
        assertThat(rules.suffixesFor("en")).containsExactly("one", "other");
        assertThat(rules.suffixesFor("ja")).containsExactly("other");
        assertThat(rules.suffixesFor("ru")).containsExactly("one", "few", "many", "other");
        assertThat(rules.suffixesFor("ar")).containsExactly("zero", "one", "two", "few", "many", "other");
        assertThat(rules.suffixesFor("fr")).containsExactly("one", "many", "other");
    }

    @Test
    void fallsBackToLanguageSubtag() {
        assertThat(rules.suffixesFor("en-US")).containsExactly("one", "other");
        assertThat(rules.suffixesFor("pl_PL")).containsExactly("one", "few", "many", "other");
        assertThat(rules.categoriesFor("PT-br")).containsExactly(PluralCategory.ONE, PluralCategory.MANY, PluralCategory.OTHER);
    }

    @Test
    void unknownLocaleThrows() {
        Throwable thrown = catchThrowable(() -> rules.suffixesFor("xx"));

        assertThat(thrown)
                .isInstanceOf(UnknownLocaleException.class)
                .hasMessageContaining("xx");
        assertThat(((UnknownLocaleException) thrown).locale()).isEqualTo("xx");
        assertThat(catchThrowable(() -> rules.suffixesFor(" "))).isInstanceOf(UnknownLocaleException.class);
    }

    @Test
    void categoryKeysAreLowercase() {
        assertThat(PluralCategory.OTHER.key()).isEqualTo("other");
        assertThat(PluralCategory.FEW.key()).isEqualTo("few");
    }
}
