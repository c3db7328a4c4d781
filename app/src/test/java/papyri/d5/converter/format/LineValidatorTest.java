package papyri.d5.converter.format;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;
import org.junit.jupiter.api.Test;

class LineValidatorTest {

    @Test
    void acceptsWellFormedLines() {
        FormatterState state = FormatterState.withoutLanguages();

        assertThat(LineValidator.validateLine("]ΑΒΓ[", state)).isEqualTo("]ΑΒΓ[");
        assertThat(LineValidator.validateLine("Α[?]-ΑΜΕΝ-Ν\u0323Β", state)).isEqualTo("Α[?]-ΑΜΕΝ-Ν\u0323Β");
        assertThat(LineValidator.validateLine("Α ? Β", state)).isEqualTo("Α ? Β");
        assertThat(state.hasErrors()).isFalse();
    }

    @Test
    void correctsLatinLookAlikesInGreekDocuments() {
        FormatterState state = new FormatterState(Set.of("grc"));

        String corrected = LineValidator.validateLine("ABEHIKMOPTXYZ", state);

        assertThat(corrected).isEqualTo("ΑΒΕΗΙΚΜΟΡΤΧΥΖ");
        assertThat(state.hasErrors()).isFalse();
        assertThat(state.changes()).hasSize(1);
        assertThat(state.changes().get(0)).hasSize(13);
        assertThat(state.changes().get(0).get(0)).startsWith("Changed \"A\" to \"Α\"");
    }

    @Test
    void logsForbiddenCharactersAndEmptyBrackets() {
        FormatterState state = new FormatterState(Set.of("grc"));
        LineValidator.validateLine("ABEHIKMOPTXYZ", state);

        LineValidator.validateLine("ΑΒΓΔΕΦ093[]", state);

        assertThat(state.errorLog()).containsExactly(
                "Forbidden character(s) [0, 9, 3] found in \"ΑΒΓΔΕΦ093[]\"",
                "Contains \"[]\"");
    }

    @Test
    void leavesMixedLanguageDocumentsUncorrected() {
        FormatterState state = new FormatterState(Set.of("grc", "la"));

        String line = LineValidator.validateLine("ΑBΓ", state);

        assertThat(line).isEqualTo("ΑBΓ");
        assertThat(state.errorLog()).containsExactly("Forbidden character(s) [B] found in \"ΑBΓ\"");
        assertThat(state.changes()).isEmpty();
    }

    @Test
    void correctionKeepsErrorsOfEarlierLines() {
        FormatterState state = new FormatterState(Set.of("grc"));
        LineValidator.validateLine("Α9", state);

        LineValidator.validateLine("ΑB", state);

        assertThat(state.errorLog()).containsExactly("Forbidden character(s) [9] found in \"Α9\"");
    }

    @Test
    void reportsBadGapStructure() {
        FormatterState state = FormatterState.withoutLanguages();

        LineValidator.validateLine("[ΑΒ", state);

        assertThat(state.errorLog()).containsExactly("Invalid gap handling: [ΑΒ");
    }

    @Test
    void forbiddenCharactersAreDistinctAndOrdered() {
        assertThat(LineValidator.forbiddenCharacters("x9Αx1")).containsExactly("x", "9", "1");
        assertThat(LineValidator.forbiddenCharacters("Α\u2105\uD800\uDD79\u2627")).isEmpty();
    }
}
