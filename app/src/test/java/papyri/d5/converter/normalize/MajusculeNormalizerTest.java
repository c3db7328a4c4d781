package papyri.d5.converter.normalize;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MajusculeNormalizerTest {

    @Test
    void mapsAccentedLowercaseToBareCapitals() {
        assertThat(MajusculeNormalizer.normalize("Ἀλέξανδρος")).isEqualTo("ΑΛΕΞΑΝΔΡΟΣ");
        assertThat(MajusculeNormalizer.normalize("ᾠδῇ")).isEqualTo("ΩΔΗ");
    }

    @Test
    void mapsSigmaVariantsAndKeepsDigammaAndStigma() {
        assertThat(MajusculeNormalizer.normalize("ςϲϹ")).isEqualTo("ΣΣΣ");
        assertThat(MajusculeNormalizer.normalize("ϝϛ")).isEqualTo("ϜϚ");
    }

    @Test
    void stripsPunctuationWhitespaceAndInputDiacritics() {
        assertThat(MajusculeNormalizer.normalize("τοῦ, καὶ.\n (ἐν)")).isEqualTo("ΤΟΥΚΑΙΕΝ");
        assertThat(MajusculeNormalizer.normalize("α\u0342β\u0306")).isEqualTo("ΑΒ");
    }

    @Test
    void leavesCharactersOutsideTheInputAlphabetUntouched() {
        assertThat(MajusculeNormalizer.normalize("abc[?]")).isEqualTo("abc[?]");
        assertThat(MajusculeNormalizer.normalize("")).isEmpty();
    }

    @Test
    void isIdempotent() {
        String once = MajusculeNormalizer.normalize("Ὀξυρυγχίτου νομοῦ\u00B7 ἔτους ϛ");
        assertThat(MajusculeNormalizer.normalize(once)).isEqualTo(once);
    }

    @Test
    void outputAlphabetIsClosedUnderNormalization() {
        String alphabet = MajusculeNormalizer.OUTPUT_ALPHABET;
        assertThat(MajusculeNormalizer.normalize(alphabet)).isEqualTo(alphabet);
    }
}
