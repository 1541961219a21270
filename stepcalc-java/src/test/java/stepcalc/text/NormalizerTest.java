package stepcalc.text;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class NormalizerTest {

    @Test
    void replaces_math_glyphs() {
        assertEquals("2*3/6-1", Normalizer.normalize("2×3÷6−1"));
        assertEquals("3*4*5*6*7", Normalizer.normalize("3・4·5✕6✖7"));
        assertEquals("1-2-3", Normalizer.normalize("1–2—3"));
    }

    @Test
    void folds_full_width_forms() {
        assertEquals("123+4", Normalizer.normalize("１２３＋４"));
        assertEquals("8/2", Normalizer.normalize("８／２"));
        assertEquals("5%2", Normalizer.normalize("５％２"));
        assertEquals("2^3", Normalizer.normalize("２＾３"));
        assertEquals("1,000", Normalizer.normalize("１，０００"));
        assertEquals("(1)", Normalizer.normalize("（１）"));
        assertEquals("\\", Normalizer.normalize("￥"));
    }

    @Test
    void null_and_empty_are_empty() {
        assertEquals("", Normalizer.normalize(null));
        assertEquals("", Normalizer.normalize(""));
    }

    @Test
    void ascii_is_untouched() {
        assertEquals("1 + 2 * (3 - 4) / 5 % 6 ^ 7 ** 8", Normalizer.normalize("1 + 2 * (3 - 4) / 5 % 6 ^ 7 ** 8"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"2×3÷6−1", "１２３＋４", "￥１，０００・２", "abc ①", "ｱ ½"})
    void is_idempotent(String input) {
        String once = Normalizer.normalize(input);
        assertEquals(once, Normalizer.normalize(once));
    }
}
