package com.ai.tpr.matching;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class NormalizerTest {

    @Test
    @DisplayName("code prefix and ward suffix are stripped")
    void wardPrefixAndSuffix() {
        assertThat(Normalizer.normalize("ad Bille Ward", NameRole.WARD)).isEqualTo("BILLE");
    }

    @Test
    @DisplayName("LGA long-form suffix is stripped")
    void lgaSuffix() {
        assertThat(Normalizer.normalize("ad Fufore Local Government Area", NameRole.LGA)).isEqualTo("FUFORE");
        assertThat(Normalizer.normalize("Yola South LGA", NameRole.LGA)).isEqualTo("YOLA SOUTH");
    }

    @Test
    @DisplayName("state suffix and prefix are stripped")
    void stateSuffix() {
        assertThat(Normalizer.normalize("ad Adamawa State", NameRole.STATE)).isEqualTo("ADAMAWA");
    }

    @Test
    @DisplayName("punctuation becomes spaces, apostrophes vanish, whitespace collapses")
    void punctuationAndWhitespace() {
        assertThat(Normalizer.normalize("  Hosheri-Zum   ", NameRole.WARD)).isEqualTo("HOSHERI ZUM");
        assertThat(Normalizer.normalize("Mai'adua", NameRole.WARD)).isEqualTo("MAIADUA");
    }

    @Test
    @DisplayName("a lone suffix word is kept rather than emptied")
    void loneSuffixKept() {
        assertThat(Normalizer.normalize("Ward", NameRole.WARD)).isEqualTo("WARD");
    }

    @Test
    @DisplayName("blank and null input normalize to empty")
    void blank() {
        assertThat(Normalizer.normalize(null, NameRole.WARD)).isEmpty();
        assertThat(Normalizer.normalize("   ", NameRole.LGA)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"ad Bille Ward", "AD AB BILLE", "kn Gwale Ward Ward", "Hoseri Zum", "ad  ab  Ward",
            "Girei I", "xx Yola South Local Government Area"})
    @DisplayName("normalize is idempotent")
    void idempotent(String input) {
        for (NameRole role : NameRole.values()) {
            String once = Normalizer.normalize(input, role);
            assertThat(Normalizer.normalize(once, role)).isEqualTo(once);
        }
    }
}
