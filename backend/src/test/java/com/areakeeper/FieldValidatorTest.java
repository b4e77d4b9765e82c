package com.areakeeper;

import com.areakeeper.domain.ErrorKind;
import com.areakeeper.domain.ValueKind;
import com.areakeeper.service.validator.FieldOutcome;
import com.areakeeper.service.validator.FieldValidator;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@MicronautTest
class FieldValidatorTest {

    @Inject FieldValidator validator;

    // ── Integer ─────────────────────────────────────────────────────────────

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 42, 999_999, 1_000_000_000})
    void integer_inRange_returnsSameValueForNumberAndDigitString(int n) {
        FieldOutcome fromNumber = validator.validate(ValueKind.INTEGER, n);
        FieldOutcome fromString = validator.validate(ValueKind.INTEGER, String.valueOf(n));

        assertThat(fromNumber.isValid()).isTrue();
        assertThat(fromNumber.value()).isEqualTo(n);
        assertThat(fromString.value()).isEqualTo(n);
    }

    @Test
    void integer_negativeOrTooLarge_outOfRange() {
        assertThat(validator.validate(ValueKind.INTEGER, -1).error().kind()).isEqualTo(ErrorKind.OUT_OF_RANGE);
        assertThat(validator.validate(ValueKind.INTEGER, "-5").error().kind()).isEqualTo(ErrorKind.OUT_OF_RANGE);
        assertThat(validator.validate(ValueKind.INTEGER, 1_000_000_001L).error().kind())
            .isEqualTo(ErrorKind.OUT_OF_RANGE);
        assertThat(validator.validate(ValueKind.INTEGER, "99999999999999999999").error().kind())
            .isEqualTo(ErrorKind.OUT_OF_RANGE);
    }

    @Test
    void integer_fractionalOrText_typeMismatch() {
        assertThat(validator.validate(ValueKind.INTEGER, 1.5).error().kind()).isEqualTo(ErrorKind.TYPE_MISMATCH);
        assertThat(validator.validate(ValueKind.INTEGER, "12a").error().kind()).isEqualTo(ErrorKind.TYPE_MISMATCH);
    }

    @Test
    void integer_anyIntegralBoxedType_normalizedToInteger() {
        assertThat(validator.validate(ValueKind.INTEGER, 5L).value()).isInstanceOf(Integer.class).isEqualTo(5);
        assertThat(validator.validate(ValueKind.INTEGER, new java.math.BigInteger("12")).value()).isEqualTo(12);
    }

    @Test
    void integer_wholeDouble_accepted() {
        assertThat(validator.validate(ValueKind.INTEGER, 7.0).value()).isEqualTo(7);
    }

    // ── Number ──────────────────────────────────────────────────────────────

    @Test
    void number_roundsHalfUpToTwoPlaces() {
        assertThat(validator.validate(ValueKind.NUMBER, "12.345").value()).isEqualTo(new BigDecimal("12.35"));
        assertThat(validator.validate(ValueKind.NUMBER, 0.125).value()).isEqualTo(new BigDecimal("0.13"));
        assertThat(validator.validate(ValueKind.NUMBER, 3).value()).isEqualTo(new BigDecimal("3.00"));
    }

    @Test
    void number_outOfRangeAndMalformed() {
        assertThat(validator.validate(ValueKind.NUMBER, -0.5).error().kind()).isEqualTo(ErrorKind.OUT_OF_RANGE);
        assertThat(validator.validate(ValueKind.NUMBER, "1000000000.01").error().kind())
            .isEqualTo(ErrorKind.OUT_OF_RANGE);
        assertThat(validator.validate(ValueKind.NUMBER, "1.2.3").error().kind()).isEqualTo(ErrorKind.TYPE_MISMATCH);
        assertThat(validator.validate(ValueKind.NUMBER, Double.NaN).error().kind())
            .isEqualTo(ErrorKind.FORMAT_INVALID);
    }

    // ── Date ────────────────────────────────────────────────────────────────

    @Test
    void date_isoString_parsed() {
        assertThat(validator.validate(ValueKind.DATE, "2024-01-15").value()).isEqualTo(LocalDate.of(2024, 1, 15));
    }

    @Test
    void date_wrongShapeOrImpossibleDay_formatInvalid() {
        assertThat(validator.validate(ValueKind.DATE, "15/01/2024").error().kind())
            .isEqualTo(ErrorKind.FORMAT_INVALID);
        assertThat(validator.validate(ValueKind.DATE, "2023-02-29").error().kind())
            .isEqualTo(ErrorKind.FORMAT_INVALID);
    }

    // ── Text, URL, email, phone ─────────────────────────────────────────────

    @Test
    void text_trimmedAndNonEmpty() {
        assertThat(validator.validate(ValueKind.TEXT, "  Town  ").value()).isEqualTo("Town");
        assertThat(validator.validate(ValueKind.TEXT, "   ").error().kind()).isEqualTo(ErrorKind.FORMAT_INVALID);
        assertThat(validator.validate(ValueKind.TEXT, Map.of("a", 1)).error().kind())
            .isEqualTo(ErrorKind.TYPE_MISMATCH);
    }

    @Test
    void url_requiresSchemeAndHost() {
        assertThat(validator.validate(ValueKind.URL, "https://t.me/bitcoin").isValid()).isTrue();
        assertThat(validator.validate(ValueKind.URL, "t.me/bitcoin").error().kind())
            .isEqualTo(ErrorKind.FORMAT_INVALID);
        assertThat(validator.validate(ValueKind.URL, "http://bad host").error().kind())
            .isEqualTo(ErrorKind.FORMAT_INVALID);
    }

    @Test
    void email_validAndInvalid() {
        assertThat(validator.validate(ValueKind.EMAIL, "hello@example.org").isValid()).isTrue();
        assertThat(validator.validate(ValueKind.EMAIL, "hello@example").error().kind())
            .isEqualTo(ErrorKind.FORMAT_INVALID);
    }

    @Test
    void phone_punctuationStripped() {
        assertThat(validator.validate(ValueKind.PHONE, "+1 (555) 123-4567").value()).isEqualTo("+15551234567");
        assertThat(validator.validate(ValueKind.PHONE, "12345").error().kind()).isEqualTo(ErrorKind.FORMAT_INVALID);
    }

    // ── Select & missing ────────────────────────────────────────────────────

    @Test
    void select_caseInsensitiveReturnsRegistryCasing() {
        List<String> allowed = List.of("Africa", "Europe");

        assertThat(validator.validate(ValueKind.SELECT, "europe", allowed).value()).isEqualTo("Europe");
        assertThat(validator.validate(ValueKind.SELECT, "Atlantis", allowed).error().kind())
            .isEqualTo(ErrorKind.NOT_ALLOWED);
    }

    @Test
    void nullInput_missing() {
        assertThat(validator.validate(ValueKind.TEXT, null).error().kind()).isEqualTo(ErrorKind.MISSING);
    }
}
