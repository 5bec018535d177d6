package com.aclforge.compiler.validation;

import com.aclforge.api.exceptions.DuplicateNameException;
import com.aclforge.api.exceptions.NameTooLongException;
import com.aclforge.api.exceptions.ValidationException;
import com.aclforge.api.model.Action;
import com.aclforge.api.model.Term;
import com.aclforge.api.model.TermField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.Period;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TermValidatorTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 6, 1);
    private static final Period TWO_WEEKS = Period.ofWeeks(2);

    private TermValidator validator;

    @BeforeEach
    void setUp() {
        validator = new TermValidator();
    }

    private static Term expiring(LocalDate date) {
        return Term.builder("t").action(Action.ACCEPT).expiration(date).build();
    }

    @Test
    @DisplayName("Should reject the first repeated term name")
    void shouldRejectDuplicateNames() {
        List<Term> terms = List.of(
                Term.builder("allow-web").build(),
                Term.builder("allow-dns").build(),
                Term.builder("allow-web").build());

        assertThatThrownBy(() -> validator.checkDuplicateNames(terms))
                .isInstanceOf(DuplicateNameException.class)
                .hasMessageContaining("allow-web");
    }

    @Test
    @DisplayName("Expiration on or before today is a skip")
    void expiredTermsShouldBeSkipped() {
        assertThat(validator.checkExpiration(expiring(TODAY), TODAY, TWO_WEEKS)).isEqualTo(ExpirationStatus.SKIP);
        assertThat(validator.checkExpiration(expiring(TODAY.minusDays(3)), TODAY, TWO_WEEKS))
                .isEqualTo(ExpirationStatus.SKIP);
    }

    @Test
    @DisplayName("Expiration within the warn window is a warning")
    void soonExpiringTermsShouldWarn() {
        assertThat(validator.checkExpiration(expiring(TODAY.plusDays(1)), TODAY, TWO_WEEKS))
                .isEqualTo(ExpirationStatus.WARN);
        assertThat(validator.checkExpiration(expiring(TODAY.plusWeeks(2)), TODAY, TWO_WEEKS))
                .isEqualTo(ExpirationStatus.WARN);
        assertThat(validator.checkExpiration(expiring(TODAY.plusWeeks(2).plusDays(1)), TODAY, TWO_WEEKS))
                .isEqualTo(ExpirationStatus.OK);
        assertThat(validator.checkExpiration(Term.builder("t").build(), TODAY, TWO_WEEKS))
                .isEqualTo(ExpirationStatus.OK);
    }

    @Test
    @DisplayName("Should name every unsupported keyword")
    void shouldRejectUnsupportedKeywords() {
        Term term = Term.builder("t").action(Action.ACCEPT).counter("c").policer("p").build();

        assertThatThrownBy(() -> validator.checkSupportedKeywords(term, TermField.required()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("counter")
                .hasMessageContaining("policer");

        EnumSet<TermField> supported = EnumSet.copyOf(TermField.required());
        supported.add(TermField.COUNTER);
        supported.add(TermField.POLICER);
        assertThatCode(() -> validator.checkSupportedKeywords(term, supported)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Names within the limit are unchanged")
    void shortNamesShouldBeUnchanged() {
        assertThat(validator.fitIdentifier("allow-web", 24, true)).isEqualTo("allow-web");
    }

    @Test
    @DisplayName("Abbreviations apply in table order until the name fits")
    void shouldAbbreviateInOrder() {
        String fitted = validator.fitIdentifier("deny-bogons-from-internet", 24, true);

        // "bogons" is tried first and already makes it fit; "internet" stays
        assertThat(fitted).isEqualTo("deny-BGN-from-internet");
    }

    @Test
    @DisplayName("Should fail with both names when abbreviations are exhausted")
    void shouldFailWhenStillTooLong() {
        String name = "permit-everything-to-the-datacenter";

        assertThatThrownBy(() -> validator.fitIdentifier(name, 24, true))
                .isInstanceOf(NameTooLongException.class)
                .satisfies(e -> {
                    NameTooLongException error = (NameTooLongException) e;
                    assertThat(error.getOriginalName()).isEqualTo(name);
                    assertThat(error.getMaxLength()).isEqualTo(24);
                });
    }

    @Test
    @DisplayName("Abbreviation is not applied unless allowed")
    void shouldNotAbbreviateWhenDisallowed() {
        assertThatThrownBy(() -> validator.fitIdentifier("deny-bogons-from-internet", 24, false))
                .isInstanceOf(NameTooLongException.class);
    }

    @Test
    @DisplayName("Fitting an already fitted name is a no-op")
    void fitIdentifierShouldBeIdempotent() {
        for (String name : List.of("accept-established-replies", "reject-internal-customer-service",
                "bogons", "permit-google-transit-router")) {
            String once = validator.fitIdentifier(name, 24, true);
            assertThat(validator.fitIdentifier(once, 24, true)).isEqualTo(once);
        }
    }
}
