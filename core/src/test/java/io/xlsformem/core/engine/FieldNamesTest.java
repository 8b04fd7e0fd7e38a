package io.xlsformem.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FieldNamesTest {

    @Test
    void stripsEveryUnderscore() {
        assertThat(FieldNames.sanitize("user_first_name")).isEqualTo("userfirstname");
        assertThat(FieldNames.sanitize("_private__var_")).isEqualTo("privatevar");
    }

    @Test
    void leavesOtherNamesAlone() {
        assertThat(FieldNames.sanitize("age")).isEqualTo("age");
        assertThat(FieldNames.sanitize("age.NAOK")).isEqualTo("age.NAOK");
        assertThat(FieldNames.sanitize(null)).isNull();
    }
}
