package org.silica.compiler.elaboration;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.silica.compiler.elaboration.ConstantValue.IntegerValue;
import org.silica.compiler.elaboration.ConstantValue.RealValue;
import org.silica.compiler.elaboration.ConstantValue.StringValue;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ParameterOverridesTest {

    @Test
    void parsesValuesOfEveryKind() {
        ParameterOverrides overrides = ParameterOverrides.parse(List.of(
                "W=16", "MASK = 8'hF0", "RATIO=2.5", "NAME=\"core\"", "MODE=fast"));

        assertThat(overrides.find("W")).contains(IntegerValue.of(16));
        assertThat(overrides.find("MASK")).contains(IntegerValue.of(BigInteger.valueOf(0xF0), 8, false));
        assertThat(overrides.find("RATIO")).contains(new RealValue(2.5));
        assertThat(overrides.find("NAME")).contains(new StringValue("core"));
        assertThat(overrides.find("MODE")).contains(new StringValue("fast"));
    }

    @Test
    void dottedNamesBuildTheInstanceTree() {
        ParameterOverrides overrides = ParameterOverrides.parse(List.of("u1.sub.D=3", "u1.E=4", "F=5"));

        assertThat(overrides.find("F")).isPresent();
        assertThat(overrides.find("D")).isEmpty();
        assertThat(overrides.child("u1").find("E")).contains(IntegerValue.of(4));
        assertThat(overrides.child("u1").child("sub").find("D")).contains(IntegerValue.of(3));
        assertThat(overrides.child("u2").isEmpty()).isTrue();
    }

    @Test
    void laterAssignmentOfTheSameNameWins() {
        ParameterOverrides overrides = ParameterOverrides.parse(List.of("W=1", "W=2"));

        assertThat(overrides.find("W")).contains(IntegerValue.of(2));
    }

    @Test
    void malformedEntriesAreRejected() {
        assertThatThrownBy(() -> ParameterOverrides.parse(List.of("W")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("NAME=VALUE");
        assertThatThrownBy(() -> ParameterOverrides.parse(List.of("=5")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ParameterOverrides.parse(List.of("u1.=5")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Missing parameter name");
    }

    @Test
    void ofAndWithChild() {
        ParameterOverrides child = ParameterOverrides.of(Map.of("X", IntegerValue.of(7)));
        ParameterOverrides overrides = ParameterOverrides.empty().withChild("inst", child);

        assertThat(overrides.getValues()).isEmpty();
        assertThat(overrides.isEmpty()).isFalse();
        assertThat(overrides.child("inst").find("X")).contains(IntegerValue.of(7));
    }
}
