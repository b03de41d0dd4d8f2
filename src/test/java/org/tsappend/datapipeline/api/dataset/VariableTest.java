package org.tsappend.datapipeline.api.dataset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class VariableTest {

    @Test
    void rejectsDataThatDoesNotFillTheShape() {
        assertThatThrownBy(() -> Variable.of("t2m", List.of("time", "lat"), new int[]{2, 2}, new double[3]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requires 4 values");
    }

    @Test
    void rejectsRepeatedDimensions() {
        assertThatThrownBy(() -> Variable.of("t2m", List.of("time", "time"), new int[]{1, 1}, new double[1]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsChunksOfWrongRank() {
        Variable v = Variable.of("t2m", "time", 1.0, 2.0);

        assertThatThrownBy(() -> v.withChunks(new int[]{1, 1}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void getReadsRowMajor() {
        Variable v = Variable.of("z", List.of("time", "level"), new int[]{2, 3}, new double[]{0, 1, 2, 3, 4, 5});

        assertThat(v.get(1, 0)).isEqualTo(3.0);
        assertThat(v.get(0, 2)).isEqualTo(2.0);
        assertThat(v.lengthOf("level")).isEqualTo(3);
    }

    @Test
    void defaultFillValueIsNaN() {
        assertThat(Variable.of("t2m", "time", 1.0).getFillValue()).isNaN();
    }

    @Test
    void exposesCopiesOnly() {
        double[] data = {1, 2};
        Variable v = Variable.of("t2m", "time", data);
        data[0] = 99;
        v.getData()[1] = 99;

        assertThat(v.getData()).containsExactly(1.0, 2.0);
    }

    @Test
    void concatRequiresTheDimension() {
        Variable a = Variable.of("orog", "lat", 1.0);
        Variable b = Variable.of("orog", "lat", 2.0);

        assertThatThrownBy(() -> a.concat(b, "time"))
                .isInstanceOf(AxisMismatchException.class)
                .hasMessageContaining("does not span");
    }
}
