package org.tsappend.datapipeline.merge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.tsappend.datapipeline.TestDatasets.TIME;

import java.time.temporal.ChronoUnit;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tsappend.datapipeline.TestDatasets;
import org.tsappend.datapipeline.api.dataset.Coordinate;
import org.tsappend.datapipeline.api.dataset.Dataset;
import org.tsappend.datapipeline.api.dataset.NoOrderingCoordinateException;
import org.tsappend.datapipeline.api.dataset.Variable;

@Tag("unit")
class OrderingCoordinatesTest {

    @Test
    void findsTheCoordinateBoundToTheDimension() {
        Dataset grid = TestDatasets.grid("t2m", new long[]{0, 1}, 2, 2);

        assertThat(OrderingCoordinates.find(grid, TIME).getName()).isEqualTo(TIME);
    }

    @Test
    void coordinateNameMayDifferFromTheDimension() {
        Dataset ds = Dataset.builder()
                .coordinate(Coordinate.ordinal("valid_time", "step", new long[]{0, 6}, ChronoUnit.HOURS))
                .variable(Variable.of("t2m", "step", 1.0, 2.0))
                .build();

        assertThat(OrderingCoordinates.find(ds, "step").getName()).isEqualTo("valid_time");
    }

    @Test
    void failsWithoutCandidate() {
        Dataset ds = Dataset.builder().variable(Variable.of("t2m", TIME, 1.0)).build();

        assertThatThrownBy(() -> OrderingCoordinates.find(ds, TIME))
                .isInstanceOf(NoOrderingCoordinateException.class)
                .hasMessageContaining("Cannot determine coordinate");
    }

    @Test
    void failsWithTwoCandidates() {
        Dataset ds = Dataset.builder()
                .coordinate(Coordinate.ordinal("time", TIME, new long[]{0}, ChronoUnit.HOURS))
                .coordinate(Coordinate.ordinal("time_utc", TIME, new long[]{0}, ChronoUnit.HOURS))
                .build();

        assertThatThrownBy(() -> OrderingCoordinates.find(ds, TIME))
                .isInstanceOf(NoOrderingCoordinateException.class)
                .hasMessageContaining("Ambiguous");
    }

    @Test
    void failsForNumericCandidate() {
        Dataset ds = Dataset.builder()
                .coordinate(Coordinate.numeric(TIME, TIME, new double[]{0.5}))
                .build();

        assertThatThrownBy(() -> OrderingCoordinates.find(ds, TIME))
                .isInstanceOf(NoOrderingCoordinateException.class)
                .hasMessageContaining("not ordinal");
    }
}
