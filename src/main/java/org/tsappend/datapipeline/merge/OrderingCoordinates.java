package org.tsappend.datapipeline.merge;

import java.util.List;

import org.tsappend.datapipeline.api.dataset.Coordinate;
import org.tsappend.datapipeline.api.dataset.Dataset;
import org.tsappend.datapipeline.api.dataset.NoOrderingCoordinateException;

/**
 * Locates the coordinate that labels the ordering dimension.
 */
public final class OrderingCoordinates {

    private OrderingCoordinates() {
    }

    /**
     * Finds the single coordinate whose only dimension is {@code dimension}.
     *
     * @param dataset   dataset to search
     * @param dimension ordering dimension name
     * @return the ordering coordinate
     * @throws NoOrderingCoordinateException if there is no such coordinate, more than one, or
     *                                       the candidate is not ordinal
     */
    public static Coordinate find(Dataset dataset, String dimension) {
        List<Coordinate> candidates = dataset.getCoordinates().stream()
                .filter(c -> c.getDimensions().equals(List.of(dimension)))
                .toList();
        if (candidates.isEmpty()) {
            throw new NoOrderingCoordinateException("Cannot determine coordinate for dimension '" + dimension
                    + "'; coordinates present: " + dataset.getCoordinates().stream().map(Coordinate::getName).toList());
        }
        if (candidates.size() > 1) {
            throw new NoOrderingCoordinateException("Ambiguous coordinate for dimension '" + dimension + "': "
                    + candidates.stream().map(Coordinate::getName).toList());
        }
        Coordinate coordinate = candidates.get(0);
        if (!coordinate.isOrdinal()) {
            throw new NoOrderingCoordinateException("Coordinate '" + coordinate.getName()
                    + "' for dimension '" + dimension + "' is not ordinal");
        }
        return coordinate;
    }
}
