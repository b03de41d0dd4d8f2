package org.tsappend.datapipeline.resources.storage.json;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.tsappend.datapipeline.api.dataset.CompressionSpec;
import org.tsappend.datapipeline.api.dataset.Coordinate;
import org.tsappend.datapipeline.api.dataset.Dataset;
import org.tsappend.datapipeline.api.dataset.Variable;
import org.tsappend.datapipeline.resources.storage.json.DatasetDocument.CompressorDocument;
import org.tsappend.datapipeline.resources.storage.json.DatasetDocument.CoordinateDocument;
import org.tsappend.datapipeline.resources.storage.json.DatasetDocument.VariableDocument;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Converts between {@link Dataset} and {@link DatasetDocument} and (de)serializes documents
 * with Gson.
 * <p>
 * Special floating point values ({@code NaN}, infinities) are written as bare tokens, which
 * Gson reads back leniently.
 */
public final class DatasetJson {

    public static final String FORMAT = "tsappend-store";
    public static final int VERSION = 1;

    private static final Gson GSON = new GsonBuilder()
            .serializeSpecialFloatingPointValues()
            .setPrettyPrinting()
            .create();

    private DatasetJson() {
    }

    public static DatasetDocument read(Reader reader) throws IOException {
        try {
            DatasetDocument document = GSON.fromJson(reader, DatasetDocument.class);
            if (document == null) {
                throw new IOException("Empty dataset document");
            }
            return document;
        } catch (JsonParseException e) {
            throw new IOException("Malformed dataset document: " + e.getMessage(), e);
        }
    }

    public static void write(DatasetDocument document, Writer writer) throws IOException {
        try {
            GSON.toJson(document, writer);
        } catch (com.google.gson.JsonIOException e) {
            throw new IOException("Failed to write dataset document", e);
        }
    }

    /**
     * Builds the document for a dataset.
     *
     * @param dataset     dataset to describe
     * @param includeData whether variable values are inlined
     * @return the document
     */
    public static DatasetDocument toDocument(Dataset dataset, boolean includeData) {
        List<CoordinateDocument> coordinates = new ArrayList<>();
        for (Coordinate c : dataset.getCoordinates()) {
            coordinates.add(new CoordinateDocument(c.getName(), c.getDimensions(), c.getShape(),
                    c.isOrdinal() ? c.getUnit().name() : null,
                    c.isOrdinal() ? c.getOrdinals() : null,
                    null,
                    c.isOrdinal() ? null : c.getValues()));
        }
        List<VariableDocument> variables = new ArrayList<>();
        for (Variable v : dataset.getVariables()) {
            CompressionSpec compressor = v.getCompressor();
            variables.add(new VariableDocument(v.getName(), v.getDimensions(), v.getShape(), v.getFillValue(),
                    v.getChunks(),
                    compressor == null ? null : new CompressorDocument(compressor.codec(), compressor.level()),
                    includeData ? box(v.getData()) : null));
        }
        return new DatasetDocument(FORMAT, VERSION, coordinates, variables);
    }

    /**
     * Builds the dataset a document describes. Variables without inline data are created from
     * {@code dataSource}.
     *
     * @param document   parsed document
     * @param dataSource supplies values for variables whose document has no {@code data}
     * @return the dataset
     * @throws IOException if the document is inconsistent
     */
    public static Dataset toDataset(DatasetDocument document, VariableDataSource dataSource) throws IOException {
        Dataset.Builder builder = Dataset.builder();
        try {
            for (CoordinateDocument c : nonNull(document.coordinates())) {
                builder.coordinate(toCoordinate(c));
            }
            for (VariableDocument v : nonNull(document.variables())) {
                requireField(v.name(), "variable name");
                requireField(v.dimensions(), "dimensions of variable '" + v.name() + "'");
                int[] shape = requireField(v.shape(), "shape of variable '" + v.name() + "'");
                double fill = v.fillValue() == null ? Double.NaN : v.fillValue();
                double[] data = v.data() != null ? unbox(v.data(), fill) : dataSource.load(v, fill);
                Variable variable = Variable.of(v.name(), v.dimensions(), shape, data).withFillValue(fill);
                if (v.chunks() != null) {
                    variable = variable.withChunks(v.chunks());
                }
                if (v.compressor() != null) {
                    variable = variable.withCompressor(new CompressionSpec(v.compressor().codec(), v.compressor().level()));
                }
                builder.variable(variable);
            }
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid dataset document: " + e.getMessage(), e);
        }
        return builder.build();
    }

    /**
     * Supplies the values of a variable stored outside its document.
     */
    @FunctionalInterface
    public interface VariableDataSource {

        /**
         * @param variable  the variable's document
         * @param fillValue resolved fill value
         * @return row-major values
         */
        double[] load(VariableDocument variable, double fillValue) throws IOException;
    }

    private static Coordinate toCoordinate(CoordinateDocument c) throws IOException {
        requireField(c.name(), "coordinate name");
        List<String> dimensions = requireField(c.dimensions(), "dimensions of coordinate '" + c.name() + "'");
        if (c.unit() != null) {
            if (dimensions.size() != 1) {
                throw new IOException("Ordinal coordinate '" + c.name() + "' must be one-dimensional");
            }
            ChronoUnit unit = parseUnit(c.unit());
            long[] ordinals = c.ordinals() != null ? c.ordinals() : fromInstants(c, unit);
            return Coordinate.ordinal(c.name(), dimensions.get(0), ordinals, unit);
        }
        double[] values = requireField(c.values(), "values of coordinate '" + c.name() + "'");
        int[] shape = c.shape() != null ? c.shape() : new int[]{values.length};
        return Coordinate.numeric(c.name(), dimensions, shape, values);
    }

    private static long[] fromInstants(CoordinateDocument c, ChronoUnit unit) throws IOException {
        List<String> instants = requireField(c.instants(), "ordinals or instants of coordinate '" + c.name() + "'");
        long[] ordinals = new long[instants.size()];
        try {
            for (int i = 0; i < ordinals.length; i++) {
                ordinals[i] = unit.between(Instant.EPOCH, Instant.parse(instants.get(i)));
            }
        } catch (DateTimeException | ArithmeticException e) {
            throw new IOException("Invalid instant in coordinate '" + c.name() + "': " + e.getMessage(), e);
        }
        return ordinals;
    }

    /**
     * Ordinal units are fixed-length steps on the UTC timeline: NANOS through DAYS. Weeks and
     * calendar units (months, years and up) are rejected.
     */
    static ChronoUnit parseUnit(String unit) throws IOException {
        ChronoUnit parsed;
        try {
            parsed = ChronoUnit.valueOf(unit.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IOException("Unknown ordinal unit: " + unit, e);
        }
        if (parsed.compareTo(ChronoUnit.DAYS) > 0) {
            throw new IOException("Unsupported ordinal unit: " + unit + " (expected NANOS through DAYS)");
        }
        return parsed;
    }

    private static <T> T requireField(T value, String what) throws IOException {
        if (value == null) {
            throw new IOException("Missing " + what);
        }
        return value;
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static Double[] box(double[] values) {
        Double[] boxed = new Double[values.length];
        for (int i = 0; i < values.length; i++) {
            boxed[i] = values[i];
        }
        return boxed;
    }

    private static double[] unbox(Double[] values, double fill) {
        double[] unboxed = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            unboxed[i] = values[i] == null ? fill : values[i];
        }
        return unboxed;
    }
}
