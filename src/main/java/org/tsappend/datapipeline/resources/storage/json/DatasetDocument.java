package org.tsappend.datapipeline.resources.storage.json;

import java.util.List;

/**
 * JSON shape of a dataset, shared by store metadata ({@code dataset.json}, no inline data) and
 * incoming input files (inline variable data).
 *
 * @param format      format marker, {@value DatasetJson#FORMAT} for stores
 * @param version     format version
 * @param coordinates coordinates in declaration order
 * @param variables   variables in declaration order
 */
public record DatasetDocument(String format, int version, List<CoordinateDocument> coordinates,
                              List<VariableDocument> variables) {

    /**
     * @param name       coordinate name
     * @param dimensions dimension names, outermost first
     * @param shape      length per dimension; derived from the values for 1-D coordinates when absent
     * @param unit       {@link java.time.temporal.ChronoUnit} name of one ordinal step; present for ordinal coordinates
     * @param ordinals   ordinal values
     * @param instants   ISO-8601 instants, converted to ordinals in {@code unit} since the epoch
     * @param values     numeric values
     */
    public record CoordinateDocument(String name, List<String> dimensions, int[] shape, String unit,
                                     long[] ordinals, List<String> instants, double[] values) {
    }

    /**
     * @param name       variable name
     * @param dimensions dimension names, outermost first
     * @param shape      length per dimension
     * @param fillValue  fill value, {@code NaN} when absent
     * @param chunks     chunk size per dimension (stores only)
     * @param compressor bound compressor (stores only)
     * @param data       row-major values, {@code null} entries meaning the fill value (input files only)
     */
    public record VariableDocument(String name, List<String> dimensions, int[] shape, Double fillValue,
                                   int[] chunks, CompressorDocument compressor, Double[] data) {
    }

    /**
     * @param codec codec name
     * @param level compression level
     */
    public record CompressorDocument(String codec, int level) {
    }
}
