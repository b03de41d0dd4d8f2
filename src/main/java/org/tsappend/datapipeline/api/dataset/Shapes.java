package org.tsappend.datapipeline.api.dataset;

/**
 * Row-major array helpers shared by {@link Variable} and {@link Coordinate}.
 * <p>
 * An array of shape {@code [d0, d1, ..., dn]} is viewed along {@code axis} as
 * {@code outer x length x inner} blocks, where {@code outer} is the product of the
 * dimensions before the axis and {@code inner} the product of those after it.
 */
final class Shapes {

    private Shapes() {
    }

    static int size(int[] shape) {
        long size = 1;
        for (int d : shape) {
            if (d < 0) {
                throw new IllegalArgumentException("Negative dimension length: " + d);
            }
            size *= d;
        }
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Array too large: " + size + " elements");
        }
        return (int) size;
    }

    static int outer(int[] shape, int axis) {
        int outer = 1;
        for (int i = 0; i < axis; i++) {
            outer *= shape[i];
        }
        return outer;
    }

    static int inner(int[] shape, int axis) {
        int inner = 1;
        for (int i = axis + 1; i < shape.length; i++) {
            inner *= shape[i];
        }
        return inner;
    }

    static boolean sameExcept(int[] a, int[] b, int axis) {
        if (a.length != b.length) {
            return false;
        }
        for (int i = 0; i < a.length; i++) {
            if (i != axis && a[i] != b[i]) {
                return false;
            }
        }
        return true;
    }

    static double[] take(double[] src, int[] shape, int axis, int[] indices) {
        int outer = outer(shape, axis);
        int inner = inner(shape, axis);
        int length = shape[axis];
        double[] dst = new double[outer * indices.length * inner];
        int pos = 0;
        for (int o = 0; o < outer; o++) {
            for (int index : indices) {
                System.arraycopy(src, (o * length + index) * inner, dst, pos, inner);
                pos += inner;
            }
        }
        return dst;
    }

    static long[] take(long[] src, int[] shape, int axis, int[] indices) {
        int outer = outer(shape, axis);
        int inner = inner(shape, axis);
        int length = shape[axis];
        long[] dst = new long[outer * indices.length * inner];
        int pos = 0;
        for (int o = 0; o < outer; o++) {
            for (int index : indices) {
                System.arraycopy(src, (o * length + index) * inner, dst, pos, inner);
                pos += inner;
            }
        }
        return dst;
    }

    static double[] concat(double[] a, int[] aShape, double[] b, int[] bShape, int axis) {
        int outer = outer(aShape, axis);
        int inner = inner(aShape, axis);
        int aBlock = aShape[axis] * inner;
        int bBlock = bShape[axis] * inner;
        double[] dst = new double[a.length + b.length];
        int pos = 0;
        for (int o = 0; o < outer; o++) {
            System.arraycopy(a, o * aBlock, dst, pos, aBlock);
            pos += aBlock;
            System.arraycopy(b, o * bBlock, dst, pos, bBlock);
            pos += bBlock;
        }
        return dst;
    }

    static long[] concat(long[] a, int[] aShape, long[] b, int[] bShape, int axis) {
        int outer = outer(aShape, axis);
        int inner = inner(aShape, axis);
        int aBlock = aShape[axis] * inner;
        int bBlock = bShape[axis] * inner;
        long[] dst = new long[a.length + b.length];
        int pos = 0;
        for (int o = 0; o < outer; o++) {
            System.arraycopy(a, o * aBlock, dst, pos, aBlock);
            pos += aBlock;
            System.arraycopy(b, o * bBlock, dst, pos, bBlock);
            pos += bBlock;
        }
        return dst;
    }
}
