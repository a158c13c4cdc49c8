package org.javai.formula.contrast;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * Dense matrix helpers over {@code double[rows][columns]} arrays. Decompositions
 * are delegated to Commons Math.
 */
public final class Matrices {

    private Matrices() {
    }

    public static double[][] identity(int n) {
        return MatrixUtils.createRealIdentityMatrix(n).getData();
    }

    public static double[][] copy(double[][] mat) {
        double[][] copy = new double[mat.length][];
        for (int i = 0; i < mat.length; i++) {
            copy[i] = mat[i].clone();
        }
        return copy;
    }

    public static int columns(double[][] mat) {
        return mat.length == 0 ? 0 : mat[0].length;
    }

    /**
     * Moore-Penrose pseudo-inverse, computed from the singular value decomposition.
     */
    public static double[][] pseudoInverse(double[][] mat) {
        if (isEmpty(mat)) {
            return new double[columns(mat)][mat.length];
        }
        return svd(mat).getSolver().getInverse().getData();
    }

    /**
     * Numerical rank: the number of singular values above a tolerance relative to
     * the largest one.
     */
    public static int rank(double[][] mat) {
        return isEmpty(mat) ? 0 : svd(mat).getRank();
    }

    private static SingularValueDecomposition svd(double[][] mat) {
        RealMatrix real = MatrixUtils.createRealMatrix(mat);
        return new SingularValueDecomposition(real);
    }

    private static boolean isEmpty(double[][] mat) {
        return mat.length == 0 || columns(mat) == 0;
    }
}
