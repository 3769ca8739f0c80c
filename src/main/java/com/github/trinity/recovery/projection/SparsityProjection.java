package com.github.trinity.recovery.projection;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;
import com.github.trinity.recovery.exception.ConfigurationException;
import com.github.trinity.recovery.util.MatrixOps;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Hard thresholding: keeps the s entries of largest magnitude and zeroes the rest. Ties are
 * resolved in favour of the lower flattened index.
 *
 * @author Sean Phillips
 */
public class SparsityProjection implements Projection {

    private final int sparsity;

    public SparsityProjection(int sparsity) {
        if (sparsity < 1) {
            throw new ConfigurationException("Sparsity projection needs sparsity >= 1, got " + sparsity);
        }
        this.sparsity = sparsity;
    }

    @Override
    public RealMatrix project(RealMatrix x) {
        int rows = x.getRowDimension();
        int cols = x.getColumnDimension();
        double[] v = MatrixOps.vectorize(x);
        if (sparsity >= v.length) {
            return x.copy();
        }
        Integer[] order = IntStream.range(0, v.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> -Math.abs(v[i])));
        double[] out = new double[v.length];
        for (int k = 0; k < sparsity; k++) {
            out[order[k]] = v[order[k]];
        }
        return MatrixOps.reshape(out, rows, cols);
    }

    public int getSparsity() {
        return sparsity;
    }
}
