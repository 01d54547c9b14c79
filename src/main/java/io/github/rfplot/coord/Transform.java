package io.github.rfplot.coord;

import org.hipparchus.linear.MatrixUtils;
import org.hipparchus.linear.RealMatrix;

/**
 * Invertible affine map from space {@code A} to space {@code B}, stored as a 3×3 homogeneous
 * matrix. Points are mapped with {@code w = 1}; vectors and sizes with {@code w = 0}, so they
 * only see the scale part.
 *
 * <p>Instances are immutable. Composition ({@link #then}) and inversion ({@link #inverse})
 * always produce new transforms.
 */
public final class Transform<A extends CoordinateSpace, B extends CoordinateSpace> {

    private final RealMatrix matrix;

    private Transform(final RealMatrix matrix) {
        this.matrix = matrix;
    }

    /**
     * Builds {@code (x, y) -> (sx·x + tx, sy·y + ty)}.
     */
    public static <A extends CoordinateSpace, B extends CoordinateSpace> Transform<A, B> scaleTranslate(
            final double sx, final double sy, final double tx, final double ty) {
        return new Transform<>(MatrixUtils.createRealMatrix(new double[][]{
                {sx, 0.0, tx},
                {0.0, sy, ty},
                {0.0, 0.0, 1.0}
        }));
    }

    public static <S extends CoordinateSpace> Transform<S, S> identity() {
        return new Transform<>(MatrixUtils.createRealIdentityMatrix(3));
    }

    /**
     * Returns the transform that applies {@code this} first and {@code next} second.
     */
    public <C extends CoordinateSpace> Transform<A, C> then(final Transform<B, C> next) {
        return new Transform<>(next.matrix.multiply(matrix));
    }

    /**
     * @throws org.hipparchus.exception.MathIllegalArgumentException if the matrix is singular
     *         (a zero-sized bounds rectangle)
     */
    public Transform<B, A> inverse() {
        return new Transform<>(MatrixUtils.inverse(matrix));
    }

    public Point<B> apply(final Point<A> p) {
        final var r = matrix.operate(new double[]{p.x(), p.y(), 1.0});
        return new Point<>(r[0], r[1]);
    }

    public Vector<B> apply(final Vector<A> v) {
        final var r = matrix.operate(new double[]{v.x(), v.y(), 0.0});
        return new Vector<>(r[0], r[1]);
    }

    public Size<B> apply(final Size<A> s) {
        final var r = matrix.operate(new double[]{s.width(), s.height(), 0.0});
        return new Size<>(r[0], r[1]);
    }

    public Rect<B> apply(final Rect<A> rect) {
        return new Rect<>(apply(rect.origin()), apply(rect.size()));
    }

    /**
     * Copy of the homogeneous matrix, row-major.
     */
    public double[][] toMatrix() {
        return matrix.getData();
    }

    @Override
    public String toString() {
        return "Transform" + matrix;
    }
}
