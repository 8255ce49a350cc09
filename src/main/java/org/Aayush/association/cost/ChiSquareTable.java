package org.Aayush.association.cost;

import lombok.experimental.UtilityClass;

/**
 * 0.95 quantiles of the chi-square distribution, indexed by degrees of freedom.
 */
@UtilityClass
public class ChiSquareTable {
    public static final int MIN_DEGREES_OF_FREEDOM = 1;
    public static final int MAX_DEGREES_OF_FREEDOM = 9;

    private static final double[] INV_95 = {
            Double.NaN,
            3.8415,
            5.9915,
            7.8147,
            9.4877,
            11.070,
            12.592,
            14.067,
            15.507,
            16.919
    };

    /**
     * Returns the 95% critical value for {@code degreesOfFreedom} in {@code [1, 9]}.
     */
    public double inverse95(int degreesOfFreedom) {
        if (degreesOfFreedom < MIN_DEGREES_OF_FREEDOM || degreesOfFreedom > MAX_DEGREES_OF_FREEDOM) {
            throw new IllegalArgumentException(
                    "degreesOfFreedom must be in [" + MIN_DEGREES_OF_FREEDOM + ", " + MAX_DEGREES_OF_FREEDOM
                            + "], got " + degreesOfFreedom
            );
        }
        return INV_95[degreesOfFreedom];
    }

    /**
     * Gating threshold for box measurements: 2 DOF for position only, 4 DOF otherwise.
     */
    public double gatingThreshold(boolean onlyPosition) {
        return inverse95(onlyPosition ? 2 : 4);
    }
}
