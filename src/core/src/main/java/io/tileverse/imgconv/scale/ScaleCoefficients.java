/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.imgconv.scale;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the linear resampling coefficients used by the {@link Scaler} on
 * each axis.
 * <p>
 * Both axes are mapped onto the integer space {@code [0, (s-1)*(d-1)*2]}, in
 * which the first and last samples of the source and destination axes coincide.
 * Source samples are {@code (d-1)*2} apart and destination samples are
 * {@code (s-1)*2} apart; the factor of two makes the midpoints between
 * neighbouring samples representable too, so all positions are exact and only
 * the final weights are rounded.
 * <p>
 * The returned lists are immutable and sorted by destination index, then by
 * source index.
 *
 * @see CoefficientCache
 */
public final class ScaleCoefficients {

    private ScaleCoefficients() {
        // utility class
    }

    /**
     * Computes the coefficients mapping an axis of {@code sourceLen} samples onto
     * one of {@code destLen} samples.
     *
     * @param sourceLen number of source samples
     * @param destLen number of destination samples
     * @return the coefficients, empty if either length is zero
     * @throws IllegalArgumentException if a length is negative
     */
    public static List<ScaleCoefficient> compute(int sourceLen, int destLen) {
        if (sourceLen < 0 || destLen < 0) {
            throw new IllegalArgumentException("Lengths cannot be negative: " + sourceLen + " -> " + destLen);
        }
        if (sourceLen == 0 || destLen == 0) {
            return List.of();
        }
        List<ScaleCoefficient> coefficients = new ArrayList<>(sourceLen + destLen);
        if (sourceLen == destLen) {
            for (int i = 0; i < sourceLen; i++) {
                coefficients.add(new ScaleCoefficient(i, i, 1f));
            }
        } else if (sourceLen == 1) {
            for (int d = 0; d < destLen; d++) {
                coefficients.add(new ScaleCoefficient(0, d, 1f));
            }
        } else if (destLen == 1) {
            final float weight = 1f / sourceLen;
            for (int s = 0; s < sourceLen; s++) {
                coefficients.add(new ScaleCoefficient(s, 0, weight));
            }
        } else if (destLen > sourceLen) {
            upscale(sourceLen, destLen, coefficients);
        } else {
            downscale(sourceLen, destLen, coefficients);
        }
        return List.copyOf(coefficients);
    }

    /**
     * Computes how many source samples must be retained behind the most recently
     * consumed one to apply the coefficients in destination order.
     *
     * @param coefficients coefficients in destination order
     * @return {@code max(highestSourceIndexSoFar - sourceIndex)}, zero for an empty list
     */
    public static int historyDepth(List<ScaleCoefficient> coefficients) {
        int highest = 0;
        int depth = 0;
        for (ScaleCoefficient c : coefficients) {
            highest = Math.max(highest, c.sourceIndex());
            depth = Math.max(depth, highest - c.sourceIndex());
        }
        return depth;
    }

    /**
     * Returns the coefficients from the {@link CoefficientCache#getDefault() default cache}.
     *
     * @param sourceLen number of source samples
     * @param destLen number of destination samples
     * @return the shared, immutable coefficients
     */
    public static List<ScaleCoefficient> cached(int sourceLen, int destLen) {
        return CoefficientCache.getDefault().get(sourceLen, destLen);
    }

    /**
     * Each destination sample lies between two source samples and takes from
     * each of them in inverse proportion to its distance.
     */
    private static void upscale(int sourceLen, int destLen, List<ScaleCoefficient> out) {
        final long space = (long) (sourceLen - 1) * (destLen - 1) * 2;
        final long srcstep = (long) (destLen - 1) * 2;
        final long dststep = (long) (sourceLen - 1) * 2;

        for (long dst = 0; dst <= space; dst += dststep) {
            final int d = (int) (dst / dststep);
            if (dst % srcstep == 0) {
                out.add(new ScaleCoefficient((int) (dst / srcstep), d, 1f));
                continue;
            }
            final long prec = lowerMultiple(dst, srcstep);
            final long succ = upperMultiple(dst, srcstep);
            final float precDistance = dst - prec;
            final float succDistance = succ - dst;
            final float whole = precDistance + succDistance;

            out.add(new ScaleCoefficient((int) (prec / srcstep), d, succDistance / whole));
            out.add(new ScaleCoefficient((int) (succ / srcstep), d, precDistance / whole));
        }
    }

    /**
     * Each destination sample covers an interval of the source axis, half a
     * destination step on each side (clipped at both ends). Every source sample
     * covers half a source step on each side, and contributes the length of its
     * overlap with the destination interval, normalised by the interval length.
     */
    private static void downscale(int sourceLen, int destLen, List<ScaleCoefficient> out) {
        final long space = (long) (sourceLen - 1) * (destLen - 1) * 2;
        final long srcstep = (long) (destLen - 1) * 2;
        final long dststep = (long) (sourceLen - 1) * 2;

        for (long dst = 0; dst <= space; dst += dststep) {
            int firstIdx = 0;
            int lastIdx = sourceLen - 1;
            long firstStart = 0;
            long lastStart = space - srcstep / 2;

            if (dst != 0) {
                firstStart = lowerMultiple(dst - dststep / 2 + srcstep / 2, srcstep);
                firstIdx = (int) (firstStart / srcstep);
                firstStart -= srcstep / 2;
            }
            if (dst != space) {
                lastStart = upperMultiple(dst + dststep / 2 - srcstep / 2, srcstep);
                lastIdx = (int) (lastStart / srcstep);
                lastStart -= srcstep / 2;
            }

            long dstStart = dst;
            long dstRange = dststep;
            if (dst == 0 || dst == space) {
                dstRange /= 2;
            }

            long firstRange = srcstep / 2;
            if (dst != 0) {
                dstStart -= dststep / 2;
                firstRange = firstStart + srcstep - dstStart;
            }

            long lastRange = srcstep / 2;
            if (dst != space) {
                lastRange = dstStart + dstRange - lastStart;
            }

            assert dstRange == firstRange + lastRange + srcstep * (lastIdx - firstIdx - 1);

            final int d = (int) (dst / dststep);
            final float midWeight = (float) srcstep / dstRange;
            out.add(new ScaleCoefficient(firstIdx, d, (float) firstRange / dstRange));
            for (int s = firstIdx + 1; s < lastIdx; s++) {
                out.add(new ScaleCoefficient(s, d, midWeight));
            }
            out.add(new ScaleCoefficient(lastIdx, d, (float) lastRange / dstRange));
        }
    }

    static long lowerMultiple(long value, long step) {
        return value - value % step;
    }

    static long upperMultiple(long value, long step) {
        long rem = value % step;
        return rem == 0 ? value : value - rem + step;
    }
}
