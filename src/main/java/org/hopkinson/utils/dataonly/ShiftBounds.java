package org.hopkinson.utils.dataonly;

import org.hopkinson.utils.AnalysisValidationException;

/**
 * Допустимый диапазон целочисленного сдвига (включительно) при выравнивании.
 */
public record ShiftBounds(int min, int max) {

    public ShiftBounds {
        if (max < min) {
            throw new AnalysisValidationException(
                    "Границы сдвига перепутаны: (" + min + ", " + max + ")");
        }
    }

    /**
     * ±N/2 — диапазон по умолчанию для сегментов длины N.
     */
    public static ShiftBounds symmetric(int segmentLength) {
        return new ShiftBounds(-(segmentLength / 2), segmentLength / 2);
    }

    public boolean contains(int shift) {
        return shift >= this.min && shift <= this.max;
    }

    public int clamp(long shift) {
        return (int) Math.max(this.min, Math.min(this.max, shift));
    }
}
