package org.hopkinson.utils.dataonly;

/**
 * Ограничения на положение окна: окно не может начинаться раньше {@code lower}
 * и заканчиваться позже {@code upper}. {@code null}: ограничения нет.
 */
public record SearchBounds(Integer lower, Integer upper) {

    public static final SearchBounds NONE = new SearchBounds(null, null);

    public static SearchBounds from(int lower) {
        return new SearchBounds(lower, null);
    }

    public static SearchBounds until(int upper) {
        return new SearchBounds(null, upper);
    }

    public static SearchBounds between(int lower, int upper) {
        return new SearchBounds(lower, upper);
    }

    public boolean admits(PulseWindow window) {
        if (this.lower != null && window.startIndex() < this.lower) return false;
        return this.upper == null || window.endIndex() <= this.upper;
    }

    /**
     * Расширение границ на {@code margin} отсчётов в обе стороны
     * (отсутствующая граница так и остаётся отсутствующей).
     */
    public SearchBounds widenedBy(int margin) {
        Integer newLower = (this.lower == null) ? null : Math.max(0, this.lower - margin);
        Integer newUpper = (this.upper == null) ? null : this.upper + margin;
        return new SearchBounds(newLower, newUpper);
    }

    @Override public String toString() {
        return "[" + (this.lower == null ? "-" : this.lower) + ", "
                + (this.upper == null ? "-" : this.upper) + "]";
    }
}
