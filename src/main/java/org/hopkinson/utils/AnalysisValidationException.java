package org.hopkinson.utils;

/**
 * Ошибка валидации входа: массивы разной длины, параметр вне допустимого диапазона,
 * неизвестный метод анализа. Бросается сразу и внутри ядра не восстанавливается.
 */
public class AnalysisValidationException extends IllegalArgumentException {

    public AnalysisValidationException(String message) {
        super(message);
    }

    /**
     * Проверка, что все переданные массивы одной длины.
     * @param names имена массивов через запятую (для сообщения)
     * @param arrays сами массивы
     */
    public static void requireSameLength(String names, double[]... arrays) {
        int expected = arrays[0].length;
        for (double[] a : arrays) {
            if (a.length != expected) {
                StringBuilder got = new StringBuilder();
                for (int i = 0; i < arrays.length; i++) {
                    if (i > 0) got.append(", ");
                    got.append(arrays[i].length);
                }
                throw new AnalysisValidationException(
                        "Все массивы (" + names + ") должны быть одной длины, получено: " + got);
            }
        }
    }
}
