package org.hopkinson.utils.dataonly;

import org.hopkinson.utils.AnalysisValidationException;

/**
 * Один канал тензодатчика в том виде, в каком его отдал загрузчик.
 * Неизменяемый: массив копируется и на входе, и на выходе.
 * @param samples амплитуды (кадры)
 * @param samplingInterval время между соседними отсчётами (мс)
 * @param polarity каким знаком канал записывает сжатие: {@link Polarity#COMPRESSIVE} для обычной
 *                 схемы (сжатие вниз), {@link Polarity#TENSILE} для моста, подключённого наоборот
 */
public record RawSignal(double[] samples, double samplingInterval, Polarity polarity) {

    public RawSignal {
        if (samples == null || samples.length == 0) {
            throw new AnalysisValidationException("Сигнал не может быть пустым");
        }
        if (!(samplingInterval > 0)) {
            throw new AnalysisValidationException(
                    "Интервал дискретизации должен быть положительным: " + samplingInterval);
        }
        if (polarity == null) {
            throw new AnalysisValidationException("Полярность канала не задана");
        }
        samples = samples.clone();
    }

    @Override public double[] samples() {
        return this.samples.clone();
    }

    /**
     * Отсчёты в общем соглашении (сжатие отрицательное): канал с инвертированным мостом
     * переворачивается, остальные возвращаются как есть.
     */
    public double[] standardizedSamples() {
        double[] out = this.samples.clone();
        if (this.polarity == Polarity.TENSILE) {
            for (int i = 0; i < out.length; i++) out[i] = -out[i];
        }
        return out;
    }

    public int length() {
        return this.samples.length;
    }

    /**
     * Время i-го отсчёта от начала записи.
     */
    public double timeOfSample(int i) {
        return i * this.samplingInterval;
    }
}
