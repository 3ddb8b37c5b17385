package org.hopkinson.utils.dataonly;

/**
 * Посылка наблюдателю: этап, роль импульса (если этап относится к одной роли) и сообщение.
 * @param stage этап конвейера
 * @param role роль импульса или {@code null}
 * @param details человекочитаемое описание результата
 */
public record AnalysisEvent(AnalysisStage stage, PulseRole role, String details) {

    public static AnalysisEvent of(AnalysisStage stage, String details) {
        return new AnalysisEvent(stage, null, details);
    }

    @Override public String toString() {
        return "[" + this.stage + (this.role == null ? "" : "/" + this.role) + "] " + this.details;
    }
}
