package org.hopkinson.utils.dataonly;

/**
 * Этапы конвейера, о которых оповещаются наблюдатели.
 */
public enum AnalysisStage {
    DETECTION,
    SEGMENTATION,
    ALIGNMENT,
    STRESS_STRAIN,
    EQUILIBRIUM,
    TAPER,
    FINISHED,
    FAILED
}
