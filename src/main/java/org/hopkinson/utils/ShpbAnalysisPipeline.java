package org.hopkinson.utils;

import org.hopkinson.utils.dataonly.AlignmentResult;
import org.hopkinson.utils.dataonly.AnalysisConfig;
import org.hopkinson.utils.dataonly.AnalysisEvent;
import org.hopkinson.utils.dataonly.AnalysisObserver;
import org.hopkinson.utils.dataonly.AnalysisReport;
import org.hopkinson.utils.dataonly.AnalysisStage;
import org.hopkinson.utils.dataonly.AnalysisSubject;
import org.hopkinson.utils.dataonly.EquilibriumMetrics;
import org.hopkinson.utils.dataonly.PulseRole;
import org.hopkinson.utils.dataonly.PulseSet;
import org.hopkinson.utils.dataonly.PulseWindow;
import org.hopkinson.utils.dataonly.RawSignal;
import org.hopkinson.utils.dataonly.RoleDetection;
import org.hopkinson.utils.dataonly.StressStrainCurve;
import org.hopkinson.utils.dataonly.ValidityAssessment;
import org.hopkinson.utils.pulsesolver.AnalysisMethod;
import org.hopkinson.utils.pulsesolver.CancellationToken;
import org.hopkinson.utils.pulsesolver.PulseAligner;
import org.hopkinson.utils.pulsesolver.PulseDetector;
import org.hopkinson.utils.pulsesolver.PulseExtractor;
import org.hopkinson.utils.pulsesolver.StressStrainCalculator;
import org.hopkinson.utils.pulsesolver.TaperWindow;
import org.hopkinson.utils.pulsesolver.ValidityAssessor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Главный класс-субъект: проводит один эксперимент от сырых сигналов до заключения о пригодности.
 * <br>Поиск → сегментация → выравнивание → кривые всех методов → равновесие → (окно Тьюки).</br>
 * <br>Три поиска окон независимы и идут параллельно, остальное — последовательно.
 * О каждом этапе оповещаются наблюдатели.</br>
 * @see LoggingAnalysisObserver
 */
public class ShpbAnalysisPipeline implements AnalysisSubject, AutoCloseable {

    private final List<AnalysisObserver> observers = new CopyOnWriteArrayList<>();

    private final AnalysisConfig config;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    /**
     * Конвейер со своим пулом на три потока (по одному на роль импульса).
     */
    public ShpbAnalysisPipeline(AnalysisConfig config) {
        this(config, Executors.newFixedThreadPool(PulseRole.values().length), true);
    }

    /**
     * Конвейер на внешнем пуле (закрывать его — забота вызывающего).
     */
    public ShpbAnalysisPipeline(AnalysisConfig config, ExecutorService executor) {
        this(config, executor, false);
    }

    private ShpbAnalysisPipeline(AnalysisConfig config, ExecutorService executor, boolean ownsExecutor) {
        if (config == null) {
            throw new AnalysisValidationException("Конфигурация анализа не задана");
        }
        this.config = config;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    /* ================ ПЕРЕОПРЕДЕЛЕНИЕ МЕТОДОВ ИНТЕРФЕЙСА SUBJECT ================ */

    @Override public void attach(AnalysisObserver newObserver) {
        this.observers.add(newObserver);
    }

    @Override public void detach(AnalysisObserver existingObserver) {
        this.observers.remove(existingObserver);
    }

    @Override public void notifyObservers(AnalysisEvent event) {
        for (AnalysisObserver obs : this.observers) {
            obs.update(event);
        }
    }

    /* ================ САМОСТОЯТЕЛЬНАЯ ЛОГИКА ================ */

    public AnalysisReport run(RawSignal incidentBar, RawSignal transmittedBar) throws HopkinsonAnalysisException {
        return run(incidentBar, transmittedBar, CancellationToken.create());
    }

    /**
     * Полный прогон анализа.
     * @param incidentBar сигнал входного стержня (падающий и отражённый импульсы)
     * @param transmittedBar сигнал выходного стержня (прошедший импульс)
     * @param token отмена / дедлайн
     * @throws PulseDetectionException не найден один из импульсов
     * @throws HopkinsonAnalysisException поток прерван во время поиска
     * @throws CancellationException отмена по токену
     */
    public AnalysisReport run(RawSignal incidentBar, RawSignal transmittedBar, CancellationToken token)
            throws HopkinsonAnalysisException {
        if (Double.compare(incidentBar.samplingInterval(), transmittedBar.samplingInterval()) != 0) {
            throw new AnalysisValidationException(String.format(
                    "Каналы записаны с разным шагом: %s и %s мс",
                    incidentBar.samplingInterval(), transmittedBar.samplingInterval()));
        }
        try {
            return runStages(incidentBar, transmittedBar, token);
        } catch (HopkinsonAnalysisException | RuntimeException e) {
            notifyObservers(AnalysisEvent.of(AnalysisStage.FAILED, e.getMessage()));
            throw e;
        }
    }

    private AnalysisReport runStages(RawSignal incidentBar, RawSignal transmittedBar, CancellationToken token)
            throws HopkinsonAnalysisException {
        // ---- поиск окон ----
        Map<PulseRole, PulseWindow> windows = detectAll(incidentBar, transmittedBar, token);

        // ---- сегментация ----
        Map<PulseRole, double[]> segments = new EnumMap<>(PulseRole.class);
        for (PulseRole role : PulseRole.values()) {
            RoleDetection rd = this.config.detection(role);
            PulseDetector detector = new PulseDetector(rd.detector());
            double[] segment = detector.segmentAndCenter(signalFor(role, incidentBar, transmittedBar),
                    windows.get(role), this.config.segmentPoints(), rd.detector().polarity(),
                    this.config.threshRatio());
            segments.put(role, segment);
            notifyObservers(new AnalysisEvent(AnalysisStage.SEGMENTATION, role,
                    "Segment of " + segment.length + " points centred"));
        }
        PulseSet pulses = new PulseSet(segments.get(PulseRole.INCIDENT), segments.get(PulseRole.TRANSMITTED),
                segments.get(PulseRole.REFLECTED), incidentBar.samplingInterval());

        // ---- выравнивание ----
        AlignmentResult alignment = new PulseAligner(this.config.aligner()).align(pulses,
                this.config.transmittedShiftOrDefault(), this.config.reflectedShiftOrDefault(), token);
        notifyObservers(AnalysisEvent.of(AnalysisStage.ALIGNMENT, String.format(Locale.ROOT,
                "shiftT=%d, shiftR=%d, fitness=%.4f%s", alignment.shiftTransmitted(),
                alignment.shiftReflected(), alignment.fitness(),
                alignment.isDegenerate() ? " (degenerate)" : "")));

        // ---- кривые и равновесие ----
        StressStrainCalculator calculator = new StressStrainCalculator(this.config.bar());
        Map<AnalysisMethod, StressStrainCurve> curves = calculator.calculateAllMethods(alignment.aligned());
        notifyObservers(AnalysisEvent.of(AnalysisStage.STRESS_STRAIN,
                "Curves computed for " + curves.keySet()));

        EquilibriumMetrics metrics = calculator.calculateEquilibriumMetrics(curves);
        ValidityAssessment validity = new ValidityAssessor().assess(metrics);
        notifyObservers(AnalysisEvent.of(AnalysisStage.EQUILIBRIUM,
                validity.validity() + ": " + validity.notes()));

        // ---- окно Тьюки (по желанию) ----
        PulseSet tapered = null;
        if (this.config.taperAlpha() != null) {
            TaperWindow taper = new TaperWindow(this.config.taperAlpha());
            tapered = alignment.aligned().map(taper::apply);
            notifyObservers(AnalysisEvent.of(AnalysisStage.TAPER,
                    "Tukey window applied, alpha=" + taper.alpha()));
        }

        notifyObservers(AnalysisEvent.of(AnalysisStage.FINISHED, "Analysis finished: " + validity.validity()));
        return new AnalysisReport(windows, pulses, alignment, curves, metrics, validity, tapered);
    }

    /**
     * Три независимых поиска на пуле потоков. Результаты забираются по мере готовности,
     * так что первая же неудача (какой бы роли она ни была) отменяет остальные.
     */
    private Map<PulseRole, PulseWindow> detectAll(RawSignal incidentBar, RawSignal transmittedBar,
                                                  CancellationToken token) throws HopkinsonAnalysisException {
        CompletionService<Detected> completion = new ExecutorCompletionService<>(this.executor);
        List<Future<Detected>> futures = new ArrayList<>();
        for (PulseRole role : PulseRole.values()) {
            RoleDetection rd = this.config.detection(role);
            double[] signal = signalFor(role, incidentBar, transmittedBar);
            PulseExtractor extractor = new PulseExtractor(new PulseDetector(rd.detector()), this.config.retry());
            futures.add(completion.submit(
                    () -> new Detected(role, extractor.extract(signal, rd.bounds(), rd.metric(), token))));
        }

        Map<PulseRole, PulseWindow> windows = new EnumMap<>(PulseRole.class);
        try {
            for (int i = 0; i < futures.size(); i++) {
                Detected detected = completion.take().get();
                windows.put(detected.role(), detected.window());
                notifyObservers(new AnalysisEvent(AnalysisStage.DETECTION, detected.role(),
                        "Window " + detected.window() + " found"));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new HopkinsonAnalysisException("Pulse detection interrupted", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof HopkinsonAnalysisException hae) throw hae;
            if (cause instanceof RuntimeException re) throw re;
            throw new HopkinsonAnalysisException("Pulse detection failed", cause);
        }
        return windows;
    }

    private record Detected(PulseRole role, PulseWindow window) {}

    private static double[] signalFor(PulseRole role, RawSignal incidentBar, RawSignal transmittedBar) {
        RawSignal channel = (role == PulseRole.TRANSMITTED) ? transmittedBar : incidentBar;
        return channel.standardizedSamples();
    }

    @Override public void close() {
        if (this.ownsExecutor) this.executor.shutdownNow();
    }
}
