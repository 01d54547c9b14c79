package io.github.rfplot.service;

import io.github.rfplot.config.RfPlotProperties;
import io.github.rfplot.coord.CoordinateSpace.DataAbsolute;
import io.github.rfplot.coord.CoordinateSpace.DataNormalized;
import io.github.rfplot.coord.CoordinateSpace.PlotArea;
import io.github.rfplot.coord.LineClipper;
import io.github.rfplot.coord.LineClipper.Segment;
import io.github.rfplot.coord.Point;
import io.github.rfplot.coord.Transforms;
import io.github.rfplot.coord.Vector;
import io.github.rfplot.coord.ViewWindow;
import io.github.rfplot.orbit.FrequencyTable;
import io.github.rfplot.orbit.Predictions;
import io.github.rfplot.orbit.Satellite;
import io.github.rfplot.orbit.SatellitePredictor;
import io.github.rfplot.orbit.TleLoader;
import io.github.rfplot.signal.FitTraceDetector;
import io.github.rfplot.signal.SignalDetector;
import io.github.rfplot.signal.SignalTracker;
import io.github.rfplot.signal.TrackPoints;
import io.github.rfplot.spectrogram.MedianFilter;
import io.github.rfplot.spectrogram.Spectrogram;
import io.github.rfplot.spectrogram.SpectrogramLoader;
import io.github.rfplot.spectrogram.SpectrogramWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * State of one viewer session: the loaded spectrogram, view window, track points, satellites and
 * the latest analysis results.
 *
 * <p>Every piece of state sits in an {@link AtomicReference} and is swapped whole. Signal searches
 * and predictions run on the analysis executor against immutable snapshots. Each request takes a
 * generation number; a result is installed only if no newer request of the same kind has already
 * installed one, so a slow superseded run never overwrites a fresher answer.
 */
@Slf4j
@Service
public class PlotSession {

    private final SpectrogramLoader spectrogramLoader;
    private final TleLoader tleLoader;
    private final SatellitePredictor satellitePredictor;
    private final Executor analysisExecutor;
    private final RfPlotProperties properties;

    private final AtomicReference<Spectrogram> spectrogram = new AtomicReference<>();
    private final AtomicReference<ViewWindow> view = new AtomicReference<>(new ViewWindow());
    private final AtomicReference<TrackPoints> trackPoints = new AtomicReference<>(TrackPoints.empty());
    private final AtomicReference<List<Satellite>> satellites = new AtomicReference<>(List.of());
    private final AtomicReference<List<Point<DataAbsolute>>> signals = new AtomicReference<>(List.of());
    private final AtomicReference<Predictions> predictions = new AtomicReference<>();

    private final Generation signalGeneration = new Generation();
    private final Generation predictionGeneration = new Generation();

    public PlotSession(final SpectrogramLoader spectrogramLoader,
                       final TleLoader tleLoader,
                       final SatellitePredictor satellitePredictor,
                       @Qualifier("analysisExecutor") final Executor analysisExecutor,
                       final RfPlotProperties properties) {
        this.spectrogramLoader = spectrogramLoader;
        this.tleLoader = tleLoader;
        this.satellitePredictor = satellitePredictor;
        this.analysisExecutor = analysisExecutor;
        this.properties = properties;
    }

    /**
     * Loads and installs a spectrogram. Track points, signals and predictions belong to the
     * previous data and are cleared; a prediction run is started if satellites and a site are
     * known.
     *
     * @throws io.github.rfplot.exception.RfPlotException if loading fails; the current
     *                                                    spectrogram is kept
     */
    public Spectrogram loadSpectrogram(final List<Path> paths) {
        final var loaded = spectrogramLoader.load(paths);
        installSpectrogram(loaded);
        return loaded;
    }

    public void installSpectrogram(final Spectrogram loaded) {
        spectrogram.set(loaded);
        view.set(new ViewWindow());
        trackPoints.set(TrackPoints.empty());
        synchronized (signalGeneration) {
            signalGeneration.invalidate();
            signals.set(List.of());
        }
        synchronized (predictionGeneration) {
            predictionGeneration.invalidate();
            predictions.set(null);
        }
        log.info("Spectrogram installed: {}", loaded);

        if (!satellites.get().isEmpty()) {
            requestPredictions();
        }
    }

    /**
     * Replaces the current spectrogram with its median-background-subtracted version. View, track
     * points and predictions are kept; signals found on the unfiltered data are dropped.
     *
     * @param windowHz width of the running median window in Hz
     * @throws IllegalStateException if no spectrogram is loaded or it was replaced meanwhile
     */
    public Spectrogram subtractBackground(final double windowHz) {
        final var current = requireSpectrogram();
        final var filtered = MedianFilter.subtract(current, windowHz);
        synchronized (signalGeneration) {
            if (!spectrogram.compareAndSet(current, filtered)) {
                throw new IllegalStateException("Spectrogram was replaced while filtering");
            }
            signalGeneration.invalidate();
            signals.set(List.of());
        }
        log.info("Subtracted {} Hz median background: {}", windowHz, filtered);
        return filtered;
    }

    /**
     * Writes the current spectrogram in the recorder's file format.
     *
     * @throws IllegalStateException                      if no spectrogram is loaded
     * @throws io.github.rfplot.exception.DataIoException if the file cannot be written
     */
    public Spectrogram saveSpectrogram(final Path path) {
        final var current = requireSpectrogram();
        SpectrogramWriter.save(current, path);
        return current;
    }

    private Spectrogram requireSpectrogram() {
        final var current = spectrogram.get();
        if (current == null) {
            throw new IllegalStateException("No spectrogram loaded");
        }
        return current;
    }

    /**
     * Loads satellites from a TLE file and a frequency table, replacing the current set.
     */
    public List<Satellite> loadSatellites(final Path tlePath, final Path frequencyPath) {
        final var frequencies = FrequencyTable.load(frequencyPath);
        final var loaded = List.copyOf(tleLoader.load(tlePath, frequencies));
        satellites.set(loaded);
        if (spectrogram.get() != null) {
            requestPredictions();
        }
        return loaded;
    }

    public TrackPoints addTrackPoint(final Point<DataAbsolute> point) {
        return trackPoints.updateAndGet(current -> current.with(point));
    }

    public void clearTrackPoints() {
        trackPoints.set(TrackPoints.empty());
    }

    /**
     * Starts a search along the current track points with the configured detection defaults.
     * The future completes with the signals found by this run, even if a newer run has already
     * replaced them in the session.
     */
    public CompletableFuture<List<Point<DataAbsolute>>> requestSignalSearch() {
        final var detection = properties.detection();
        return requestSignalSearch(detection.halfBandwidth(), new FitTraceDetector(detection.sigma()));
    }

    public CompletableFuture<List<Point<DataAbsolute>>> requestSignalSearch(final double halfBandwidth,
                                                                           final SignalDetector detector) {
        final var data = spectrogram.get();
        if (data == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No spectrogram loaded"));
        }
        final var points = trackPoints.get().points();
        return submit(signalGeneration,
                () -> SignalTracker.findSignals(data, points, halfBandwidth, detector),
                result -> {
                    signals.set(List.copyOf(result));
                    log.info("Signal search found {} points along {} track points", result.size(), points.size());
                },
                "Signal search");
    }

    /**
     * Starts a prediction run over the current spectrogram span for the current satellites.
     * Completes with an empty optional when there is nothing to predict.
     */
    public CompletableFuture<Optional<Predictions>> requestPredictions() {
        final var data = spectrogram.get();
        final var sats = satellites.get();
        final var site = properties.configuredSite();
        if (data == null || site.isEmpty()) {
            if (site.isEmpty()) {
                log.warn("No observer site configured, skipping satellite predictions");
            }
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return submit(predictionGeneration,
                () -> Optional.of(satellitePredictor.predict(sats, data.startTime(), data.lengthSeconds(), site.get())),
                result -> {
                    predictions.set(result.orElse(null));
                    log.info("Predictions updated for {} satellites", sats.size());
                },
                "Satellite prediction");
    }

    private <T> CompletableFuture<T> submit(final Generation generation, final Supplier<T> work,
                                            final Consumer<T> install, final String label) {
        final var ticket = generation.next();
        return CompletableFuture.supplyAsync(work, analysisExecutor)
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.error("{} failed: {}", label, error.getMessage());
                        return;
                    }
                    synchronized (generation) {
                        if (generation.tryApply(ticket)) {
                            install.accept(result);
                        } else {
                            log.debug("{} result of generation {} is stale, discarded", label, ticket);
                        }
                    }
                });
    }

    public Optional<Spectrogram> spectrogram() {
        return Optional.ofNullable(spectrogram.get());
    }

    public ViewWindow view() {
        return view.get().copy();
    }

    public ViewWindow pan(final Vector<PlotArea> delta) {
        return view.updateAndGet(current -> {
            final var next = current.copy();
            next.pan(delta);
            return next;
        }).copy();
    }

    public ViewWindow zoom(final Point<PlotArea> at, final double delta) {
        return view.updateAndGet(current -> {
            final var next = current.copy();
            next.zoom(at, delta);
            return next;
        }).copy();
    }

    public void resetView() {
        view.set(new ViewWindow());
    }

    /**
     * The track polyline in normalized data coordinates, clipped to the current view window.
     * Segments entirely outside the view are left out.
     */
    public List<Segment<DataNormalized>> visibleTrack() {
        final var data = spectrogram.get();
        if (data == null) {
            return List.of();
        }
        final var toNormalized = Transforms.dataAbsoluteToDataNormalized(data.bounds());
        final var viewBounds = view.get().bounds();
        final var points = trackPoints.get().points();
        final var segments = new ArrayList<Segment<DataNormalized>>();
        for (var i = 0; i + 1 < points.size(); i++) {
            LineClipper.clip(viewBounds, toNormalized.apply(points.get(i)), toNormalized.apply(points.get(i + 1)))
                    .ifPresent(segments::add);
        }
        return segments;
    }

    public TrackPoints trackPoints() {
        return trackPoints.get();
    }

    public List<Satellite> satellites() {
        return satellites.get();
    }

    public List<Point<DataAbsolute>> signals() {
        return signals.get();
    }

    public Optional<Predictions> predictions() {
        return Optional.ofNullable(predictions.get());
    }

    /**
     * Issues request numbers and tracks the newest one whose result was installed.
     */
    static final class Generation {

        private final AtomicLong issued = new AtomicLong();
        private final AtomicLong applied = new AtomicLong();

        long next() {
            return issued.incrementAndGet();
        }

        /**
         * Marks everything issued so far as stale.
         */
        void invalidate() {
            applied.accumulateAndGet(issued.get(), Math::max);
        }

        boolean tryApply(final long ticket) {
            final var previous = applied.getAndAccumulate(ticket, Math::max);
            return ticket > previous;
        }
    }
}
