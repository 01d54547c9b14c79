package io.github.rfplot.controller;

import io.github.rfplot.coord.Point;
import io.github.rfplot.dto.BackgroundRequest;
import io.github.rfplot.dto.PlotResponse;
import io.github.rfplot.dto.PredictionSummary;
import io.github.rfplot.dto.SatelliteInfo;
import io.github.rfplot.dto.SatelliteRequest;
import io.github.rfplot.dto.SatelliteResponse;
import io.github.rfplot.dto.SaveRequest;
import io.github.rfplot.dto.SignalPoint;
import io.github.rfplot.dto.SpectrogramInfo;
import io.github.rfplot.dto.SpectrogramRequest;
import io.github.rfplot.dto.SpectrogramResponse;
import io.github.rfplot.dto.TrackPointRequest;
import io.github.rfplot.dto.TrackSegment;
import io.github.rfplot.exception.RfPlotException;
import io.github.rfplot.service.PlotSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;

/**
 * REST surface of the plot session.
 *
 * <p>Loading endpoints answer synchronously. Signal searches and predictions are started in the
 * background ({@code 202 ACCEPTED}) and their latest results are read back with GET.
 */
@Slf4j
@RestController
@RequestMapping("/api/plot")
@RequiredArgsConstructor
public class PlotSessionController {

    private static final String ACTIVE = "ACTIVE";
    private static final String ACCEPTED = "ACCEPTED";
    private static final String REJECTED = "REJECTED";

    private final PlotSession plotSession;

    /**
     * Loads spectrogram files and installs the result as the session spectrogram.
     *
     * @return {@code 200 OK} with the metadata, {@code 400 Bad Request} on I/O, parse or
     *         consistency failure
     */
    @PostMapping("/spectrogram")
    public ResponseEntity<SpectrogramResponse> loadSpectrogram(@RequestBody final SpectrogramRequest request) {
        if (request.paths() == null || request.paths().isEmpty()) {
            return ResponseEntity.badRequest()
                    .body(new SpectrogramResponse(REJECTED, "At least one path is required", null));
        }

        try {
            final var paths = request.paths().stream().map(Path::of).toList();
            final var spectrogram = plotSession.loadSpectrogram(paths);
            return ResponseEntity.ok(new SpectrogramResponse(ACTIVE,
                    "Loaded %d slices from %d files".formatted(spectrogram.sliceCount(), paths.size()),
                    SpectrogramInfo.of(spectrogram)));
        } catch (final RfPlotException e) {
            log.error("Failed to load spectrogram ({}): {}", e.kind(), e.getMessage());
            return ResponseEntity.badRequest()
                    .body(new SpectrogramResponse(REJECTED, "Invalid spectrogram: " + e.getMessage(), null));
        }
    }

    @PostMapping("/spectrogram/background")
    public ResponseEntity<SpectrogramResponse> subtractBackground(@RequestBody final BackgroundRequest request) {
        if (request.windowHz() == null || !(request.windowHz() > 0.0)) {
            return ResponseEntity.badRequest()
                    .body(new SpectrogramResponse(REJECTED, "windowHz must be a positive number", null));
        }
        if (plotSession.spectrogram().isEmpty()) {
            return ResponseEntity.badRequest().body(new SpectrogramResponse(REJECTED, "No spectrogram loaded", null));
        }

        final var filtered = plotSession.subtractBackground(request.windowHz());
        return ResponseEntity.ok(new SpectrogramResponse(ACTIVE,
                "Subtracted %.0f Hz median background".formatted(request.windowHz()),
                SpectrogramInfo.of(filtered)));
    }

    @PostMapping("/spectrogram/save")
    public ResponseEntity<PlotResponse> saveSpectrogram(@RequestBody final SaveRequest request) {
        if (request.path() == null || request.path().isBlank()) {
            return ResponseEntity.badRequest().body(new PlotResponse(REJECTED, "path is required"));
        }
        if (plotSession.spectrogram().isEmpty()) {
            return ResponseEntity.badRequest().body(new PlotResponse(REJECTED, "No spectrogram loaded"));
        }

        try {
            final var saved = plotSession.saveSpectrogram(Path.of(request.path()));
            return ResponseEntity.ok(new PlotResponse(ACTIVE,
                    "Saved %d slices to %s".formatted(saved.sliceCount(), request.path())));
        } catch (final RfPlotException e) {
            log.error("Failed to save spectrogram ({}): {}", e.kind(), e.getMessage());
            return ResponseEntity.badRequest().body(new PlotResponse(REJECTED, "Save failed: " + e.getMessage()));
        }
    }

    @PostMapping("/satellites")
    public ResponseEntity<SatelliteResponse> loadSatellites(@RequestBody final SatelliteRequest request) {
        if (request.tlePath() == null || request.frequencyPath() == null) {
            return ResponseEntity.badRequest()
                    .body(new SatelliteResponse(REJECTED, "tlePath and frequencyPath are required", List.of()));
        }

        try {
            final var satellites = plotSession.loadSatellites(Path.of(request.tlePath()), Path.of(request.frequencyPath()));
            return ResponseEntity.ok(new SatelliteResponse(ACTIVE,
                    "Loaded %d satellites".formatted(satellites.size()),
                    satellites.stream().map(SatelliteInfo::of).toList()));
        } catch (final RfPlotException e) {
            log.error("Failed to load satellites ({}): {}", e.kind(), e.getMessage());
            return ResponseEntity.badRequest()
                    .body(new SatelliteResponse(REJECTED, "Invalid satellite data: " + e.getMessage(), List.of()));
        }
    }

    @PostMapping("/track-points")
    public ResponseEntity<PlotResponse> addTrackPoint(@RequestBody final TrackPointRequest request) {
        if (request.time() == null || request.frequency() == null) {
            return ResponseEntity.badRequest()
                    .body(new PlotResponse(REJECTED, "time and frequency are required"));
        }
        final var points = plotSession.addTrackPoint(Point.of(request.time(), request.frequency()));
        return ResponseEntity.ok(new PlotResponse(ACTIVE, "%d track points".formatted(points.size())));
    }

    @DeleteMapping("/track-points")
    public ResponseEntity<PlotResponse> clearTrackPoints() {
        plotSession.clearTrackPoints();
        return ResponseEntity.ok(new PlotResponse(ACTIVE, "Track points cleared"));
    }

    @GetMapping("/track-points/visible")
    public List<TrackSegment> visibleTrack() {
        return plotSession.visibleTrack().stream().map(TrackSegment::of).toList();
    }

    @PostMapping("/signals/search")
    public ResponseEntity<PlotResponse> searchSignals() {
        if (plotSession.spectrogram().isEmpty()) {
            return ResponseEntity.badRequest().body(new PlotResponse(REJECTED, "No spectrogram loaded"));
        }
        plotSession.requestSignalSearch();
        return ResponseEntity.accepted()
                .body(new PlotResponse(ACCEPTED, "Signal search started along %d track points"
                        .formatted(plotSession.trackPoints().size())));
    }

    @GetMapping("/signals")
    public List<SignalPoint> signals() {
        return plotSession.signals().stream().map(SignalPoint::of).toList();
    }

    @PostMapping("/predictions")
    public ResponseEntity<PlotResponse> predict() {
        if (plotSession.spectrogram().isEmpty()) {
            return ResponseEntity.badRequest().body(new PlotResponse(REJECTED, "No spectrogram loaded"));
        }
        plotSession.requestPredictions();
        return ResponseEntity.accepted()
                .body(new PlotResponse(ACCEPTED, "Prediction started for %d satellites"
                        .formatted(plotSession.satellites().size())));
    }

    @GetMapping("/predictions")
    public List<PredictionSummary> predictions() {
        return plotSession.predictions()
                .map(p -> p.series().entrySet().stream()
                        .map(e -> PredictionSummary.of(e.getKey(), e.getValue()))
                        .toList())
                .orElse(List.of());
    }
}
