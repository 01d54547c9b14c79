package io.github.rfplot.controller;

import io.github.rfplot.coord.CoordinateSpace.DataNormalized;
import io.github.rfplot.coord.LineClipper.Segment;
import io.github.rfplot.coord.Point;
import io.github.rfplot.exception.DataIoException;
import io.github.rfplot.exception.InconsistentDataException;
import io.github.rfplot.exception.MissingFrequencyException;
import io.github.rfplot.service.PlotSession;
import io.github.rfplot.signal.TrackPoints;
import io.github.rfplot.spectrogram.Spectrogram;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PlotSessionController.class)
class PlotSessionControllerTest {

    private static final Spectrogram SPECTROGRAM = Spectrogram.ofDecibels(Instant.parse("2023-06-01T10:00:00Z"),
            437_800_000.0, 48_000.0, 1.0, 2, new float[]{-3f, 0f, 1f, 12f});

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PlotSession plotSession;

    @Test
    void loadSpectrogramReturnsActiveWithMetadata() throws Exception {
        when(plotSession.loadSpectrogram(anyList())).thenReturn(SPECTROGRAM);

        mockMvc.perform(post("/api/plot/spectrogram")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "paths": ["/data/a.bin", "/data/b.bin"]
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.spectrogram.sliceCount").value(2))
                .andExpect(jsonPath("$.spectrogram.channelCount").value(2))
                .andExpect(jsonPath("$.spectrogram.startTime").value("2023-06-01T10:00:00Z"));

        verify(plotSession).loadSpectrogram(List.of(Path.of("/data/a.bin"), Path.of("/data/b.bin")));
    }

    @Test
    void loadSpectrogramReturnsBadRequestWithoutPaths() throws Exception {
        mockMvc.perform(post("/api/plot/spectrogram")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "paths": [] }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"));
    }

    @Test
    void loadSpectrogramReturnsBadRequestForInconsistentFiles() throws Exception {
        when(plotSession.loadSpectrogram(anyList()))
                .thenThrow(new InconsistentDataException("Non-contiguous spectrograms during concatenation"));

        mockMvc.perform(post("/api/plot/spectrogram")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "paths": ["/data/a.bin", "/data/c.bin"] }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.message").value(containsString("Non-contiguous")));
    }

    @Test
    void loadSatellitesReturnsBadRequestForMissingFrequency() throws Exception {
        when(plotSession.loadSatellites(any(), any())).thenThrow(new MissingFrequencyException(25544));

        mockMvc.perform(post("/api/plot/satellites")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "tlePath": "/data/active.tle",
                                    "frequencyPath": "/data/frequencies.txt"
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.message").value(containsString("25544")));
    }

    @Test
    void addTrackPointReturnsActive() throws Exception {
        when(plotSession.addTrackPoint(any())).thenReturn(TrackPoints.empty().with(Point.of(1.5, -200.0)));

        mockMvc.perform(post("/api/plot/track-points")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "time": 1.5, "frequency": -200.0 }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.message").value("1 track points"));

        verify(plotSession).addTrackPoint(Point.of(1.5, -200.0));
    }

    @Test
    void addTrackPointRejectsMissingFrequency() throws Exception {
        mockMvc.perform(post("/api/plot/track-points")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "time": 1.5 }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"));
    }

    @Test
    void clearTrackPoints() throws Exception {
        mockMvc.perform(delete("/api/plot/track-points"))
                .andExpect(status().isOk());

        verify(plotSession).clearTrackPoints();
    }

    @Test
    void signalSearchIsAcceptedWhenSpectrogramLoaded() throws Exception {
        when(plotSession.spectrogram()).thenReturn(Optional.of(SPECTROGRAM));
        when(plotSession.trackPoints()).thenReturn(TrackPoints.empty());

        mockMvc.perform(post("/api/plot/signals/search"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("ACCEPTED"));

        verify(plotSession).requestSignalSearch();
    }

    @Test
    void signalSearchIsRejectedWithoutSpectrogram() throws Exception {
        when(plotSession.spectrogram()).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/plot/signals/search"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"));
    }

    @Test
    void signalsAreListedAsTimeFrequencyPairs() throws Exception {
        when(plotSession.signals()).thenReturn(List.of(Point.of(5.0, 8000.0)));

        mockMvc.perform(get("/api/plot/signals"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].time").value(5.0))
                .andExpect(jsonPath("$[0].frequency").value(8000.0));
    }

    @Test
    void predictionsAreEmptyBeforeFirstRun() throws Exception {
        when(plotSession.predictions()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/plot/predictions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void subtractBackgroundReturnsFilteredMetadata() throws Exception {
        when(plotSession.spectrogram()).thenReturn(Optional.of(SPECTROGRAM));
        when(plotSession.subtractBackground(anyDouble())).thenReturn(SPECTROGRAM);

        mockMvc.perform(post("/api/plot/spectrogram/background")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "windowHz": 2000.0 }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.spectrogram.channelCount").value(2));

        verify(plotSession).subtractBackground(2000.0);
    }

    @Test
    void subtractBackgroundRejectsNonPositiveWindow() throws Exception {
        mockMvc.perform(post("/api/plot/spectrogram/background")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "windowHz": 0 }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"));

        verify(plotSession, never()).subtractBackground(anyDouble());
    }

    @Test
    void saveSpectrogramReportsIoFailure() throws Exception {
        final var target = Path.of("/readonly/out.bin");
        when(plotSession.spectrogram()).thenReturn(Optional.of(SPECTROGRAM));
        when(plotSession.saveSpectrogram(target))
                .thenThrow(new DataIoException(target, new IOException("Read-only file system")));

        mockMvc.perform(post("/api/plot/spectrogram/save")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "path": "/readonly/out.bin" }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.message").value(containsString("Read-only file system")));
    }

    @Test
    void saveSpectrogramReturnsActive() throws Exception {
        final var target = Path.of("/data/out.bin");
        when(plotSession.spectrogram()).thenReturn(Optional.of(SPECTROGRAM));
        when(plotSession.saveSpectrogram(target)).thenReturn(SPECTROGRAM);

        mockMvc.perform(post("/api/plot/spectrogram/save")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "path": "/data/out.bin" }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Saved 2 slices to /data/out.bin"));
    }

    @Test
    void visibleTrackIsListedAsSegments() throws Exception {
        when(plotSession.visibleTrack()).thenReturn(List.of(
                new Segment<DataNormalized>(Point.of(0.1, 0.2), Point.of(0.6, 0.7))));

        mockMvc.perform(get("/api/plot/track-points/visible"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].startX").value(0.1))
                .andExpect(jsonPath("$[0].endY").value(0.7));
    }
}
