package io.github.rfplot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * rfplot: analysis core of a radio-frequency spectrogram viewer.
 *
 * <p>Loads satellite spectrogram recordings, tracks drifting narrowband signals along
 * user-drawn tracks, and predicts the Doppler curves of catalogued satellites with Orekit
 * SGP4/SDP4 for comparison against the recording.
 *
 * @see io.github.rfplot.service.PlotSession
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RfPlotApplication {

    public static void main(String[] args) {
        SpringApplication.run(RfPlotApplication.class, args);
    }
}
