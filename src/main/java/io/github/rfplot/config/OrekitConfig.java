package io.github.rfplot.config;

import lombok.extern.slf4j.Slf4j;
import org.orekit.data.DataContext;
import org.orekit.data.ZipJarCrawler;
import org.orekit.time.DateComponents;
import org.orekit.time.OffsetModel;
import org.orekit.time.TimeScales;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collections;
import java.util.List;

/**
 * Provides the Orekit {@link TimeScales} used for TLE epochs and prediction grids.
 *
 * <p>If {@code orekit-data.zip} is on the classpath it is registered with Orekit's default
 * {@link DataContext} and its time scales are used. Otherwise UTC is built from the leap-second
 * table below, which is all TLE parsing and SGP4 need.
 */
@Slf4j
@Configuration
public class OrekitConfig {

    static final String DATA_ARCHIVE = "orekit-data.zip";

    @Bean
    public TimeScales timeScales() {
        final var orekitData = OrekitConfig.class.getClassLoader().getResource(DATA_ARCHIVE);
        if (orekitData == null) {
            log.warn("{} not found on classpath, using built-in leap second table", DATA_ARCHIVE);
            return builtInTimeScales();
        }
        final var crawler = new ZipJarCrawler(orekitData);
        DataContext.getDefault().getDataProvidersManager().addProvider(crawler);
        log.info("Orekit data loaded from classpath:{}", DATA_ARCHIVE);
        return DataContext.getDefault().getTimeScales();
    }

    /**
     * Time scales backed only by the integer TAI−UTC steps since 1972. No Earth orientation data
     * is available, so UT1 must not be requested from them.
     */
    public static TimeScales builtInTimeScales() {
        return TimeScales.of(leapSeconds(), (conventions, timeScales) -> Collections.emptyList());
    }

    static List<OffsetModel> leapSeconds() {
        return List.of(
                offset(1972, 1, 1, 10),
                offset(1972, 7, 1, 11),
                offset(1973, 1, 1, 12),
                offset(1974, 1, 1, 13),
                offset(1975, 1, 1, 14),
                offset(1976, 1, 1, 15),
                offset(1977, 1, 1, 16),
                offset(1978, 1, 1, 17),
                offset(1979, 1, 1, 18),
                offset(1980, 1, 1, 19),
                offset(1981, 7, 1, 20),
                offset(1982, 7, 1, 21),
                offset(1983, 7, 1, 22),
                offset(1985, 7, 1, 23),
                offset(1988, 1, 1, 24),
                offset(1990, 1, 1, 25),
                offset(1991, 1, 1, 26),
                offset(1992, 7, 1, 27),
                offset(1993, 7, 1, 28),
                offset(1994, 7, 1, 29),
                offset(1996, 1, 1, 30),
                offset(1997, 7, 1, 31),
                offset(1999, 1, 1, 32),
                offset(2006, 1, 1, 33),
                offset(2009, 1, 1, 34),
                offset(2012, 7, 1, 35),
                offset(2015, 7, 1, 36),
                offset(2017, 1, 1, 37));
    }

    private static OffsetModel offset(final int year, final int month, final int day, final int taiMinusUtc) {
        return new OffsetModel(new DateComponents(year, month, day), taiMinusUtc);
    }
}
