package com.energyforecast.dao;

import com.energyforecast.entity.RawSeries;
import com.energyforecast.exception.MalformedSeriesException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class CsvSeriesDaoTest {

    @TempDir
    Path dataDir;

    private void write(String fileName, String content) throws IOException {
        Files.write(dataDir.resolve(fileName), content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testLoadSortsAndKeepsFirstDuplicate() throws IOException {
        write("AEP_hourly.csv", "Datetime,AEP_MW\n"
                + "2018-01-01 02:00:00,13000.0\n"
                + "2018-01-01 00:00:00,11000.0\n"
                + "2018-01-01 01:00:00,12000.0\n"
                + "2018-01-01 01:00:00,99999.0\n");

        RawSeries series = new CsvSeriesDao(dataDir).load("AEP");

        assertEquals("AEP", series.getDatasetName());
        assertArrayEquals(new double[]{11000.0, 12000.0, 13000.0}, series.values(), 0.0);
        assertEquals(LocalDateTime.of(2018, 1, 1, 0, 0), series.getPoints().get(0).getTimestamp());
    }

    @Test
    void testSingleValueColumnAndIsoTimestamps() throws IOException {
        write("pjm_hourly.csv", "Datetime,load\n"
                + "2018-01-01T00:00:00,1.5\n"
                + "2018-01-01T01:00:00,2.5\n");

        RawSeries series = new CsvSeriesDao(dataDir).load("pjm");

        assertArrayEquals(new double[]{1.5, 2.5}, series.values(), 0.0);
    }

    @Test
    void testConfiguredColumnsAndPattern() throws IOException {
        write("load-COMED.csv", "time,other,demand\n"
                + "2018-01-01 00:00:00,7,100\n"
                + "2018-01-01 01:00:00,8,200\n");

        CsvSeriesDao dao = new CsvSeriesDao(dataDir, "load-{dataset}.csv", "time", "demand");

        assertEquals(dataDir.resolve("load-COMED.csv"), dao.resolveFile("COMED"));
        assertArrayEquals(new double[]{100.0, 200.0}, dao.load("COMED").values(), 0.0);
    }

    @Test
    void testAmbiguousValueColumn() throws IOException {
        write("X_hourly.csv", "Datetime,a,b\n2018-01-01 00:00:00,1,2\n");
        assertThrows(MalformedSeriesException.class, () -> new CsvSeriesDao(dataDir).load("X"));
    }

    @Test
    void testMissingTimestampColumn() throws IOException {
        write("AEP_hourly.csv", "time,AEP_MW\n2018-01-01 00:00:00,1\n");
        assertThrows(MalformedSeriesException.class, () -> new CsvSeriesDao(dataDir).load("AEP"));
    }

    @Test
    void testUnparsableRows() throws IOException {
        write("AEP_hourly.csv", "Datetime,AEP_MW\n2018-01-01 00:00:00,abc\n");
        assertThrows(MalformedSeriesException.class, () -> new CsvSeriesDao(dataDir).load("AEP"));

        write("DOM_hourly.csv", "Datetime,DOM_MW\nyesterday,1.0\n");
        assertThrows(MalformedSeriesException.class, () -> new CsvSeriesDao(dataDir).load("DOM"));
    }

    @Test
    void testHeaderOnlyFileIsMalformed() throws IOException {
        write("AEP_hourly.csv", "Datetime,AEP_MW\n");
        assertThrows(MalformedSeriesException.class, () -> new CsvSeriesDao(dataDir).load("AEP"));
    }

    @Test
    void testMissingFile() {
        assertThrows(IOException.class, () -> new CsvSeriesDao(dataDir).load("NOPE"));
    }
}
