package com.energyforecast.dao;

import com.energyforecast.entity.RawSeries;
import com.energyforecast.entity.SeriesPoint;
import com.energyforecast.exception.MalformedSeriesException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * 读取小时负荷 CSV 文件，例如 AEP_hourly.csv（列：Datetime,AEP_MW）
 */
public class CsvSeriesDao implements SeriesSource {
    private static final Logger logger = LoggerFactory.getLogger(CsvSeriesDao.class);

    public static final String DATASET_PLACEHOLDER = "{dataset}";
    public static final String DEFAULT_FILE_PATTERN = DATASET_PLACEHOLDER + "_hourly.csv";
    public static final String DEFAULT_TIMESTAMP_COLUMN = "Datetime";

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path dataDir;
    private final String fileNamePattern;
    private final String timestampColumn;
    private final String valueColumn;

    public CsvSeriesDao(Path dataDir) {
        this(dataDir, DEFAULT_FILE_PATTERN, DEFAULT_TIMESTAMP_COLUMN, null);
    }

    /**
     * @param valueColumn 数值列名，为 null 时依次尝试 {DATASET}_MW 和唯一的非时间列
     */
    public CsvSeriesDao(Path dataDir, String fileNamePattern, String timestampColumn, String valueColumn) {
        this.dataDir = dataDir;
        this.fileNamePattern = fileNamePattern;
        this.timestampColumn = timestampColumn;
        this.valueColumn = valueColumn;
    }

    public Path resolveFile(String datasetName) {
        return dataDir.resolve(fileNamePattern.replace(DATASET_PLACEHOLDER, datasetName));
    }

    @Override
    public RawSeries load(String datasetName) throws IOException {
        Path file = resolveFile(datasetName);
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreSurroundingSpaces(true)
                .build();

        List<SeriesPoint> points = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, format)) {

            List<String> header = parser.getHeaderNames();
            if (!header.contains(timestampColumn)) {
                throw new MalformedSeriesException("File " + file + " has no timestamp column " + timestampColumn);
            }
            String column = resolveValueColumn(datasetName, header, file);

            for (CSVRecord record : parser) {
                points.add(new SeriesPoint(
                        parseTimestamp(record.get(timestampColumn), file, record.getRecordNumber()),
                        parseValue(record.get(column), file, record.getRecordNumber())));
            }
        }

        List<SeriesPoint> ordered = sortAndDeduplicate(points, datasetName);
        logger.info("Loaded {} observations for dataset {} from {}", ordered.size(), datasetName, file);
        return new RawSeries(datasetName, ordered);
    }

    private String resolveValueColumn(String datasetName, List<String> header, Path file) {
        if (valueColumn != null && !valueColumn.isEmpty()) {
            if (!header.contains(valueColumn)) {
                throw new MalformedSeriesException("File " + file + " has no value column " + valueColumn);
            }
            return valueColumn;
        }

        String conventional = datasetName.toUpperCase(Locale.ROOT) + "_MW";
        if (header.contains(conventional)) {
            return conventional;
        }

        List<String> candidates = new ArrayList<>(header);
        candidates.remove(timestampColumn);
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        throw new MalformedSeriesException("Cannot determine the value column of " + file + " from " + header);
    }

    private static LocalDateTime parseTimestamp(String text, Path file, long row) {
        try {
            return LocalDateTime.parse(text, TIMESTAMP_FORMAT);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text);
            } catch (DateTimeParseException iso) {
                throw new MalformedSeriesException("Unparsable timestamp '" + text + "' at row " + row + " of " + file, iso);
            }
        }
    }

    private static double parseValue(String text, Path file, long row) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new MalformedSeriesException("Unparsable value '" + text + "' at row " + row + " of " + file, e);
        }
    }

    /**
     * 按时间排序（稳定），重复时间戳保留首次出现的记录
     */
    static List<SeriesPoint> sortAndDeduplicate(List<SeriesPoint> points, String datasetName) {
        List<SeriesPoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparing(SeriesPoint::getTimestamp));

        List<SeriesPoint> result = new ArrayList<>(sorted.size());
        int duplicates = 0;
        for (SeriesPoint point : sorted) {
            if (!result.isEmpty() && result.get(result.size() - 1).getTimestamp().equals(point.getTimestamp())) {
                duplicates++;
                continue;
            }
            result.add(point);
        }

        if (duplicates > 0) {
            logger.warn("Dataset {} contains {} duplicate timestamps, kept the first occurrence of each",
                    datasetName, duplicates);
        }
        return result;
    }
}
