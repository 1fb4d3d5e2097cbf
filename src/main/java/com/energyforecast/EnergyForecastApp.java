package com.energyforecast;

import com.energyforecast.dao.CsvSeriesDao;
import com.energyforecast.dao.EnergyDataFetcher;
import com.energyforecast.dao.FileModelRepository;
import com.energyforecast.dao.SeriesSource;
import com.energyforecast.entity.ForecastReport;
import com.energyforecast.entity.HyperparameterConfig;
import com.energyforecast.entity.HyperparameterGrid;
import com.energyforecast.entity.PipelineConfig;
import com.energyforecast.entity.ScalerFitScope;
import com.energyforecast.entity.SplitRatios;
import com.energyforecast.model.ArchitectureVariant;
import com.energyforecast.service.ForecastPipeline;
import com.energyforecast.util.ConfigReaderUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

public class EnergyForecastApp {
    private static final Logger logger = LoggerFactory.getLogger(EnergyForecastApp.class);

    private static final List<String> DEFAULT_DATASETS = List.of("AEP", "COMED", "DAYTON");

    public static void main(String[] args) {
        logger.info("Starting Energy Demand Forecasting Application...");

        try {
            // 1. 读取配置
            ConfigReaderUtil cr = args.length > 0 ? new ConfigReaderUtil(args[0]) : new ConfigReaderUtil();
            PipelineConfig pipelineConfig = buildPipelineConfig(cr);
            List<String> datasets = cr.getList("datasets");
            if (datasets.isEmpty()) {
                datasets = DEFAULT_DATASETS;
            }

            // 2. 初始化组件
            ForecastPipeline pipeline = new ForecastPipeline(pipelineConfig,
                    buildSeriesSource(cr),
                    new FileModelRepository(Paths.get(cr.getValue("models.dir", "models"))));
            Runtime.getRuntime().addShutdownHook(new Thread(pipeline::cancel));

            // 3. 运行并输出报告
            ForecastReport report = pipeline.run(datasets);
            System.out.println();
            System.out.println(report.render(pipelineConfig.isReportOriginalUnits()));

            String jsonPath = cr.getValue("report.json.path", "");
            if (!jsonPath.isEmpty()) {
                Path path = Paths.get(jsonPath);
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.write(path, report.toJson().getBytes(StandardCharsets.UTF_8));
                logger.info("Report written to {}", path.toAbsolutePath());
            }

            logger.info("Application completed: {} of {} datasets succeeded",
                    report.successes().size(), datasets.size());
        } catch (IOException e) {
            logger.error("Failed to write report", e);
            System.err.println("报告写入失败：" + e.getMessage());
        } catch (Exception e) {
            logger.error("Application failed", e);
            System.err.println("程序运行出错：" + e.getMessage());
        }
    }

    static SeriesSource buildSeriesSource(ConfigReaderUtil cr) {
        CsvSeriesDao csvSeriesDao = new CsvSeriesDao(
                Paths.get(cr.getValue("data.dir", "data")),
                cr.getValue("data.file.pattern", CsvSeriesDao.DEFAULT_FILE_PATTERN),
                cr.getValue("data.timestamp.column", CsvSeriesDao.DEFAULT_TIMESTAMP_COLUMN),
                cr.getValue("data.value.column", null));

        String urlTemplate = cr.getValue("data.url.template", "");
        if (urlTemplate.isEmpty()) {
            return csvSeriesDao;
        }
        return new EnergyDataFetcher(urlTemplate, csvSeriesDao);
    }

    /**
     * 从 properties 构建流水线配置，缺省项保留 {@link PipelineConfig} 的默认值
     */
    static PipelineConfig buildPipelineConfig(ConfigReaderUtil cr) {
        PipelineConfig config = PipelineConfig.getDefaultConfig();
        HyperparameterGrid defaultGrid = config.getGrid();
        HyperparameterConfig defaultFixed = config.getFixedConfig();

        config.setWindowLength(requirePositive("window.length", cr.getInt("window.length", config.getWindowLength())));
        // 切分比例在启动时校验，避免每个数据集各自失败
        SplitRatios ratios = new SplitRatios(
                cr.getDouble("split.train.end", config.getTrainEnd()),
                cr.getDouble("split.validation.end", config.getValidationEnd()));
        config.setTrainEnd(ratios.getTrainEnd());
        config.setValidationEnd(ratios.getValidationEnd());
        config.setArchitecture(ArchitectureVariant.valueOf(
                cr.getValue("architecture", config.getArchitecture().name()).toUpperCase(Locale.ROOT)));
        config.setSearchEnabled(cr.getBoolean("search.enabled", config.isSearchEnabled()));

        config.setGrid(new HyperparameterGrid(
                cr.getIntList("grid.recurrent.units", defaultGrid.getRecurrentUnits()),
                cr.getDoubleList("grid.dropout.rates", defaultGrid.getDropoutRates()),
                cr.getIntList("grid.batch.sizes", defaultGrid.getBatchSizes()),
                cr.getIntList("grid.epoch.budgets", defaultGrid.getEpochBudgets())));
        config.setFixedConfig(new HyperparameterConfig(
                cr.getInt("fixed.recurrent.units", defaultFixed.getRecurrentUnits()),
                cr.getDouble("fixed.dropout.rate", defaultFixed.getDropoutRate()),
                cr.getInt("fixed.batch.size", defaultFixed.getBatchSize()),
                cr.getInt("fixed.epoch.budget", defaultFixed.getEpochBudget())));

        config.setSearchPatience(requirePositive("patience.search", cr.getInt("patience.search", config.getSearchPatience())));
        config.setFinalPatience(requirePositive("patience.final", cr.getInt("patience.final", config.getFinalPatience())));
        config.setLearningRate(cr.getDouble("learning.rate", config.getLearningRate()));
        config.setSeed(cr.getLong("seed", config.getSeed()));
        config.setScalerFitScope(ScalerFitScope.valueOf(
                cr.getValue("scaler.fit.scope", config.getScalerFitScope().name()).toUpperCase(Locale.ROOT)));
        config.setDatasetParallelism(requirePositive("parallel.datasets",
                cr.getInt("parallel.datasets", config.getDatasetParallelism())));
        config.setSearchParallelism(requirePositive("parallel.search",
                cr.getInt("parallel.search", config.getSearchParallelism())));
        config.setReportOriginalUnits(cr.getBoolean("report.original.units", config.isReportOriginalUnits()));
        return config;
    }

    private static int requirePositive(String key, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(key + " must be >= 1, got " + value);
        }
        return value;
    }
}
