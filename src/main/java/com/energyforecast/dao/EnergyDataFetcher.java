package com.energyforecast.dao;

import com.energyforecast.entity.RawSeries;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.TimeUnit;

/**
 * 下载小时负荷数据到本地数据目录，已存在的文件直接复用
 */
public class EnergyDataFetcher implements SeriesSource {
    private static final Logger logger = LoggerFactory.getLogger(EnergyDataFetcher.class);

    private static final OkHttpClient OK_HTTP_CLIENT = new OkHttpClient.Builder()
            .connectTimeout(15, TimeUnit.SECONDS)
            .readTimeout(60, TimeUnit.SECONDS) // 单个数据文件可达十几 MB
            .writeTimeout(15, TimeUnit.SECONDS)
            .build();

    private final String urlTemplate;
    private final CsvSeriesDao csvSeriesDao;
    private final OkHttpClient client;

    /**
     * @param urlTemplate 下载地址模板，{dataset} 会被替换为数据集名称
     */
    public EnergyDataFetcher(String urlTemplate, CsvSeriesDao csvSeriesDao) {
        this(urlTemplate, csvSeriesDao, OK_HTTP_CLIENT);
    }

    EnergyDataFetcher(String urlTemplate, CsvSeriesDao csvSeriesDao, OkHttpClient client) {
        this.urlTemplate = urlTemplate;
        this.csvSeriesDao = csvSeriesDao;
        this.client = client;
    }

    @Override
    public RawSeries load(String datasetName) throws IOException {
        fetch(datasetName);
        return csvSeriesDao.load(datasetName);
    }

    /**
     * 确保数据文件存在于本地，必要时下载
     *
     * @return 本地文件路径
     * @throws IOException HTTP 请求失败或写文件失败
     */
    public Path fetch(String datasetName) throws IOException {
        Path target = csvSeriesDao.resolveFile(datasetName);
        if (Files.exists(target)) {
            logger.debug("Using cached data file {}", target);
            return target;
        }

        HttpUrl url = HttpUrl.parse(urlTemplate.replace(CsvSeriesDao.DATASET_PLACEHOLDER, datasetName));
        if (url == null) {
            throw new IOException("Invalid download URL template: " + urlTemplate);
        }

        Request request = new Request.Builder()
                .url(url)
                .get()
                .build();

        logger.info("Downloading dataset {} from {}", datasetName, url);
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("HTTP request failed: status " + response.code() + ", reason: " + response.message());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Empty response body from " + url);
            }

            Path parent = target.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, datasetName, ".part");
            try (InputStream in = body.byteStream()) {
                Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
        }

        logger.info("Saved dataset {} to {} ({} bytes)", datasetName, target, Files.size(target));
        return target;
    }
}
