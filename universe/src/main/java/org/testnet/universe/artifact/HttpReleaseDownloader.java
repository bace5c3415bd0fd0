package org.testnet.universe.artifact;

import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

/**
 * Downloads releases over plain http(s).
 */
@Slf4j
public class HttpReleaseDownloader implements ReleaseDownloader {

    @Override
    public void download(String url, Path target, Duration timeout) {
        log.info("Downloading release: {} -> {}", url, target);

        int timeoutMillis = Math.toIntExact(timeout.toMillis());
        RequestConfig config = RequestConfig.custom()
                .setConnectTimeout(timeoutMillis)
                .setConnectionRequestTimeout(timeoutMillis)
                .setSocketTimeout(timeoutMillis)
                .build();

        try (CloseableHttpClient httpClient = HttpClients.custom().setDefaultRequestConfig(config).build();
             CloseableHttpResponse response = httpClient.execute(new HttpGet(url))) {
            checkStatus(url, response);

            HttpEntity entity = response.getEntity();
            if (entity == null) {
                throw new ArtifactException("Empty response downloading release: " + url);
            }

            Files.deleteIfExists(target);
            try (InputStream content = entity.getContent()) {
                Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ArtifactException("Can't download release: " + url, e);
        }
    }

    private static void checkStatus(String url, HttpResponse response) {
        int status = response.getStatusLine().getStatusCode();
        if (status != HttpStatus.SC_OK) {
            throw new ArtifactException("Can't download release: " + url + ", status: " + response.getStatusLine());
        }
    }
}
