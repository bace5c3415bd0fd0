package org.testnet.universe.rpc;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.conn.ConnectTimeoutException;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.testnet.universe.rpc.RpcException.Kind;

import java.io.Closeable;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * JSON-RPC over http POST, one request per call, no retries.
 */
@Slf4j
public class HttpJsonRpcTransport implements JsonRpcTransport, Closeable {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final CloseableHttpClient httpClient;

    public HttpJsonRpcTransport() {
        this(DEFAULT_TIMEOUT);
    }

    public HttpJsonRpcTransport(Duration timeout) {
        int timeoutMillis = Math.toIntExact(timeout.toMillis());
        RequestConfig config = RequestConfig.custom()
                .setConnectTimeout(timeoutMillis)
                .setConnectionRequestTimeout(timeoutMillis)
                .setSocketTimeout(timeoutMillis)
                .build();

        this.httpClient = HttpClients.custom()
                .setDefaultRequestConfig(config)
                .disableAutomaticRetries()
                .build();
    }

    @Override
    public JsonObject send(String endpoint, JsonObject request) {
        HttpPost post = new HttpPost("http://" + endpoint);
        post.setEntity(new StringEntity(request.toString(), ContentType.APPLICATION_JSON));

        String body;
        int status;
        try (CloseableHttpResponse response = httpClient.execute(post)) {
            status = response.getStatusLine().getStatusCode();
            body = response.getEntity() == null
                    ? ""
                    : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
        } catch (SocketTimeoutException | ConnectTimeoutException e) {
            throw new RpcException(Kind.TIMEOUT, endpoint, "no response", e);
        } catch (IOException e) {
            throw new RpcException(Kind.REFUSED, endpoint, e.getMessage(), e);
        }

        JsonElement json;
        try {
            json = JsonParser.parseString(body);
        } catch (JsonParseException e) {
            if (status != HttpStatus.SC_OK) {
                throw new RpcException(Kind.REMOTE, endpoint, "http status " + status);
            }
            throw new RpcException(Kind.DECODE, endpoint, "invalid json response", e);
        }

        if (!json.isJsonObject()) {
            if (status != HttpStatus.SC_OK) {
                throw new RpcException(Kind.REMOTE, endpoint, "http status " + status);
            }
            throw new RpcException(Kind.DECODE, endpoint, "response is not a json object: " + body);
        }

        log.trace("{} -> {}: {}", request, endpoint, json);
        return json.getAsJsonObject();
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
