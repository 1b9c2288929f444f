/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.kubeauth.kubernetes;

import static java.nio.charset.StandardCharsets.UTF_8;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import io.kubeauth.common.configuration.KubeAuthConfiguration;
import io.kubeauth.common.data.ClusterConfig;
import io.kubeauth.common.util.ObjectMapperFactory;
import io.kubeauth.common.util.PemUtils;
import io.kubeauth.kubernetes.models.V1Status;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHeaders;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.config.RegistryBuilder;
import org.apache.http.conn.socket.ConnectionSocketFactory;
import org.apache.http.conn.socket.PlainConnectionSocketFactory;
import org.apache.http.conn.ssl.SSLConnectionSocketFactory;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;

/**
 * Pooled HTTP client for one {@link ClusterConfig} generation.
 *
 * <p>Requests are executed on the provided executor. Cancelling a returned future aborts the HTTP exchange, and a
 * request whose future is cancelled before it is dispatched is never sent.
 */
@Slf4j
public class KubernetesApiClient implements Closeable {

    static final String[] TLS_PROTOCOLS = {"TLSv1.3", "TLSv1.2"};

    @Getter
    private final ClusterConfig config;
    private final String host;
    private final String reviewerJwt;
    private final CloseableHttpClient httpClient;
    private final Executor executor;
    private final ObjectMapper mapper = ObjectMapperFactory.getMapper();

    public KubernetesApiClient(ClusterConfig config, KubeAuthConfiguration conf, Executor executor)
            throws IOException {
        this.config = config;
        this.executor = executor;
        this.host = StringUtils.removeEnd(config.getKubernetesHost(), "/");

        String caCert = config.getKubernetesCaCert();
        String jwt = config.getTokenReviewerJwt();
        if (!config.isDisableLocalCaJwt()) {
            if (StringUtils.isBlank(caCert)) {
                caCert = readLocalFile(conf.getLocalCaCertPath()).orElse(null);
            }
            if (StringUtils.isBlank(jwt)) {
                jwt = readLocalFile(conf.getLocalServiceAccountTokenPath()).orElse(null);
            }
        }
        this.reviewerJwt = StringUtils.trimToNull(jwt);

        RegistryBuilder<ConnectionSocketFactory> registryBuilder = RegistryBuilder.create();
        registryBuilder.register("http", PlainConnectionSocketFactory.getSocketFactory());
        if (StringUtils.isNotBlank(caCert)) {
            registryBuilder.register("https", new SSLConnectionSocketFactory(buildSslContext(caCert),
                    TLS_PROTOCOLS, null, SSLConnectionSocketFactory.getDefaultHostnameVerifier()));
        } else {
            registryBuilder.register("https", SSLConnectionSocketFactory.getSystemSocketFactory());
        }
        PoolingHttpClientConnectionManager cm = new PoolingHttpClientConnectionManager(registryBuilder.build());
        cm.setMaxTotal(conf.getKubernetesHttpMaxConnections());
        cm.setDefaultMaxPerRoute(conf.getKubernetesHttpMaxConnections());

        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(conf.getKubernetesHttpConnectTimeoutMillis())
                .setConnectionRequestTimeout(conf.getKubernetesHttpConnectTimeoutMillis())
                .setSocketTimeout(conf.getKubernetesHttpReadTimeoutMillis())
                .build();
        this.httpClient = HttpClients.custom()
                .setConnectionManager(cm)
                .setDefaultRequestConfig(requestConfig)
                .disableAutomaticRetries()
                .disableRedirectHandling()
                .build();
        log.info("Created Kubernetes API client for {} (custom CA: {}, reviewer JWT: {})", host,
                StringUtils.isNotBlank(caCert), reviewerJwt != null);
    }

    /**
     * The bearer token used to call the API server, if one is configured or mounted into the pod.
     */
    public Optional<String> getReviewerJwt() {
        return Optional.ofNullable(reviewerJwt);
    }

    public HttpGet newGet(String path, String bearerToken) {
        HttpGet get = new HttpGet(host + path);
        setHeaders(get, bearerToken);
        return get;
    }

    public HttpPost newPost(String path, Object body, String bearerToken) throws IOException {
        HttpPost post = new HttpPost(host + path);
        setHeaders(post, bearerToken);
        post.setEntity(new ByteArrayEntity(mapper.writeValueAsBytes(body), ContentType.APPLICATION_JSON));
        return post;
    }

    private static void setHeaders(HttpRequestBase request, String bearerToken) {
        request.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + StringUtils.trimToEmpty(bearerToken));
        request.setHeader(HttpHeaders.CONTENT_TYPE, ContentType.APPLICATION_JSON.getMimeType());
        request.setHeader(HttpHeaders.ACCEPT, ContentType.APPLICATION_JSON.getMimeType());
    }

    /**
     * Execute a request and decode the response body into {@code type}.
     *
     * @return a future completed with the decoded object, or exceptionally with an {@link IOException}
     */
    public <T> CompletableFuture<T> executeAsync(HttpRequestBase request, Class<T> type) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.whenComplete((__, ex) -> {
            if (future.isCancelled()) {
                log.debug("Aborting {} {}", request.getMethod(), request.getURI().getPath());
                request.abort();
            }
        });
        try {
            executor.execute(() -> {
                if (future.isDone()) {
                    return;
                }
                try {
                    future.complete(execute(request, type));
                } catch (Throwable t) {
                    future.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(new IOException("Kubernetes API client is shut down", e));
        }
        return future;
    }

    private <T> T execute(HttpRequestBase request, Class<T> type) throws IOException {
        if (log.isDebugEnabled()) {
            log.debug("Sending {} {}", request.getMethod(), request.getURI());
        }
        try (CloseableHttpResponse response = httpClient.execute(request)) {
            HttpEntity entity = response.getEntity();
            String body = entity != null ? EntityUtils.toString(entity, UTF_8) : "";
            return parseResponse(response.getStatusLine().getStatusCode(), body, type, mapper);
        }
    }

    /**
     * Turn an API server answer into the requested object or a {@link KubernetesApiException}.
     *
     * <p>Statuses outside [200, 206] fail with the trimmed body. Otherwise a {@code Status} object that does not
     * report success fails with that status, and any other body must decode into {@code type}.
     */
    @VisibleForTesting
    static <T> T parseResponse(int statusCode, String body, Class<T> type, ObjectMapper mapper)
            throws KubernetesApiException {
        if (statusCode < 200 || statusCode > 206) {
            String trimmed = StringUtils.trimToEmpty(body);
            V1Status status = readStatus(trimmed, mapper);
            return throwFor(statusCode, trimmed, status);
        }
        JsonNode node;
        try {
            node = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new KubernetesApiException("Unable to decode response: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new KubernetesApiException(statusCode, "Unexpected response body", body);
        }
        if (V1Status.KIND.equals(node.path("kind").asText())) {
            V1Status status = mapper.convertValue(node, V1Status.class);
            if (!V1Status.STATUS_SUCCESS.equals(status.getStatus())) {
                throw KubernetesApiException.fromStatus(status, body);
            }
        }
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new KubernetesApiException("Unable to decode " + type.getSimpleName() + ": "
                    + e.getOriginalMessage(), e);
        }
    }

    private static <T> T throwFor(int statusCode, String body, V1Status status) throws KubernetesApiException {
        String message = status != null && StringUtils.isNotBlank(status.getMessage())
                ? status.getMessage()
                : String.format("the server responded with the status code %d: %s", statusCode, body);
        throw new KubernetesApiException(statusCode, message, body, status);
    }

    private static V1Status readStatus(String body, ObjectMapper mapper) {
        try {
            JsonNode node = mapper.readTree(body);
            if (node != null && V1Status.KIND.equals(node.path("kind").asText())) {
                return mapper.convertValue(node, V1Status.class);
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Error body is not a Status object: {}", e.getMessage());
        }
        return null;
    }

    static SSLContext buildSslContext(String caCertPem) throws IOException {
        List<X509Certificate> certificates = PemUtils.parseCertificates(caCertPem);
        try {
            KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
            trustStore.load(null, null);
            for (int i = 0; i < certificates.size(); i++) {
                trustStore.setCertificateEntry("kubernetes-ca-" + i, certificates.get(i));
            }
            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);
            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, tmf.getTrustManagers(), null);
            return sslContext;
        } catch (GeneralSecurityException e) {
            throw new IOException("Unable to build trust store from CA certificate", e);
        }
    }

    private static Optional<String> readLocalFile(String location) {
        if (StringUtils.isBlank(location)) {
            return Optional.empty();
        }
        Path path = Paths.get(location);
        if (!Files.isReadable(path)) {
            log.debug("Local file {} is not available", location);
            return Optional.empty();
        }
        try {
            return Optional.of(new String(Files.readAllBytes(path), UTF_8));
        } catch (IOException e) {
            log.warn("Unable to read local file {}: {}", location, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
