package com.datcoord.store;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class HttpContentStore implements ContentStore {
    private static final Logger log = LoggerFactory.getLogger(HttpContentStore.class);
    private static final MediaType OCTET_STREAM = MediaType.parse("application/octet-stream");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final HttpUrl publisherUrl;
    private final HttpUrl aggregatorUrl;
    private final int storageEpochs;

    public HttpContentStore(OkHttpClient httpClient, String publisherUrl, String aggregatorUrl, int storageEpochs) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.mapper = new ObjectMapper();
        this.publisherUrl = HttpUrl.get(publisherUrl);
        this.aggregatorUrl = HttpUrl.get(aggregatorUrl == null || aggregatorUrl.isBlank() ? publisherUrl : aggregatorUrl);
        this.storageEpochs = Math.max(1, storageEpochs);
    }

    public static OkHttpClient boundedClient(Duration timeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .callTimeout(timeout)
                .build();
    }

    @Override
    public ContentId put(byte[] data) {
        Objects.requireNonNull(data, "data");
        HttpUrl url = publisherUrl.newBuilder()
                .addPathSegments("v1/blobs")
                .addQueryParameter("epochs", Integer.toString(storageEpochs))
                .build();
        Request request = new Request.Builder()
                .url(url)
                .put(RequestBody.create(data, OCTET_STREAM))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new StorageUnavailableException("blob upload failed status=" + response.code());
            }
            ContentId id = parseBlobId(mapper.readTree(body.string()));
            log.debug("content.put bytes={} blobId={}", data.length, id);
            return id;
        } catch (IOException e) {
            throw new StorageUnavailableException("blob upload failed: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] get(ContentId id) {
        HttpUrl url = aggregatorUrl.newBuilder()
                .addPathSegments("v1/blobs")
                .addPathSegment(id.value())
                .build();
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == 404) {
                throw new ContentNotFoundException(id);
            }
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new StorageUnavailableException("blob download failed blobId=" + id + " status=" + response.code());
            }
            return body.bytes();
        } catch (IOException e) {
            throw new StorageUnavailableException("blob download failed blobId=" + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "http:" + publisherUrl;
    }

    private ContentId parseBlobId(JsonNode root) {
        JsonNode created = root.path("newlyCreated").path("blobObject").path("blobId");
        if (created.isTextual()) {
            return new ContentId(created.asText());
        }
        JsonNode certified = root.path("alreadyCertified").path("blobId");
        if (certified.isTextual()) {
            return new ContentId(certified.asText());
        }
        throw new StorageUnavailableException("blob upload response carried no blobId");
    }
}
