package com.datcoord.store;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import org.junit.jupiter.api.Test;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HttpContentStoreTest {

    private final List<Request> requests = new ArrayList<>();

    @Test
    void shouldPutBlobAndReadNewlyCreatedId() {
        HttpContentStore store = storeAnswering(request -> json(request, 200,
                "{\"newlyCreated\":{\"blobObject\":{\"blobId\":\"blob-123\",\"size\":3}}}"));

        ContentId id = store.put(new byte[] { 1, 2, 3 });

        assertEquals("blob-123", id.value());
        Request sent = requests.get(0);
        assertEquals("PUT", sent.method());
        assertEquals("/v1/blobs", sent.url().encodedPath());
        assertEquals("2", sent.url().queryParameter("epochs"));
    }

    @Test
    void shouldAcceptAlreadyCertifiedBlob() {
        HttpContentStore store = storeAnswering(request -> json(request, 200,
                "{\"alreadyCertified\":{\"blobId\":\"blob-known\",\"endEpoch\":40}}"));

        assertEquals("blob-known", store.put(new byte[] { 4 }).value());
    }

    @Test
    void shouldReadBlobsFromAggregator() {
        HttpContentStore store = storeAnswering(request -> new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(200)
                .message("OK")
                .body(ResponseBody.create("payload".getBytes(StandardCharsets.UTF_8),
                        MediaType.parse("application/octet-stream")))
                .build());

        byte[] data = store.get(new ContentId("blob-123"));

        assertArrayEquals("payload".getBytes(StandardCharsets.UTF_8), data);
        assertEquals("aggregator.test", requests.get(0).url().host());
        assertEquals("/v1/blobs/blob-123", requests.get(0).url().encodedPath());
    }

    @Test
    void shouldMapNotFoundAndServerErrors() {
        HttpContentStore missing = storeAnswering(request -> json(request, 404, "{}"));
        assertThrows(ContentNotFoundException.class, () -> missing.get(new ContentId("blob-x")));

        HttpContentStore failing = storeAnswering(request -> json(request, 503, "{}"));
        assertThrows(StorageUnavailableException.class, () -> failing.get(new ContentId("blob-x")));
        assertThrows(StorageUnavailableException.class, () -> failing.put(new byte[] { 1 }));
    }

    @Test
    void shouldRejectUploadResponseWithoutBlobId() {
        HttpContentStore store = storeAnswering(request -> json(request, 200, "{\"unexpected\":true}"));

        assertThrows(StorageUnavailableException.class, () -> store.put(new byte[] { 1 }));
    }

    private HttpContentStore storeAnswering(Function<Request, Response> responder) {
        OkHttpClient client = new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    requests.add(chain.request());
                    return responder.apply(chain.request());
                })
                .build();
        return new HttpContentStore(client, "http://publisher.test", "http://aggregator.test", 2);
    }

    private static Response json(Request request, int code, String body) {
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(code)
                .message("status " + code)
                .body(ResponseBody.create(body, MediaType.parse("application/json")))
                .build();
    }
}
