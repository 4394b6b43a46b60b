package com.acmeCables.proposalEngine.retrieval.service;

import com.acmeCables.proposalEngine.resilience.exception.CollaboratorRejectedException;
import com.acmeCables.proposalEngine.resilience.exception.UpstreamUnavailableException;
import com.acmeCables.proposalEngine.retrieval.model.VectorHit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServiceUnavailable;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RetrievalClientsTest {

    // nothing listens on port 1
    private static final String UNREACHABLE_URL = "http://localhost:1";
    private static final String QDRANT_URL = "http://qdrant.test";
    private static final String SEARCH_URL = QDRANT_URL + "/collections/sku_index/points/search";

    @Test
    @DisplayName("embedding refuses to call without an API key")
    void embeddingWithoutKey() {
        CohereEmbeddingClient client = new CohereEmbeddingClient(UNREACHABLE_URL + "/v2/embed");

        assertThatThrownBy(() -> client.embed("11 kV XLPE cable"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cohere.api.key");
    }

    @Test
    @DisplayName("embedding transport failures are upstream unavailable")
    void embeddingUnreachable() {
        CohereEmbeddingClient client = new CohereEmbeddingClient(UNREACHABLE_URL + "/v2/embed");
        ReflectionTestUtils.setField(client, "apiKey", "test-key");
        ReflectionTestUtils.setField(client, "model", "embed-english-v3.0");

        assertThatThrownBy(() -> client.embed("11 kV XLPE cable"))
                .isInstanceOf(UpstreamUnavailableException.class);
    }

    @Test
    @DisplayName("vector search transport failures are upstream unavailable")
    void searchUnreachable() {
        QdrantVectorSearchClient client = new QdrantVectorSearchClient(UNREACHABLE_URL);
        ReflectionTestUtils.setField(client, "collection", "sku_index");

        assertThatThrownBy(() -> client.query(new float[] {0.1f, 0.2f}, 10))
                .isInstanceOf(UpstreamUnavailableException.class);
    }

    @Test
    @DisplayName("vector search reads sku ids from the payload or its metadata")
    void searchHits() {
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        QdrantVectorSearchClient client = new QdrantVectorSearchClient(builder, QDRANT_URL);
        ReflectionTestUtils.setField(client, "collection", "sku_index");
        server.expect(requestTo(SEARCH_URL)).andRespond(withSuccess("""
                {"status": "ok", "result": [
                  {"id": 1, "score": 0.92, "payload": {"metadata": {"sku_id": "SKU-HT-11"}}},
                  {"id": 2, "score": 0.81, "payload": {"sku_id": "SKU-HT-12"}},
                  {"id": 3, "score": 0.40, "payload": {"name": "no id"}}
                ]}
                """, MediaType.APPLICATION_JSON));

        assertThat(client.query(new float[] {0.1f, 0.2f}, 10))
                .extracting(VectorHit::getCandidateId)
                .containsExactly("SKU-HT-11", "SKU-HT-12");
        server.verify();
    }

    @Test
    @DisplayName("vector search on a missing collection is a rejection, not an outage")
    void searchRejected() {
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        QdrantVectorSearchClient client = new QdrantVectorSearchClient(builder, QDRANT_URL);
        ReflectionTestUtils.setField(client, "collection", "sku_index");
        server.expect(requestTo(SEARCH_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> client.query(new float[] {0.1f}, 10))
                .isInstanceOf(CollaboratorRejectedException.class)
                .hasMessageContaining("404");
    }

    @Test
    @DisplayName("embedding separates rejected requests from unavailable service")
    void embeddingStatuses() {
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        CohereEmbeddingClient client = new CohereEmbeddingClient(builder, "http://cohere.test/v2/embed");
        ReflectionTestUtils.setField(client, "apiKey", "test-key");
        ReflectionTestUtils.setField(client, "model", "embed-english-v3.0");
        server.expect(requestTo("http://cohere.test/v2/embed")).andRespond(withBadRequest());
        server.expect(requestTo("http://cohere.test/v2/embed")).andRespond(withServiceUnavailable());

        assertThatThrownBy(() -> client.embed("11 kV XLPE cable"))
                .isInstanceOf(CollaboratorRejectedException.class);
        assertThatThrownBy(() -> client.embed("11 kV XLPE cable"))
                .isInstanceOf(UpstreamUnavailableException.class);
    }
}
