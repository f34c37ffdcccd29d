package ch.so.arp.rag.engine.backend.qdrant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServiceUnavailable;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.rag.engine.BackendUnavailableException;
import ch.so.arp.rag.engine.NotFoundException;

class RestQdrantClientTest {

    private static final String BASE = "http://qdrant.test:6333";

    private MockRestServiceServer server;
    private RestQdrantClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
        server = MockRestServiceServer.bindTo(builder).build();
        client = new RestQdrantClient(builder.build(), new ObjectMapper());
    }

    @Test
    void listsCollectionNames() {
        server.expect(requestTo(BASE + "/collections"))
                .andRespond(withSuccess("{\"result\":{\"collections\":[{\"name\":\"a\"},{\"name\":\"b\"}]}}",
                        MediaType.APPLICATION_JSON));

        assertThat(client.listCollections()).containsExactly("a", "b");
    }

    @Test
    void searchSendsFilterOnMetadataKeys() {
        server.expect(requestTo(BASE + "/collections/plans/points/search"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"limit\":3,\"with_payload\":true,"
                        + "\"filter\":{\"must\":[{\"key\":\"metadata.lang\",\"match\":{\"value\":\"de\"}}]}}"))
                .andRespond(withSuccess("{\"result\":[{\"id\":\"p1\",\"score\":0.8,"
                        + "\"payload\":{\"doc_id\":\"d1\",\"text\":\"chunk\"}}]}", MediaType.APPLICATION_JSON));

        List<QdrantClient.ScoredPoint> points = client.search("plans", new float[] { 0.1f, 0.2f }, 3,
                Map.of("lang", "de"));

        assertThat(points).singleElement().satisfies(point -> {
            assertThat(point.id()).isEqualTo("p1");
            assertThat(point.score()).isEqualTo(0.8d);
            assertThat(point.payload()).containsEntry("doc_id", "d1");
        });
        server.verify();
    }

    @Test
    void scrollReportsTheNextOffset() {
        server.expect(requestTo(BASE + "/collections/plans/points/scroll"))
                .andExpect(content().json("{\"limit\":2,\"with_payload\":true,\"with_vector\":false}"))
                .andRespond(withSuccess("{\"result\":{\"points\":[{\"id\":\"p1\",\"payload\":{}},"
                        + "{\"id\":\"p2\",\"payload\":{}}],\"next_page_offset\":\"p3\"}}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/collections/plans/points/scroll"))
                .andExpect(content().json("{\"offset\":\"p3\"}"))
                .andRespond(withSuccess("{\"result\":{\"points\":[{\"id\":\"p3\",\"payload\":{}}],"
                        + "\"next_page_offset\":null}}", MediaType.APPLICATION_JSON));

        QdrantClient.ScrollPage first = client.scroll("plans", null, 2);
        QdrantClient.ScrollPage second = client.scroll("plans", first.nextOffset(), 2);

        assertThat(first.points()).extracting(QdrantClient.Point::id).containsExactly("p1", "p2");
        assertThat(first.nextOffset()).isEqualTo("p3");
        assertThat(second.nextOffset()).isNull();
        server.verify();
    }

    @Test
    void missingCollectionIsNotFound() {
        server.expect(requestTo(BASE + "/collections/missing/points/count")).andRespond(withResourceNotFound());

        assertThatThrownBy(() -> client.count("missing")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void serverErrorsMeanTheServiceIsUnavailable() {
        server.expect(requestTo(BASE + "/collections/plans/exists")).andRespond(withServiceUnavailable());

        assertThatThrownBy(() -> client.collectionExists("plans")).isInstanceOf(BackendUnavailableException.class);
    }
}
