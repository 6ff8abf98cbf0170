package deckhand.cluster.kubernetes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import deckhand.cluster.OrchestrationApiException;
import deckhand.cluster.model.JobPhase;
import deckhand.cluster.spec.SecretSpec;
import deckhand.engine.translate.ResourceTranslator;
import io.kubernetes.client.util.ClientBuilder;
import io.kubernetes.client.util.credentials.AccessTokenAuthentication;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static deckhand.engine.PipelineFixtures.batch;
import static deckhand.engine.PipelineFixtures.context;
import static deckhand.engine.PipelineFixtures.service;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the client against a scripted HTTP server standing in for the API
 * server.
 */
class KubernetesApiClientTest {

    private record Exchange(String method, String uri, String contentType, String authorization, String body) {
    }

    private record Reply(int status, String body) {
    }

    private static final ObjectMapper mapper = new ObjectMapper();

    private HttpServer server;
    private KubernetesApiClient client;
    private final List<Exchange> exchanges = new CopyOnWriteArrayList<>();
    private final Map<String, Reply> replies = new ConcurrentHashMap<>();

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        String base = "http://127.0.0.1:" + server.getAddress().getPort();
        client = new KubernetesApiClient(new ClientBuilder()
                .setBasePath(base)
                .setAuthentication(new AccessTokenAuthentication("t0ken"))
                .build());
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private void reply(String method, String path, int status, String body) {
        replies.put(method + " " + path, new Reply(status, body.replace('\'', '"')));
    }

    private void handle(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        String uri = exchange.getRequestURI().toString();
        exchanges.add(new Exchange(exchange.getRequestMethod(), uri,
                exchange.getRequestHeaders().getFirst("Content-Type"),
                exchange.getRequestHeaders().getFirst("Authorization"), body));

        String path = exchange.getRequestURI().getPath();
        Reply reply = replies.getOrDefault(exchange.getRequestMethod() + " " + path, new Reply(200, "{}"));
        byte[] bytes = reply.body().getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(reply.status(), bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    @Test
    void createJobPostsManifestWithToken() throws Exception {
        var job = new ResourceTranslator("sa").translate(batch("train", 10, 0), context("r1"), 1).job();

        client.createJob(job);

        Exchange sent = exchanges.get(0);
        assertEquals("POST", sent.method());
        assertEquals("/apis/batch/v1/namespaces/ml/jobs", sent.uri());
        assertEquals("Bearer t0ken", sent.authorization());
        assertTrue(sent.contentType().startsWith("application/json"), sent.contentType());
        JsonNode body = mapper.readTree(sent.body());
        assertEquals(job.name(), body.path("metadata").path("name").asText());
    }

    @Test
    void readJobMapsStatusAndMissingJob() {
        reply("GET", "/apis/batch/v1/namespaces/ml/jobs/done", 200,
                "{'metadata':{'name':'done'},'status':{'succeeded':1}}");
        reply("GET", "/apis/batch/v1/namespaces/ml/jobs/gone", 404, "{'message':'not found'}");

        assertEquals(JobPhase.SUCCEEDED, client.readJob("ml", "done").phase());
        assertEquals(JobPhase.NOT_FOUND, client.readJob("ml", "gone").phase());
    }

    @Test
    void errorsCarryStatusAndMessage() {
        reply("GET", "/apis/batch/v1/namespaces/ml/jobs/x", 500, "{'kind':'Status','message':'etcd timeout'}");

        OrchestrationApiException e = assertThrows(OrchestrationApiException.class, () -> client.readJob("ml", "x"));
        assertEquals(500, e.statusCode());
        assertTrue(e.getMessage().contains("etcd timeout"), e.getMessage());
    }

    @Test
    void deleteJobIgnoresMissingAndPropagatesInBackground() {
        reply("DELETE", "/apis/batch/v1/namespaces/ml/jobs/gone", 404, "{}");

        client.deleteJob("ml", "gone");

        assertEquals("/apis/batch/v1/namespaces/ml/jobs/gone?propagationPolicy=Background", exchanges.get(0).uri());
    }

    @Test
    void forbiddenNamespaceReadIsAssumedToExist() {
        reply("GET", "/api/v1/namespaces/ml", 403, "{'message':'forbidden'}");
        reply("GET", "/api/v1/namespaces/absent", 404, "{}");

        assertTrue(client.namespaceExists("ml"));
        assertFalse(client.namespaceExists("absent"));
    }

    @Test
    void serviceAccountConflictIsIgnored() {
        reply("POST", "/api/v1/namespaces/ml/serviceaccounts", 409, "{'message':'exists'}");

        assertDoesNotThrow(() -> client.ensureServiceAccount("ml", "deckhand-stage"));
    }

    @Test
    void existingSecretIsReplaced() {
        reply("POST", "/api/v1/namespaces/ml/secrets", 409, "{'message':'exists'}");

        client.createSecret(new SecretSpec("ml", "dev-db", Map.of(), Map.of("PW", "x")));

        assertEquals(2, exchanges.size());
        assertEquals("PUT", exchanges.get(1).method());
        assertEquals("/api/v1/namespaces/ml/secrets/dev-db", exchanges.get(1).uri());
    }

    @Test
    void deleteMissingSecretFails() {
        reply("DELETE", "/api/v1/namespaces/ml/secrets/none", 404, "{}");

        OrchestrationApiException e = assertThrows(OrchestrationApiException.class,
                () -> client.deleteSecret("ml", "none"));
        assertTrue(e.isNotFound());
    }

    @Test
    void listUsesLabelSelector() {
        reply("GET", "/apis/batch/v1/namespaces/ml/jobs", 200,
                "{'items':[{'metadata':{'name':'a'},'status':{'active':1}}]}");

        var jobs = client.listJobs("ml", Map.of("app", "deckhand"));

        assertEquals(1, jobs.size());
        assertEquals("/apis/batch/v1/namespaces/ml/jobs?labelSelector=app%3Ddeckhand", exchanges.get(0).uri());
    }

    @Test
    void rollbackReplacesTemplateWithTargetRevision() throws Exception {
        reply("GET", "/apis/apps/v1/namespaces/ml/deployments/demo--serve", 200, """
                {'metadata':{'name':'demo--serve','generation':2,'resourceVersion':'77',
                  'annotations':{'deployment.kubernetes.io/revision':'2'}},
                 'spec':{'replicas':1,'selector':{'matchLabels':{'stage':'serve'}},
                         'template':{'metadata':{'labels':{'stage':'serve'}},
                                     'spec':{'containers':[{'name':'deckhand','image':'img:2'}]}}}}
                """);
        reply("GET", "/apis/apps/v1/namespaces/ml/replicasets", 200, """
                {'items':[
                  {'metadata':{'annotations':{'deployment.kubernetes.io/revision':'1'}},
                   'spec':{'selector':{'matchLabels':{'stage':'serve'}},
                           'template':{'metadata':{'labels':{'stage':'serve','pod-template-hash':'a1'}},
                                       'spec':{'containers':[{'name':'deckhand','image':'img:1'}]}}}},
                  {'metadata':{'annotations':{'deployment.kubernetes.io/revision':'2'}},
                   'spec':{'selector':{'matchLabels':{'stage':'serve'}},
                           'template':{'metadata':{'labels':{'stage':'serve','pod-template-hash':'b2'}},
                                       'spec':{'containers':[{'name':'deckhand','image':'img:2'}]}}}}]}
                """);

        client.rollbackDeployment("ml", "demo--serve", 0);

        assertEquals("/apis/apps/v1/namespaces/ml/replicasets?labelSelector=stage%3Dserve", exchanges.get(1).uri());
        Exchange replace = exchanges.get(exchanges.size() - 1);
        assertEquals("PUT", replace.method());
        assertEquals("/apis/apps/v1/namespaces/ml/deployments/demo--serve", replace.uri());
        JsonNode body = mapper.readTree(replace.body());
        assertEquals("77", body.path("metadata").path("resourceVersion").asText());
        JsonNode template = body.path("spec").path("template");
        assertEquals("img:1", template.path("spec").path("containers").path(0).path("image").asText());
        assertFalse(template.path("metadata").path("labels").has("pod-template-hash"));
    }

    @Test
    void unknownRevisionIsNotFound() {
        reply("GET", "/apis/apps/v1/namespaces/ml/deployments/demo--serve", 200, """
                {'metadata':{'name':'demo--serve','annotations':{'deployment.kubernetes.io/revision':'1'}},
                 'spec':{'selector':{'matchLabels':{'stage':'serve'}},
                         'template':{'spec':{'containers':[{'name':'deckhand','image':'img:1'}]}}}}
                """);
        reply("GET", "/apis/apps/v1/namespaces/ml/replicasets", 200, "{'items':[]}");

        OrchestrationApiException e = assertThrows(OrchestrationApiException.class,
                () -> client.rollbackDeployment("ml", "demo--serve", 0));
        assertTrue(e.isNotFound());
    }

    @Test
    void updateKeepsResourceVersionOfLiveDeployment() throws Exception {
        reply("GET", "/apis/apps/v1/namespaces/ml/deployments/demo--serve", 200, """
                {'metadata':{'name':'demo--serve','resourceVersion':'41'},
                 'spec':{'selector':{'matchLabels':{'stage':'serve'}},
                         'template':{'spec':{'containers':[{'name':'deckhand','image':'old'}]}}}}
                """);
        var spec = new ResourceTranslator("sa").translate(service("serve", 10, 2, 5000, false), context("r1"), 1)
                .deployment();

        client.updateDeployment(spec);

        Exchange replace = exchanges.get(exchanges.size() - 1);
        assertEquals("PUT", replace.method());
        assertEquals("/apis/apps/v1/namespaces/ml/deployments/" + spec.name(), replace.uri());
        JsonNode body = mapper.readTree(replace.body());
        assertEquals("41", body.path("metadata").path("resourceVersion").asText());
        assertEquals(2, body.path("spec").path("replicas").asInt());
    }

    @Test
    void missingDeploymentCannotBeUpdated() {
        reply("GET", "/apis/apps/v1/namespaces/ml/deployments/demo--serve", 404, "{'message':'not found'}");
        var spec = new ResourceTranslator("sa").translate(service("serve", 10, 1, 5000, false), context("r1"), 1)
                .deployment();

        OrchestrationApiException e = assertThrows(OrchestrationApiException.class,
                () -> client.updateDeployment(spec));
        assertTrue(e.isNotFound());
    }

    @Test
    void podLogIsPlainText() {
        reply("GET", "/api/v1/namespaces/ml/pods", 200,
                "{'items':[{'metadata':{'name':'p0','creationTimestamp':'2024-05-01T09:00:00Z'}},"
                        + "{'metadata':{'name':'p1','creationTimestamp':'2024-05-01T10:00:00Z'}}]}");
        reply("GET", "/api/v1/namespaces/ml/pods/p1/log", 200, "line one");

        String pod = client.latestPodName("ml", Map.of("job-name", "j")).orElseThrow();

        assertEquals("p1", pod);
        assertEquals("line one", client.readPodLog("ml", pod));
    }
}
