package com.formulagrid.app.controllers;

import com.formulagrid.app.AppApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = AppApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class SheetControllerIntegrationTest {

    @LocalServerPort
    int port;

    private RestTemplate restTemplate;
    private HttpHeaders headers;

    @BeforeEach
    void setUp() {
        // The JDK client supports PATCH
        restTemplate = new RestTemplate(new JdkClientHttpRequestFactory());
        headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
    }

    private String url(String path) {
        return "http://localhost:" + port + "/sheets" + path;
    }

    private String createSheet(String body) {
        ResponseEntity<Map> response = restTemplate.postForEntity(url(""), new HttpEntity<>(body, headers), Map.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        String sheetId = (String) response.getBody().get("id");
        assertNotNull(sheetId);
        return sheetId;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> patch(String sheetId, String edits) {
        ResponseEntity<Map> response = restTemplate.exchange(url("/" + sheetId), HttpMethod.PATCH,
                new HttpEntity<>("{\"edits\": " + edits + "}", headers), Map.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        return (Map<String, Object>) response.getBody().get("computedValues");
    }

    /**
     * The seeded "Budget Calculator" sheet is available at startup.
     */
    @Test
    @SuppressWarnings("unchecked")
    void testSeedSheetIsEvaluated() {
        ResponseEntity<Map> response = restTemplate.getForEntity(url("/seed-sheet-1"), Map.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("Budget Calculator", response.getBody().get("name"));

        Map<String, Object> values = (Map<String, Object>) response.getBody().get("computedValues");
        assertEquals("Revenue", values.get("A1"));
        assertEquals(700.0, values.get("C3"));
        assertEquals(3000.0, values.get("A5"));
        assertEquals(1450.0, values.get("C5"));
        assertEquals("#CYCLE!", values.get("C6"));
        assertEquals("#CYCLE!", values.get("C7"));
    }

    /**
     * Create, edit, and read back: C1 follows A1 after A1 changes.
     */
    @Test
    @SuppressWarnings("unchecked")
    void testCreateSheetAndApplyEdits() {
        String sheetId = createSheet("{\"name\": \"Test\", \"rows\": 10, \"cols\": 5}");

        Map<String, Object> values = patch(sheetId, "[" +
                "{\"addr\": \"A1\", \"kind\": \"literal\", \"value\": 5}," +
                "{\"addr\": \"B1\", \"kind\": \"literal\", \"value\": \"hello\"}," +
                "{\"addr\": \"C1\", \"kind\": \"formula\", \"formula\": \"=A1*2\"}," +
                "{\"addr\": \"D1\", \"kind\": \"formula\", \"formula\": \"=(1+\"}]");
        assertEquals(5.0, values.get("A1"));
        assertEquals("hello", values.get("B1"));
        assertEquals(10.0, values.get("C1"));
        assertEquals("#PARSE!", values.get("D1"));

        patch(sheetId, "[{\"addr\": \"A1\", \"kind\": \"literal\", \"value\": 7}]");

        ResponseEntity<Map> response = restTemplate.getForEntity(url("/" + sheetId), Map.class);
        Map<String, Object> data = (Map<String, Object>) response.getBody().get("computedValues");
        assertEquals(14.0, data.get("C1"));

        Map<String, Object> cells = (Map<String, Object>) response.getBody().get("cells");
        Map<String, Object> c1 = (Map<String, Object>) cells.get("C1");
        assertEquals("formula", c1.get("kind"));
        assertEquals("=A1*2", c1.get("src"));
    }

    @Test
    void testUnknownSheetReturnsNotFound() {
        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.getForEntity(url("/no-such-sheet"), Map.class));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }

    /**
     * An edit outside the sheet is rejected and nothing in the batch is applied.
     */
    @Test
    @SuppressWarnings("unchecked")
    void testOutOfBoundsEditIsRejected() {
        String sheetId = createSheet("{\"rows\": 5, \"cols\": 5}");

        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class, () ->
                patch(sheetId, "[{\"addr\": \"A1\", \"kind\": \"literal\", \"value\": 1}," +
                        "{\"addr\": \"Z99\", \"kind\": \"literal\", \"value\": 2}]"));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());

        ResponseEntity<Map> response = restTemplate.getForEntity(url("/" + sheetId), Map.class);
        assertTrue(((Map<String, Object>) response.getBody().get("computedValues")).isEmpty());
    }

    @Test
    void testCreateSheetTooLargeIsRejected() {
        // max-rows is 500 in the test profile
        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class, () ->
                createSheet("{\"rows\": 501}"));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testPasteMovesRelativeReferences() {
        String sheetId = createSheet("{\"rows\": 10, \"cols\": 5}");
        patch(sheetId, "[" +
                "{\"addr\": \"A1\", \"kind\": \"literal\", \"value\": 1}," +
                "{\"addr\": \"A2\", \"kind\": \"literal\", \"value\": 2}," +
                "{\"addr\": \"B1\", \"kind\": \"formula\", \"formula\": \"=A1*2\"}]");

        ResponseEntity<Map> response = restTemplate.postForEntity(url("/" + sheetId + "/paste"),
                new HttpEntity<>("{\"from\": \"B1\", \"to\": \"B2\"}", headers), Map.class);
        Map<String, Object> values = (Map<String, Object>) response.getBody().get("computedValues");
        assertEquals(4.0, values.get("B2"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testExplainCell() {
        ResponseEntity<Map> response = restTemplate.getForEntity(url("/seed-sheet-1/cells/C3/explain"), Map.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("C3", response.getBody().get("address"));

        List<Map<String, Object>> trace = (List<Map<String, Object>>) response.getBody().get("trace");
        assertEquals(1, trace.size());
        assertEquals("=A3-B3", trace.get(0).get("formula"));
        assertEquals(700.0, trace.get(0).get("value"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testDependencyGraphs() {
        String sheetId = createSheet("{\"rows\": 10, \"cols\": 5}");
        patch(sheetId, "[" +
                "{\"addr\": \"B1\", \"kind\": \"formula\", \"formula\": \"=C2\"}," +
                "{\"addr\": \"A1\", \"kind\": \"formula\", \"formula\": \"=B1\"}]");

        Map<String, List<String>> forwardGraph = restTemplate.getForEntity(
                url("/" + sheetId + "/forwardDependencies"), Map.class).getBody();
        assertNotNull(forwardGraph);
        assertEquals(Collections.singletonList("C2"), forwardGraph.get("B1"));
        assertEquals(Collections.singletonList("B1"), forwardGraph.get("A1"));

        Map<String, List<String>> reverseGraph = restTemplate.getForEntity(
                url("/" + sheetId + "/reverseDependencies"), Map.class).getBody();
        assertNotNull(reverseGraph);
        assertEquals(Collections.singletonList("B1"), reverseGraph.get("C2"));
        assertEquals(Collections.singletonList("A1"), reverseGraph.get("B1"));
    }
}
