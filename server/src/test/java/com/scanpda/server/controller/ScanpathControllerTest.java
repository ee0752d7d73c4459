package com.scanpda.server.controller;

import com.scanpda.server.pda.Verdict;
import com.scanpda.server.service.PdaConfig;
import com.scanpda.server.service.ScanpathAnalysisService;
import com.scanpda.server.service.ScanpathReport;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ScanpathControllerTest {

    private static ScanpathController readyController() {
        ScanpathAnalysisService service = new ScanpathAnalysisService(PdaConfig.defaults());
        service.init();
        return new ScanpathController(service);
    }

    private static ScanpathController.ScanpathRequest request(String... symbols) {
        ScanpathController.ScanpathRequest request = new ScanpathController.ScanpathRequest();
        request.symbols = Arrays.asList(symbols);
        return request;
    }

    @Test
    public void testAnalyzeReturnsReport() {
        ResponseEntity<?> response = readyController().analyze(request("II", "V1", "QRS", "ST", "T"));

        assertEquals(200, response.getStatusCode().value());
        ScanpathReport report = (ScanpathReport) response.getBody();
        assertNotNull(report);
        assertEquals(Verdict.INCOMPLETE, report.getVerdict());
    }

    @Test
    public void testRejectedScanpathIsStillOk() {
        ResponseEntity<?> response = readyController().analyze(request("QT"));

        assertEquals(200, response.getStatusCode().value());
        assertEquals(Verdict.REJECTED, ((ScanpathReport) response.getBody()).getVerdict());
    }

    @Test
    public void testUnknownSymbolIsBadRequest() {
        ResponseEntity<?> response = readyController().analyze(request("II", "aVF"));

        assertEquals(400, response.getStatusCode().value());
        assertTrue(response.getBody().toString().contains("aVF"));
    }

    @Test
    public void testMissingBodyFieldsAreBadRequest() {
        ScanpathController controller = readyController();

        assertEquals(400, controller.analyze(new ScanpathController.ScanpathRequest()).getStatusCode().value());
        assertEquals(400, controller.analyzeAll(new ScanpathController.BatchRequest()).getStatusCode().value());

        ScanpathController.BatchRequest withNull = new ScanpathController.BatchRequest();
        withNull.scanpaths = Arrays.asList(Arrays.asList("II"), null);
        assertEquals(400, controller.analyzeAll(withNull).getStatusCode().value());
    }

    @Test
    public void testBatchEndpoint() {
        ScanpathController.BatchRequest request = new ScanpathController.BatchRequest();
        request.scanpaths = Arrays.asList(
                Arrays.asList("II", "V1", "QRS", "QT"),
                Arrays.asList("II"));

        ResponseEntity<?> response = readyController().analyzeAll(request);
        assertEquals(200, response.getStatusCode().value());
        @SuppressWarnings("unchecked")
        List<ScanpathReport> reports = (List<ScanpathReport>) response.getBody();
        assertEquals(2, reports.size());
        assertEquals(Verdict.ACCEPTED, reports.get(0).getVerdict());
        assertEquals(Verdict.INCOMPLETE, reports.get(1).getVerdict());
    }

    @Test
    public void testServiceUnavailableUntilGrammarLoaded() {
        ScanpathController controller = new ScanpathController(new ScanpathAnalysisService(PdaConfig.defaults()));

        assertEquals(503, controller.analyze(request("II")).getStatusCode().value());
        assertEquals(503, controller.analyzeAll(new ScanpathController.BatchRequest()).getStatusCode().value());
        assertEquals(503, controller.grammar().getStatusCode().value());
    }

    @Test
    public void testGrammarEndpoint() {
        ResponseEntity<?> response = readyController().grammar();

        assertEquals(200, response.getStatusCode().value());
        @SuppressWarnings("unchecked")
        Map<String, Object> body = (Map<String, Object>) response.getBody();
        assertEquals("ecg-expert-scan", body.get("name"));
    }
}
