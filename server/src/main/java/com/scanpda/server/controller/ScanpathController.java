package com.scanpda.server.controller;

import com.scanpda.server.grammar.UnknownSymbolException;
import com.scanpda.server.service.ScanpathAnalysisService;
import com.scanpda.server.service.ScanpathReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
public class ScanpathController {

    private static final Logger logger = LoggerFactory.getLogger(ScanpathController.class);
    private final ScanpathAnalysisService analysisService;

    public ScanpathController(ScanpathAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    public static class ScanpathRequest {
        // AOI labels in fixation order
        public List<String> symbols;
    }

    public static class BatchRequest {
        public List<List<String>> scanpaths;
    }

    @PostMapping("/analyze-scanpath")
    public ResponseEntity<?> analyze(@RequestBody ScanpathRequest request) {
        if (!analysisService.isReady()) {
            return ResponseEntity.status(503).body("Grammar is still loading, please try again later.");
        }
        if (request == null || request.symbols == null) {
            return ResponseEntity.badRequest().body("Request must contain a 'symbols' array.");
        }

        logger.info("Received scanpath of {} symbols.", request.symbols.size());
        try {
            ScanpathReport report = analysisService.analyze(request.symbols);
            return ResponseEntity.ok(report);
        } catch (UnknownSymbolException e) {
            logger.warn("Rejected scanpath with unknown symbol '{}'", e.getLabel());
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @PostMapping("/analyze-scanpaths")
    public ResponseEntity<?> analyzeAll(@RequestBody BatchRequest request) {
        if (!analysisService.isReady()) {
            return ResponseEntity.status(503).body("Grammar is still loading, please try again later.");
        }
        if (request == null || request.scanpaths == null) {
            return ResponseEntity.badRequest().body("Request must contain a 'scanpaths' array.");
        }
        for (List<String> scanpath : request.scanpaths) {
            if (scanpath == null) {
                return ResponseEntity.badRequest().body("Scanpaths must not be null.");
            }
        }

        logger.info("Received batch of {} scanpaths.", request.scanpaths.size());
        try {
            List<ScanpathReport> reports = analysisService.analyzeAll(request.scanpaths);
            return ResponseEntity.ok(reports);
        } catch (UnknownSymbolException e) {
            logger.warn("Rejected batch with unknown symbol '{}'", e.getLabel());
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @GetMapping("/grammar")
    public ResponseEntity<?> grammar() {
        if (!analysisService.isReady()) {
            return ResponseEntity.status(503).body("Grammar is still loading, please try again later.");
        }
        return ResponseEntity.ok(analysisService.describeGrammar());
    }
}
