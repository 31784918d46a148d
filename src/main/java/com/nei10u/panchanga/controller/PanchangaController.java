package com.nei10u.panchanga.controller;

import com.nei10u.panchanga.model.PanchangaRequest;
import com.nei10u.panchanga.model.PanchangaResult;
import com.nei10u.panchanga.service.PanchangaService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/panchanga")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class PanchangaController {

    private static final Logger log = LoggerFactory.getLogger(PanchangaController.class);
    private final PanchangaService panchangaService;

    @PostMapping("/compute")
    public ResponseEntity<PanchangaResult> compute(@RequestBody PanchangaRequest request) {
        String rid = ensureRequestId(request);
        log.info("[{}] compute start", rid);
        PanchangaResult result = panchangaService.calculate(request);
        log.info("[{}] compute done jd={}", rid, result.getJulianDay());
        return ResponseEntity.ok(result);
    }

    private String ensureRequestId(PanchangaRequest request) {
        if (request.getRequestId() == null || request.getRequestId().isBlank()) {
            request.setRequestId(UUID.randomUUID().toString());
        }
        return request.getRequestId();
    }
}
