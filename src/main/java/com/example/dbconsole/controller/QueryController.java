package com.example.dbconsole.controller;

import com.example.dbconsole.model.QueryRequest;
import com.example.dbconsole.model.QueryResponse;
import com.example.dbconsole.service.QueryService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
public class QueryController {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(QueryController.class);

    @Autowired
    private QueryService queryService;

    @PostMapping("/query")
    public ResponseEntity<QueryResponse> executeQuery(@RequestBody QueryRequest request) {
        String query = request.getQuery();
        log.info("API CALL: executeQuery, length: {}", query == null ? 0 : query.length());
        try {
            return ResponseEntity.ok(queryService.executeQuery(query));
        } catch (IllegalArgumentException e) {
            log.info("API REJECTED: executeQuery, reason: {}", e.getMessage());
            return ResponseEntity.badRequest().body(QueryResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("API ERROR: executeQuery", e);
            return ResponseEntity.ok(QueryResponse.error(e.getMessage() != null ? e.getMessage() : e.toString()));
        }
    }
}
