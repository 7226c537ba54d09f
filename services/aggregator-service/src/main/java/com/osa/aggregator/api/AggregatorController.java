package com.osa.aggregator.api;

import com.osa.aggregator.api.dto.ErrorResponse;
import com.osa.aggregator.api.dto.SearchRequest;
import com.osa.aggregator.api.dto.SearchResponse;
import com.osa.aggregator.execution.QueueFullException;
import com.osa.aggregator.service.DispatchResult;
import com.osa.aggregator.service.DispatcherStatus;
import com.osa.aggregator.service.InvalidSearchRequestException;
import com.osa.aggregator.service.NoBackendsAvailableException;
import com.osa.aggregator.service.SearchDispatcher;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AggregatorController {
    private static final Logger logger = LoggerFactory.getLogger(AggregatorController.class);

    private final SearchDispatcher dispatcher;

    public AggregatorController(SearchDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/search")
    public ResponseEntity<?> search(
        @RequestBody(required = false) SearchRequest request,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        String traceId = normalizeOrGenerate(traceIdHeader);
        String requestId = normalizeOrGenerate(requestIdHeader);

        if (request == null) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "request body is required", traceId, requestId)
            );
        }

        try {
            DispatchResult result = dispatcher.searchDetailed(request.getQuery(), request.getOptions());
            SearchResponse response = new SearchResponse();
            response.setTraceId(traceId);
            response.setRequestId(requestId);
            response.setTookMs(result.getTookMs());
            response.setPartial(result.isPartial());
            response.setCached(result.isCached());
            response.setHits(result.getResults());
            response.setBackends(result.getOutcomes());
            return ResponseEntity.ok(response);
        } catch (InvalidSearchRequestException e) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", e.getMessage(), traceId, requestId)
            );
        } catch (NoBackendsAvailableException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                new ErrorResponse("no_backends_available", e.getMessage(), traceId, requestId)
            );
        } catch (QueueFullException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                new ErrorResponse("queue_full", "too many concurrent searches", traceId, requestId)
            );
        } catch (Exception e) {
            logger.error("search_failed trace_id={} request_id={}", traceId, requestId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                new ErrorResponse("internal_error", "Unexpected error", traceId, requestId)
            );
        }
    }

    @GetMapping("/status")
    public DispatcherStatus status() {
        return dispatcher.getStatus();
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleInvalidJson(HttpMessageNotReadableException e, HttpServletRequest request) {
        String traceId = normalizeOrGenerate(request.getHeader("x-trace-id"));
        String requestId = normalizeOrGenerate(request.getHeader("x-request-id"));
        return ResponseEntity.badRequest().body(
            new ErrorResponse("bad_request", "invalid JSON", traceId, requestId)
        );
    }

    private String normalizeOrGenerate(String value) {
        if (value != null && !value.trim().isEmpty()) {
            return value;
        }
        return UUID.randomUUID().toString();
    }
}
