package com.narrativeplatform.narrative.controller;

import com.narrativeplatform.common.exception.InputRangeException;
import com.narrativeplatform.common.trace.TraceContextUtil;
import com.narrativeplatform.narrative.dto.ErrorResponseDTO;
import com.narrativeplatform.narrative.dto.NarrativeRequestDTO;
import com.narrativeplatform.narrative.dto.NarrativeResponseDTO;
import com.narrativeplatform.narrative.service.NarrativeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/narrative")
public class NarrativeController {

    private static final Logger log = LoggerFactory.getLogger(NarrativeController.class);

    private final NarrativeService narrativeService;

    public NarrativeController(NarrativeService narrativeService) {
        this.narrativeService = narrativeService;
    }

    @PostMapping("/generate")
    public Mono<ResponseEntity<NarrativeResponseDTO>> generate(
            @RequestBody NarrativeRequestDTO request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        return TraceContextUtil.withTraceId(
            narrativeService.generate(request)
                .map(body -> ResponseEntity.ok()
                    .header(TraceContextUtil.TRACE_ID_HEADER, traceId)
                    .body(body)),
            traceId);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    @ExceptionHandler(InputRangeException.class)
    public ResponseEntity<ErrorResponseDTO> handleInputRange(InputRangeException e) {
        log.warn("[Narrative] Rejected input. component={} reason={}", e.getComponent(), e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponseDTO.of("invalid_input", e.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, ServerWebInputException.class})
    public ResponseEntity<ErrorResponseDTO> handleBadRequest(Exception e) {
        log.warn("[Narrative] Bad request. reason={}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponseDTO.of("bad_request", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDTO> handleUnexpected(Exception e) {
        log.error("[Narrative] Narrative generation failed.", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponseDTO.of("internal_error", "narrative generation failed"));
    }
}
