package com.tsvolume.api;

import com.tsvolume.model.QueryRequest;
import com.tsvolume.service.TimeseriesService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.util.Map;

/**
 * Query and stats endpoints at the server root, as polled by external clients.
 *
 * POST / streams the result rows straight from the query cursor; GET /stats
 * returns the per-volume free space document.
 */
@RestController
public class QueryController {

    private static final Logger logger = LoggerFactory.getLogger(QueryController.class);

    @Autowired
    private TimeseriesService timeseriesService;

    @PostMapping("/")
    public ResponseEntity<StreamingResponseBody> query(@RequestBody QueryRequest request) {
        logger.debug("Streaming query {}", request);
        StreamingResponseBody body = out -> timeseriesService.streamQuery(request, out);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(request.getFormat().getContentType()))
                .body(body);
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        return ResponseEntity.ok(timeseriesService.getStats());
    }
}
