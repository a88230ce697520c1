package com.httpcache.controller;

import com.httpcache.model.RangeField;
import com.httpcache.model.dto.CacheEntrySummary;
import com.httpcache.model.dto.CacheStatistics;
import com.httpcache.service.CacheAdminService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cache management controller.
 * Statistics and clearing work on every backend; entry queries need the indexed one.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final CacheAdminService adminService;

    public CacheController(CacheAdminService adminService) {
        this.adminService = adminService;
    }

    @GetMapping("/stats")
    public ResponseEntity<CacheStatistics> getStats() {
        return ResponseEntity.ok(adminService.getStatistics());
    }

    /**
     * List entries, optionally only those stored for one URL.
     *
     * @param url response URL to match exactly (optional)
     */
    @GetMapping("/entries")
    public ResponseEntity<?> getEntries(@RequestParam(required = false) String url) {
        log.info("Admin: Listing cache entries, url={}", url);
        return orNotImplemented(adminService.getEntries(url));
    }

    /**
     * Entries whose age or time-to-live, in seconds, lies within [low, high].
     *
     * @param field age or time_to_live
     */
    @GetMapping("/entries/range")
    public ResponseEntity<?> getEntriesInRange(@RequestParam String field,
                                               @RequestParam long low,
                                               @RequestParam long high) {
        RangeField rangeField;
        try {
            rangeField = RangeField.parse(field);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "Unknown range field: " + field));
        }
        log.info("Admin: Range query {} in [{}, {}]", rangeField, low, high);
        return orNotImplemented(adminService.getEntriesInRange(rangeField, low, high));
    }

    @GetMapping("/entries/stale")
    public ResponseEntity<?> getStaleEntries() {
        return orNotImplemented(adminService.getStaleEntries());
    }

    @GetMapping("/entries/search")
    public ResponseEntity<?> searchEntries(@RequestParam("q") String text) {
        log.info("Admin: Searching cache entries for '{}'", text);
        return orNotImplemented(adminService.searchEntries(text));
    }

    @DeleteMapping("/entries")
    public Mono<ResponseEntity<Void>> deleteEntry(@RequestParam String key) {
        log.info("Admin: Deleting cache entry key={}", key);
        return adminService.deleteEntry(key)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @PostMapping("/clear")
    public ResponseEntity<Map<String, String>> clearCache() {
        log.warn("Admin: Clearing ALL cache entries");
        adminService.clearCache();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Cache cleared"
        ));
    }

    private static ResponseEntity<?> orNotImplemented(Optional<List<CacheEntrySummary>> entries) {
        if (entries.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_IMPLEMENTED)
                    .body(Map.of("error", "Entry queries require the indexed storage backend"));
        }
        return ResponseEntity.ok(entries.get());
    }
}
