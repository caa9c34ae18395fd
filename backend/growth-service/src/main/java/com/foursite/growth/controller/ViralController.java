package com.foursite.growth.controller;

import com.foursite.growth.dto.*;
import com.foursite.growth.service.IngestionService;
import com.foursite.growth.service.ReconciliationService;
import com.foursite.growth.service.ScoreService;
import com.foursite.growth.service.ShowcaseRanker;
import com.foursite.growth.service.ShowcaseService;
import com.foursite.growth.service.SiteService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for sites, shares, viral scores and the showcase
 */
@RestController
@RequestMapping("/api/growth")
@RequiredArgsConstructor
@Tag(name = "Viral", description = "Share tracking, viral score and showcase APIs")
public class ViralController {

    private final SiteService siteService;
    private final IngestionService ingestionService;
    private final ScoreService scoreService;
    private final ShowcaseService showcaseService;
    private final ShowcaseRanker showcaseRanker;
    private final ReconciliationService reconciliationService;

    // ==================== Sites ====================

    @PostMapping("/sites")
    @Operation(summary = "Register a site", description = "Register a generated site for its owner; repeat calls return the site unchanged")
    public ResponseEntity<ApiResponse<SiteStatsDto>> registerSite(@Valid @RequestBody RegisterSiteRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(siteService.registerSite(request)));
    }

    @GetMapping("/sites/{siteId}")
    @Operation(summary = "Get site stats", description = "Share counters, boost level and featuring state of a site")
    public ResponseEntity<ApiResponse<SiteStatsDto>> getSite(@PathVariable String siteId) {
        return ResponseEntity.ok(ApiResponse.ok(siteService.getSiteStats(siteId)));
    }

    @PostMapping("/sites/{siteId}/retire")
    @Operation(summary = "Retire a site", description = "Soft-retire a site; it keeps its history and leaves the showcase")
    public ResponseEntity<ApiResponse<SiteStatsDto>> retireSite(@PathVariable String siteId) {
        return ResponseEntity.ok(ApiResponse.ok(siteService.retireSite(siteId)));
    }

    @PostMapping("/sites/{siteId}/pageviews")
    @Operation(summary = "Record pageviews", description = "Add pageviews to a site")
    public ResponseEntity<ApiResponse<Long>> recordPageviews(@PathVariable String siteId,
                                                             @Valid @RequestBody PageviewRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(siteService.recordPageview(siteId, request.getCount())));
    }

    @GetMapping("/sites/{siteId}/score")
    @Operation(summary = "Get viral score", description = "Live viral score of a site")
    public ResponseEntity<ApiResponse<ScoreDto>> getScore(@PathVariable String siteId) {
        return ResponseEntity.ok(ApiResponse.ok(scoreService.getScore(siteId)));
    }

    @GetMapping("/sites/{siteId}/featuring")
    @Operation(summary = "Get featuring history", description = "Auto-featuring windows granted to a site")
    public ResponseEntity<ApiResponse<List<FeaturingEventDto>>> getFeaturing(@PathVariable String siteId) {
        return ResponseEntity.ok(ApiResponse.ok(siteService.getFeaturingHistory(siteId)));
    }

    // ==================== Shares ====================

    @PostMapping("/shares")
    @Operation(summary = "Record a share", description = "Record an external share; a repeated idempotency key is accepted once")
    public ResponseEntity<ApiResponse<ShareResultDto>> recordShare(@Valid @RequestBody RecordShareRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(ingestionService.recordShare(request)));
    }

    // ==================== Showcase ====================

    @GetMapping("/showcase")
    @Operation(summary = "Get showcase", description = "A page of the latest published showcase ranking")
    public ResponseEntity<ApiResponse<List<ShowcaseEntryDto>>> getShowcase(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        return ResponseEntity.ok(ApiResponse.ok(showcaseService.getShowcase(limit, offset)));
    }

    // ==================== Internal ====================

    @PostMapping("/internal/showcase/refresh")
    @Operation(summary = "Re-rank showcase (internal)", description = "Run the showcase ranking now")
    public ResponseEntity<ApiResponse<ShowcaseRefreshDto>> refreshShowcase() {
        return ResponseEntity.ok(ApiResponse.ok(showcaseRanker.refresh()));
    }

    @PostMapping("/internal/reconcile")
    @Operation(summary = "Reconcile (internal)", description = "Heal missed featuring triggers and milestones, expire pro grants")
    public ResponseEntity<ApiResponse<ReconciliationReportDto>> reconcile() {
        return ResponseEntity.ok(ApiResponse.ok(reconciliationService.runAll()));
    }
}
