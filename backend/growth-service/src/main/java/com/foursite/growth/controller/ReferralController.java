package com.foursite.growth.controller;

import com.foursite.growth.dto.*;
import com.foursite.growth.service.CommissionService;
import com.foursite.growth.service.MemberService;
import com.foursite.growth.service.MilestoneService;
import com.foursite.growth.service.PayoutService;
import com.foursite.growth.service.ReferralService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for referrals, commissions, payouts and milestones
 */
@RestController
@RequestMapping("/api/growth")
@RequiredArgsConstructor
@Tag(name = "Referral", description = "Referral program, commission and milestone APIs")
public class ReferralController {

    private final ReferralService referralService;
    private final CommissionService commissionService;
    private final PayoutService payoutService;
    private final MilestoneService milestoneService;
    private final MemberService memberService;

    // ==================== Referrals ====================

    @PostMapping("/referrals/conversions")
    @Operation(summary = "Record a conversion", description = "Record that a referee converted through a referrer")
    public ResponseEntity<ApiResponse<ReferralDto>> recordConversion(@Valid @RequestBody RecordConversionRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(referralService.recordConversion(request)));
    }

    @PostMapping("/referrals/{referralId}/suspend")
    @Operation(summary = "Suspend a referral", description = "Move an active referral to pending")
    public ResponseEntity<ApiResponse<ReferralDto>> suspend(@PathVariable UUID referralId) {
        return ResponseEntity.ok(ApiResponse.ok(referralService.suspend(referralId)));
    }

    @PostMapping("/referrals/{referralId}/reinstate")
    @Operation(summary = "Reinstate a referral", description = "Move a pending referral back to active")
    public ResponseEntity<ApiResponse<ReferralDto>> reinstate(@PathVariable UUID referralId) {
        return ResponseEntity.ok(ApiResponse.ok(referralService.reinstate(referralId)));
    }

    @PostMapping("/referrals/{referralId}/churn")
    @Operation(summary = "Churn a referral", description = "End a referral permanently")
    public ResponseEntity<ApiResponse<ReferralDto>> churn(@PathVariable UUID referralId) {
        return ResponseEntity.ok(ApiResponse.ok(referralService.churn(referralId)));
    }

    @GetMapping("/members/{userId}/referrals")
    @Operation(summary = "Get referrals list", description = "Referrals of a member with their current commission rate")
    public ResponseEntity<ApiResponse<List<ReferralDto>>> getReferrals(@PathVariable String userId) {
        return ResponseEntity.ok(ApiResponse.ok(referralService.getReferrals(userId)));
    }

    // ==================== Members ====================

    @GetMapping("/members/{userId}")
    @Operation(summary = "Get member", description = "Subscription tier of a member")
    public ResponseEntity<ApiResponse<MemberDto>> getMember(@PathVariable String userId) {
        return ResponseEntity.ok(ApiResponse.ok(memberService.getMember(userId)));
    }

    @PutMapping("/members/{userId}/tier")
    @Operation(summary = "Update member tier", description = "Apply the tier reported by billing and propagate it to the member's sites")
    public ResponseEntity<ApiResponse<MemberDto>> updateTier(@PathVariable String userId,
                                                             @Valid @RequestBody UpdateTierRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(memberService.updateTier(userId, request.getTier())));
    }

    // ==================== Commission ====================

    @GetMapping("/members/{userId}/commission")
    @Operation(summary = "Get commission summary", description = "Earned, paid and pending commission of a referrer")
    public ResponseEntity<ApiResponse<CommissionSummaryDto>> getCommissionSummary(@PathVariable String userId) {
        return ResponseEntity.ok(ApiResponse.ok(commissionService.getSummary(userId)));
    }

    @GetMapping("/members/{userId}/commission/entries")
    @Operation(summary = "Get commission entries", description = "Commission ledger of a referrer, newest first")
    public ResponseEntity<ApiResponse<List<LedgerEntryDto>>> getCommissionEntries(@PathVariable String userId) {
        return ResponseEntity.ok(ApiResponse.ok(commissionService.getEntries(userId)));
    }

    @PostMapping("/internal/commission/settlements")
    @Operation(summary = "Settle a period (internal)", description = "Accrue commission for one billing period of a referral")
    public ResponseEntity<ApiResponse<LedgerEntryDto>> settlePeriod(@Valid @RequestBody SettlePeriodRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(commissionService.settlePeriod(
                request.getReferralEdgeId(), request.getPeriod(), request.getRevenue())));
    }

    @PostMapping("/internal/commission/entries/{entryId}/reverse")
    @Operation(summary = "Reverse an entry (internal)", description = "Offset an accrual, e.g. after a refund")
    public ResponseEntity<ApiResponse<LedgerEntryDto>> reverseEntry(@PathVariable UUID entryId,
                                                                    @Valid @RequestBody ReasonRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(commissionService.reverseEntry(entryId, request.getReason())));
    }

    // ==================== Payouts ====================

    @PostMapping("/members/{userId}/payouts")
    @Operation(summary = "Request payout", description = "Claim all pending commission into a payout")
    public ResponseEntity<ApiResponse<PayoutDto>> requestPayout(@PathVariable String userId) {
        return ResponseEntity.ok(ApiResponse.ok(payoutService.requestPayout(userId)));
    }

    @GetMapping("/members/{userId}/payouts")
    @Operation(summary = "Get payout history", description = "Commission payout history for a referrer")
    public ResponseEntity<ApiResponse<List<PayoutDto>>> getPayouts(@PathVariable String userId) {
        return ResponseEntity.ok(ApiResponse.ok(payoutService.getPayouts(userId)));
    }

    @PostMapping("/internal/payouts/{payoutId}/processing")
    @Operation(summary = "Mark payout processing (internal)")
    public ResponseEntity<ApiResponse<PayoutDto>> markProcessing(@PathVariable UUID payoutId) {
        return ResponseEntity.ok(ApiResponse.ok(payoutService.markProcessing(payoutId)));
    }

    @PostMapping("/internal/payouts/{payoutId}/complete")
    @Operation(summary = "Complete payout (internal)")
    public ResponseEntity<ApiResponse<PayoutDto>> completePayout(@PathVariable UUID payoutId,
                                                                 @Valid @RequestBody CompletePayoutRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(payoutService.completePayout(payoutId, request.getExternalReference())));
    }

    @PostMapping("/internal/payouts/{payoutId}/fail")
    @Operation(summary = "Fail payout (internal)", description = "Mark a payout failed and release its entries")
    public ResponseEntity<ApiResponse<PayoutDto>> failPayout(@PathVariable UUID payoutId,
                                                             @Valid @RequestBody ReasonRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(payoutService.failPayout(payoutId, request.getReason())));
    }

    // ==================== Milestones ====================

    @GetMapping("/members/{userId}/milestones")
    @Operation(summary = "Get milestone status", description = "Milestones granted to a member")
    public ResponseEntity<ApiResponse<List<MilestoneRecordDto>>> getMilestones(@PathVariable String userId) {
        return ResponseEntity.ok(ApiResponse.ok(milestoneService.getMilestoneStatus(userId)));
    }

    @GetMapping("/members/{userId}/milestones/progress")
    @Operation(summary = "Get milestone progress", description = "Progress towards each configured milestone")
    public ResponseEntity<ApiResponse<List<MilestoneProgressDto>>> getMilestoneProgress(@PathVariable String userId) {
        return ResponseEntity.ok(ApiResponse.ok(milestoneService.getProgress(userId)));
    }
}
