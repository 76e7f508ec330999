package com.photobooth.booking.api.controller;

import com.photobooth.booking.pricing.PackageQuote;
import com.photobooth.booking.pricing.PriceBreakdown;
import com.photobooth.booking.pricing.PricingService;
import com.photobooth.common.dto.BaseResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/pricing")
@RequiredArgsConstructor
public class PricingController {

    private final PricingService pricingService;

    @PostMapping("/quote")
    public ResponseEntity<BaseResponse<PriceBreakdown>> quote(@RequestBody PackageQuote quote) {
        return ResponseEntity.ok(BaseResponse.success(pricingService.computeBreakdown(quote)));
    }
}
