package org.dongguk.discrecovery.controller;

import lombok.RequiredArgsConstructor;
import org.dongguk.discrecovery.core.annotation.UserId;
import org.dongguk.discrecovery.dto.response.QrCodeDto;
import org.dongguk.discrecovery.dto.response.QrLookupDto;
import org.dongguk.discrecovery.service.QrCodeService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/qr-codes")
public class QrCodeController {
    private final QrCodeService qrCodeService;

    /**
     * QR 공개 조회 (로그인 없이 가능)
     */
    @GetMapping("/{code}/lookup")
    public ResponseEntity<QrLookupDto> lookup(
            @UserId(required = false) Long userId,
            @PathVariable String code
    ) {
        return ResponseEntity.ok(qrCodeService.lookup(code, userId));
    }

    /**
     * QR 할당받기
     */
    @PostMapping("/{code}/assign")
    public ResponseEntity<QrCodeDto> assign(
            @UserId Long userId,
            @PathVariable String code
    ) {
        return ResponseEntity.ok(qrCodeService.assign(code, userId));
    }
}
