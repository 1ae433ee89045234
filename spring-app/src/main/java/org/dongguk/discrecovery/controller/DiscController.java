package org.dongguk.discrecovery.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.dongguk.discrecovery.core.annotation.UserId;
import org.dongguk.discrecovery.dto.request.LinkQrCodeRequest;
import org.dongguk.discrecovery.dto.response.DiscDto;
import org.dongguk.discrecovery.service.ClaimService;
import org.dongguk.discrecovery.service.OwnershipTransferService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/discs")
public class DiscController {
    private final ClaimService claimService;
    private final OwnershipTransferService ownershipTransferService;

    /**
     * 주인 없는 디스크 클레임
     */
    @PostMapping("/{discId}/claim")
    public ResponseEntity<DiscDto> claim(
            @UserId Long userId,
            @PathVariable Long discId
    ) {
        return ResponseEntity.ok(claimService.claim(discId, userId));
    }

    /**
     * QR 연결 해제 (QR 삭제)
     */
    @PostMapping("/{discId}/qr-code/unlink")
    public ResponseEntity<DiscDto> unlinkQrCode(
            @UserId Long userId,
            @PathVariable Long discId
    ) {
        return ResponseEntity.ok(ownershipTransferService.unlinkQrCode(discId, userId));
    }

    /**
     * 할당받은 QR 을 디스크에 연결
     */
    @PostMapping("/{discId}/qr-code/link")
    public ResponseEntity<DiscDto> linkQrCode(
            @UserId Long userId,
            @PathVariable Long discId,
            @Valid @RequestBody LinkQrCodeRequest request
    ) {
        return ResponseEntity.ok(ownershipTransferService.linkQrCode(discId, userId, request.qrCode()));
    }
}
