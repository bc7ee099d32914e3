package com.rockdeals.pos.presentation.pos.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 바코드 스캔 담기 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanBarcodeRequest {
    private String barcode;
}
