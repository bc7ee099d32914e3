package com.rockdeals.pos.presentation.sale;

import com.rockdeals.pos.application.sale.SaleQueryService;
import com.rockdeals.pos.application.sale.SaleRefundService;
import com.rockdeals.pos.domain.sale.SaleSearchCondition;
import com.rockdeals.pos.domain.sale.SaleStatus;
import com.rockdeals.pos.presentation.sale.request.RefundRequest;
import com.rockdeals.pos.presentation.sale.response.ReceiptResponse;
import com.rockdeals.pos.presentation.sale.response.RefundResponse;
import com.rockdeals.pos.presentation.sale.response.SaleListResponse;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

/**
 * SaleController - 판매 조회/환불 API
 */
@RestController
@RequestMapping("/sales")
public class SaleController {

    private final SaleQueryService saleQueryService;
    private final SaleRefundService saleRefundService;

    public SaleController(SaleQueryService saleQueryService, SaleRefundService saleRefundService) {
        this.saleQueryService = saleQueryService;
        this.saleRefundService = saleRefundService;
    }

    /**
     * GET /sales?status=&from=&to=&page=&size= - 판매 목록 (최신순)
     */
    @GetMapping
    public ResponseEntity<SaleListResponse> listSales(
            @RequestParam(value = "status", required = false) SaleStatus status,
            @RequestParam(value = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(value = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "size", required = false) Integer size) {
        SaleSearchCondition condition = SaleSearchCondition.of(status, from, to, page, size);
        return ResponseEntity.ok(SaleListResponse.from(saleQueryService.listSales(condition)));
    }

    /**
     * GET /sales/{sale_id}/receipt - 영수증 조회 (재출력용)
     */
    @GetMapping("/{sale_id}/receipt")
    public ResponseEntity<ReceiptResponse> getReceipt(@PathVariable("sale_id") Long saleId) {
        return ResponseEntity.ok(ReceiptResponse.from(saleQueryService.getReceipt(saleId)));
    }

    /**
     * POST /sales/{sale_id}/refund - 판매 전체 환불, 재고 복구
     */
    @PostMapping("/{sale_id}/refund")
    public ResponseEntity<RefundResponse> refundSale(@PathVariable("sale_id") Long saleId,
                                                     @RequestBody(required = false) RefundRequest request) {
        String reason = request == null ? null : request.getReason();
        return ResponseEntity.ok(RefundResponse.from(saleRefundService.refundSale(saleId, reason)));
    }
}
