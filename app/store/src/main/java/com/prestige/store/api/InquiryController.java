package com.prestige.store.api;

import com.prestige.store.api.request.InquiryCreateRequest;
import com.prestige.store.api.request.SellSubmissionCreateRequest;
import com.prestige.store.data.Row;
import com.prestige.store.service.InquiryService;
import com.prestige.store.service.SellSubmissionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** 顧客からの問い合わせと買取申込の受付窓口。 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class InquiryController {

  private final InquiryService inquiryService;
  private final SellSubmissionService sellSubmissionService;

  @PostMapping("/inquiries")
  public ResponseEntity<Row> createInquiry(@Valid @RequestBody InquiryCreateRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED).body(inquiryService.create(request));
  }

  @PostMapping("/sell")
  public ResponseEntity<Row> createSellSubmission(
      @Valid @RequestBody SellSubmissionCreateRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED).body(sellSubmissionService.create(request));
  }
}
