package com.prestige.store.api;

import com.prestige.store.api.request.InquiryUpdateRequest;
import com.prestige.store.api.request.SellSubmissionUpdateRequest;
import com.prestige.store.api.response.MessageResponse;
import com.prestige.store.api.response.PagedRowsResponse;
import com.prestige.store.data.Row;
import com.prestige.store.model.InquiryStats;
import com.prestige.store.service.InquiryService;
import com.prestige.store.service.PageWindow;
import com.prestige.store.service.SellSubmissionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminInquiryController {

  private final InquiryService inquiryService;
  private final SellSubmissionService sellSubmissionService;

  @GetMapping("/inquiries")
  public ResponseEntity<PagedRowsResponse> listInquiries(
      @RequestParam(name = "status", required = false) String status,
      @RequestParam(name = "limit", required = false) Integer limit,
      @RequestParam(name = "offset", required = false) Integer offset) {
    return ResponseEntity.ok(inquiryService.list(status, PageWindow.of(limit, offset)));
  }

  @PutMapping("/inquiries/{id}")
  public ResponseEntity<Row> updateInquiry(
      @PathVariable("id") long id, @Valid @RequestBody InquiryUpdateRequest request) {
    return ResponseEntity.ok(inquiryService.update(id, request));
  }

  @DeleteMapping("/inquiries/{id}")
  public ResponseEntity<MessageResponse> deleteInquiry(@PathVariable("id") long id) {
    inquiryService.delete(id);
    return ResponseEntity.ok(new MessageResponse("inquiry deleted"));
  }

  @GetMapping("/inquiry-stats")
  public ResponseEntity<InquiryStats> inquiryStats() {
    return ResponseEntity.ok(inquiryService.stats());
  }

  @GetMapping("/sell-submissions")
  public ResponseEntity<PagedRowsResponse> listSellSubmissions(
      @RequestParam(name = "status", required = false) String status,
      @RequestParam(name = "limit", required = false) Integer limit,
      @RequestParam(name = "offset", required = false) Integer offset) {
    return ResponseEntity.ok(sellSubmissionService.list(status, PageWindow.of(limit, offset)));
  }

  @PutMapping("/sell-submissions/{id}")
  public ResponseEntity<Row> updateSellSubmission(
      @PathVariable("id") long id, @Valid @RequestBody SellSubmissionUpdateRequest request) {
    return ResponseEntity.ok(sellSubmissionService.update(id, request));
  }
}
