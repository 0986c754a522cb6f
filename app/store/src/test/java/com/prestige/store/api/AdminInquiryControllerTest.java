package com.prestige.store.api;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.prestige.store.api.request.SellSubmissionUpdateRequest;
import com.prestige.store.api.response.PagedRowsResponse;
import com.prestige.store.data.Row;
import com.prestige.store.service.InquiryService;
import com.prestige.store.service.PageWindow;
import com.prestige.store.service.ResourceNotFoundException;
import com.prestige.store.service.SellSubmissionService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AdminInquiryController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class AdminInquiryControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private InquiryService inquiryService;
  @MockitoBean private SellSubmissionService sellSubmissionService;

  @Test
  void listUsesPagingParameters() throws Exception {
    when(inquiryService.list("pending", new PageWindow(10, 20)))
        .thenReturn(
            new PagedRowsResponse(
                List.of(new Row().put("id", 5L).put("watch_brand", "Omega")),
                PagedRowsResponse.Pagination.of(21, 10, 20, 1)));

    mockMvc
        .perform(
            get("/api/admin/inquiries")
                .param("status", "pending")
                .param("limit", "10")
                .param("offset", "20"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data[0].watch_brand").value("Omega"))
        .andExpect(jsonPath("$.pagination.total").value(21))
        .andExpect(jsonPath("$.pagination.has_more").value(false));
  }

  @Test
  void limitOutOfRangeReturns400() throws Exception {
    mockMvc
        .perform(get("/api/admin/sell-submissions").param("limit", "500"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("limit must be between 1 and 100"));
  }

  @Test
  void deleteMissingInquiryReturns404() throws Exception {
    doThrow(new ResourceNotFoundException("inquiry not found")).when(inquiryService).delete(4L);

    mockMvc
        .perform(delete("/api/admin/inquiries/4"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.message").value("inquiry not found"));
  }

  @Test
  void deleteReturnsMessage() throws Exception {
    mockMvc
        .perform(delete("/api/admin/inquiries/4"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("inquiry deleted"));
    verify(inquiryService).delete(4L);
  }

  @Test
  void quoteUpdateIsForwarded() throws Exception {
    final SellSubmissionUpdateRequest request =
        new SellSubmissionUpdateRequest("quoted", 9800L, "Clean example");
    when(sellSubmissionService.update(eq(3L), eq(request)))
        .thenReturn(new Row().put("id", 3L).put("status", "quoted").put("estimated_value", 9800L));

    mockMvc
        .perform(
            put("/api/admin/sell-submissions/3")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"status":"quoted","estimated_value":9800,"notes":"Clean example"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.estimated_value").value(9800));
  }

  @Test
  void negativeEstimateReturns400() throws Exception {
    mockMvc
        .perform(
            put("/api/admin/sell-submissions/3")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"estimated_value\":-1}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("estimated_value must not be negative"));
  }
}
